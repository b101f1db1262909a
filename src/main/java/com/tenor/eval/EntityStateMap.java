package com.tenor.eval;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.interchange.Contract;

/**
 * Current state of every entity instance, keyed by (entity id, instance id)
 * and iterated in sorted order. Single-instance contracts use
 * {@link InstanceBindings#DEFAULT_INSTANCE_ID}.
 */
public final class EntityStateMap {

    private final TreeMap<String, TreeMap<String, String>> states = new TreeMap<>();

    public EntityStateMap() {}

    /** Every declared entity's default instance in its initial state. */
    public static EntityStateMap initial(Contract contract) {
        EntityStateMap m = new EntityStateMap();
        for (Contract.Entity e : contract.entities().values()) m.set(e.id, InstanceBindings.DEFAULT_INSTANCE_ID, e.initial);
        return m;
    }

    /** {@code entity -> state} pairs, all on the default instance. */
    public static EntityStateMap single(Map<String, String> entityStates) {
        EntityStateMap m = new EntityStateMap();
        for (Map.Entry<String, String> e : entityStates.entrySet()) m.set(e.getKey(), InstanceBindings.DEFAULT_INSTANCE_ID, e.getValue());
        return m;
    }

    /**
     * Accepts {@code {"Order": "pending"}} (default instance) and
     * {@code {"Order": {"ord-1": "pending", "ord-2": "shipped"}}}, mixed freely.
     */
    public static EntityStateMap fromJson(JsonNode json) {
        EntityStateMap m = new EntityStateMap();
        if (json == null || json.isNull()) return m;
        if (!json.isObject()) throw EvalException.deserialize("entity states must be a JSON object");
        Iterator<Map.Entry<String, JsonNode>> it = json.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            if (v.isTextual()) {
                m.set(e.getKey(), InstanceBindings.DEFAULT_INSTANCE_ID, v.asText());
            } else if (v.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> inst = v.fields();
                while (inst.hasNext()) {
                    Map.Entry<String, JsonNode> i = inst.next();
                    if (!i.getValue().isTextual()) {
                        throw EvalException.deserialize("state of " + e.getKey() + "/" + i.getKey() + " must be a string");
                    }
                    m.set(e.getKey(), i.getKey(), i.getValue().asText());
                }
            } else {
                throw EvalException.deserialize("state of entity '" + e.getKey() + "' must be a string or an object");
            }
        }
        return m;
    }

    public EntityStateMap set(String entityId, String instanceId, String state) {
        states.computeIfAbsent(entityId, k -> new TreeMap<>()).put(instanceId, state);
        return this;
    }

    /** State of the instance, or null when it is not tracked. */
    public String get(String entityId, String instanceId) {
        TreeMap<String, String> inst = states.get(entityId);
        return inst == null ? null : inst.get(instanceId);
    }

    public SortedMap<String, String> instances(String entityId) {
        TreeMap<String, String> inst = states.get(entityId);
        return inst == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(inst);
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public EntityStateMap copy() {
        EntityStateMap m = new EntityStateMap();
        for (Map.Entry<String, TreeMap<String, String>> e : states.entrySet()) {
            m.states.put(e.getKey(), new TreeMap<>(e.getValue()));
        }
        return m;
    }

    public ObjectNode toJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, TreeMap<String, String>> e : states.entrySet()) {
            ObjectNode inst = root.putObject(e.getKey());
            for (Map.Entry<String, String> i : e.getValue().entrySet()) inst.put(i.getKey(), i.getValue());
        }
        return root;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EntityStateMap && states.equals(((EntityStateMap) o).states);
    }

    @Override
    public int hashCode() {
        return states.hashCode();
    }

    @Override
    public String toString() {
        return states.toString();
    }
}
