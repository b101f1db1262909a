package com.tenor.eval;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Owns copies of everything it records so it can outlive the call. */
public final class OperationProvenance {

    public final String operationId;
    public final String persona;
    public final Map<String, String> instanceBindings;
    public final List<EffectRecord> effects;
    public final List<String> factsUsed;
    public final List<String> verdictsUsed;

    public OperationProvenance(String operationId, String persona, Map<String, String> instanceBindings,
                               List<EffectRecord> effects, List<String> factsUsed, List<String> verdictsUsed) {
        this.operationId = operationId;
        this.persona = persona;
        this.instanceBindings = Map.copyOf(new TreeMap<>(instanceBindings));
        this.effects = List.copyOf(effects);
        this.factsUsed = List.copyOf(factsUsed);
        this.verdictsUsed = List.copyOf(verdictsUsed);
    }

    public ObjectNode toJson() {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("operation", operationId);
        o.put("persona", persona);
        ObjectNode b = o.putObject("instance_bindings");
        for (Map.Entry<String, String> e : new TreeMap<>(instanceBindings).entrySet()) b.put(e.getKey(), e.getValue());
        ArrayNode eff = o.putArray("effects");
        for (EffectRecord r : effects) eff.add(r.toJson());
        ArrayNode facts = o.putArray("facts_used");
        for (String f : factsUsed) facts.add(f);
        ArrayNode verdicts = o.putArray("verdicts_used");
        for (String v : verdictsUsed) verdicts.add(v);
        return o;
    }
}
