package com.tenor.eval;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** One applied (or, in a simulated flow, would-be) entity transition. */
public final class EffectRecord {

    public final String entityId;
    public final String instanceId;
    public final String stateBefore;
    public final String stateAfter;

    public EffectRecord(String entityId, String instanceId, String stateBefore, String stateAfter) {
        this.entityId = entityId;
        this.instanceId = instanceId;
        this.stateBefore = stateBefore;
        this.stateAfter = stateAfter;
    }

    public ObjectNode toJson() {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("entity_id", entityId);
        o.put("instance_id", instanceId);
        o.put("state_before", stateBefore);
        o.put("state_after", stateAfter);
        return o;
    }

    @Override
    public String toString() {
        return entityId + "/" + instanceId + ": " + stateBefore + " -> " + stateAfter;
    }
}
