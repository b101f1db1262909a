package com.tenor.eval;

import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** What a flow did, or in simulation what it would do. */
public final class FlowResult {

    public final String flowId;
    public final String outcome;
    public final List<StepRecord> stepsExecuted;
    public final List<EffectRecord> entityStateChanges;
    public final String initiatingPersona;
    /** States after the flow, as a new map. */
    public final EntityStateMap entityStates;

    FlowResult(String flowId, String outcome, List<StepRecord> stepsExecuted, List<EffectRecord> entityStateChanges,
               String initiatingPersona, EntityStateMap entityStates) {
        this.flowId = flowId;
        this.outcome = outcome;
        this.stepsExecuted = List.copyOf(stepsExecuted);
        this.entityStateChanges = List.copyOf(entityStateChanges);
        this.initiatingPersona = initiatingPersona;
        this.entityStates = entityStates;
    }

    public StepRecord step(String stepId) {
        for (StepRecord r : stepsExecuted) {
            if (r.stepId.equals(stepId)) return r;
        }
        return null;
    }

    public ObjectNode toJson() {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("flow_id", flowId);
        o.put("outcome", outcome);
        o.put("initiating_persona", initiatingPersona);
        ArrayNode steps = o.putArray("steps_executed");
        for (StepRecord r : stepsExecuted) steps.add(r.toJson());
        ArrayNode changes = o.putArray("entity_state_changes");
        for (EffectRecord e : entityStateChanges) changes.add(e.toJson());
        o.set("entity_states", entityStates.toJson());
        return o;
    }
}
