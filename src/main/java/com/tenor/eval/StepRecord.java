package com.tenor.eval;

import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One executed step. {@code stepType} is one of operation, branch, handoff,
 * sub_flow, parallel, compensation, escalation.
 */
public final class StepRecord {

    public final String stepId;
    public final String stepType;
    public final String result;
    public final Map<String, String> instanceBindings;

    StepRecord(String stepId, String stepType, String result, Map<String, String> instanceBindings) {
        this.stepId = stepId;
        this.stepType = stepType;
        this.result = result;
        this.instanceBindings = Map.copyOf(instanceBindings);
    }

    public ObjectNode toJson() {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("step_id", stepId);
        o.put("step_type", stepType);
        o.put("result", result);
        ObjectNode b = o.putObject("instance_bindings");
        for (Map.Entry<String, String> e : new TreeMap<>(instanceBindings).entrySet()) b.put(e.getKey(), e.getValue());
        return o;
    }

    @Override
    public String toString() {
        return stepId + "[" + stepType + "]=" + result;
    }
}
