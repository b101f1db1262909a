package com.tenor.eval;

import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class OperationResult {

    public final String outcome;
    public final List<EffectRecord> effects;
    public final OperationProvenance provenance;
    /** States after the operation; a new map, the input is never changed. */
    public final EntityStateMap entityStates;

    OperationResult(String outcome, List<EffectRecord> effects, OperationProvenance provenance, EntityStateMap entityStates) {
        this.outcome = outcome;
        this.effects = List.copyOf(effects);
        this.provenance = provenance;
        this.entityStates = entityStates;
    }

    public ObjectNode toJson() {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("outcome", outcome);
        ArrayNode eff = o.putArray("effects");
        for (EffectRecord r : effects) eff.add(r.toJson());
        o.set("provenance", provenance.toJson());
        o.set("entity_states", entityStates.toJson());
        return o;
    }
}
