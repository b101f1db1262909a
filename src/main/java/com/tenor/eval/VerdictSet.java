package com.tenor.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Verdicts in production order (stratum, then rule order within the stratum). */
public final class VerdictSet {

    private final List<VerdictInstance> verdicts = new ArrayList<>();

    VerdictSet() {}

    /** At most one verdict per type. */
    void add(VerdictInstance v) {
        VerdictInstance existing = get(v.verdictType);
        if (existing != null) {
            throw EvalException.invariant("verdict type '" + v.verdictType + "' produced by both rule '"
                    + existing.provenance.ruleId + "' and rule '" + v.provenance.ruleId + "'");
        }
        verdicts.add(v);
    }

    public List<VerdictInstance> all() {
        return Collections.unmodifiableList(verdicts);
    }

    public int size() {
        return verdicts.size();
    }

    public boolean has(String verdictType) {
        for (VerdictInstance v : verdicts) {
            if (v.verdictType.equals(verdictType)) return true;
        }
        return false;
    }

    /** The verdict of the type, or null. */
    public VerdictInstance get(String verdictType) {
        for (int i = verdicts.size() - 1; i >= 0; i--) {
            if (verdicts.get(i).verdictType.equals(verdictType)) return verdicts.get(i);
        }
        return null;
    }

    public ObjectNode toJson() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode root = f.objectNode();
        ArrayNode arr = root.putArray("verdicts");
        for (VerdictInstance v : verdicts) {
            ObjectNode o = arr.addObject();
            o.put("type", v.verdictType);
            o.set("payload", v.payload.toJson());
            ObjectNode p = o.putObject("provenance");
            p.put("rule", v.provenance.ruleId);
            p.put("stratum", v.provenance.stratum);
            ArrayNode facts = p.putArray("facts_used");
            for (String id : v.provenance.factsUsed) facts.add(id);
            ArrayNode used = p.putArray("verdicts_used");
            for (String id : v.provenance.verdictsUsed) used.add(id);
        }
        return root;
    }
}
