package com.tenor.eval;

import java.util.ArrayList;
import java.util.List;

/** Records fact and verdict reads during one predicate evaluation, first-read order, no repeats. */
final class ProvenanceCollector {

    private final List<String> facts = new ArrayList<>();
    private final List<String> verdicts = new ArrayList<>();

    void fact(String id) {
        if (!facts.contains(id)) facts.add(id);
    }

    void verdict(String type) {
        if (!verdicts.contains(type)) verdicts.add(type);
    }

    List<String> factsUsed() {
        return List.copyOf(facts);
    }

    List<String> verdictsUsed() {
        return List.copyOf(verdicts);
    }

    VerdictProvenance toProvenance(String ruleId, int stratum) {
        return new VerdictProvenance(ruleId, stratum, facts, verdicts);
    }
}
