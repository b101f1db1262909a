package com.tenor.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.tenor.debug.Debug;
import com.tenor.interchange.Contract;
import com.tenor.interchange.Predicate;

/**
 * Stratified rule evaluation. Strata run in ascending order; a stratum sees
 * only verdicts of lower strata, and its own verdicts join the context once
 * every rule of the stratum has been evaluated. Within a stratum rules run in
 * bundle order, so the result is a pure function of (contract, facts).
 */
public final class RuleEngine {

    private static final String TAG = "tenor.eval";

    private RuleEngine() {}

    public static VerdictSet evaluate(Contract contract, FactSet facts) {
        Map<Integer, List<Contract.Rule>> strata = new TreeMap<>();
        for (Contract.Rule r : contract.rules()) {
            strata.computeIfAbsent(r.stratum, k -> new ArrayList<>()).add(r);
        }

        VerdictSet verdicts = new VerdictSet();
        for (Map.Entry<Integer, List<Contract.Rule>> e : strata.entrySet()) {
            List<VerdictInstance> produced = new ArrayList<>();
            for (Contract.Rule rule : e.getValue()) {
                VerdictInstance v = fire(rule, facts, verdicts);
                if (v != null) produced.add(v);
            }
            for (VerdictInstance v : produced) verdicts.add(v);
            Debug.get().d(TAG, "stratum " + e.getKey() + ": " + produced.size() + "/" + e.getValue().size() + " rules fired");
        }
        return verdicts;
    }

    private static VerdictInstance fire(Contract.Rule rule, FactSet facts, VerdictSet verdicts) {
        ProvenanceCollector collector = new ProvenanceCollector();
        PredicateEvaluator eval = new PredicateEvaluator(facts, verdicts, collector);
        if (!eval.test(rule.condition)) return null;

        Contract.Produce produce = rule.produce;
        Value payload;
        if (produce.isMul()) {
            payload = eval.eval(new Predicate.Mul(new Predicate.FactRef(produce.mulFactRef), produce.mulLiteral, produce.mulResultType));
        } else {
            payload = Values.parseLiteral(produce.literal, produce.payloadType);
        }
        Debug.get().t(TAG, "rule '" + rule.id + "' produced " + produce.verdictType + " = " + payload);
        return new VerdictInstance(produce.verdictType, payload, collector.toProvenance(rule.id, rule.stratum));
    }
}
