package com.tenor.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.tenor.debug.Debug;
import com.tenor.interchange.Contract;

/**
 * Runs a single operation in two passes.
 *
 * Pass one checks the persona, the precondition and, for every effect, that
 * the bound instance exists and sits in the effect's source state. Pass two
 * runs only when pass one found nothing wrong and applies every transition to
 * a copy of the state map. A failure in pass one therefore leaves no effect
 * applied.
 */
public final class OperationExecutor {

    private static final String TAG = "tenor.op";

    private OperationExecutor() {}

    public static OperationResult execute(Contract.Operation op, String persona, FactSet facts, VerdictSet verdicts,
                                          EntityStateMap states, Map<String, String> ambientBindings) {
        if (!op.allowedPersonas.contains(persona)) {
            Debug.get().d(TAG, "'" + op.id + "' rejected persona '" + persona + "'");
            throw OperationException.personaRejected(op.id, persona);
        }

        ProvenanceCollector collector = new ProvenanceCollector();
        boolean met;
        try {
            met = new PredicateEvaluator(facts, verdicts, collector).test(op.precondition);
        } catch (EvalException e) {
            throw OperationException.evaluation(op.id, persona, e);
        }
        if (!met) {
            Debug.get().d(TAG, "'" + op.id + "' precondition false");
            throw OperationException.preconditionFailed(op.id, persona, "precondition evaluated to false");
        }

        Map<String, String> bindings = InstanceBindings.resolve(op, ambientBindings);
        String outcome;
        List<EffectRecord> pending;

        if (op.outcomes.size() > 1 && hasLabels(op)) {
            // first declared outcome whose effects all validate
            OperationException first = null;
            outcome = null;
            pending = null;
            for (String candidate : op.outcomes) {
                List<Contract.Effect> group = new ArrayList<>();
                for (Contract.Effect e : op.effects) {
                    if (candidate.equals(e.outcome)) group.add(e);
                }
                try {
                    pending = validate(op, persona, group, states, bindings);
                    outcome = candidate;
                    break;
                } catch (OperationException e) {
                    if (first == null) first = e;
                }
            }
            if (outcome == null) throw first;
        } else {
            pending = validate(op, persona, op.effects, states, bindings);
            String label = null;
            for (Contract.Effect e : op.effects) {
                if (e.outcome != null) label = e.outcome;
            }
            if (label != null) {
                outcome = label;
            } else if (op.outcomes.size() == 1) {
                outcome = op.outcomes.get(0);
            } else if (op.outcomes.size() > 1) {
                throw OperationException.preconditionFailed(op.id, persona,
                        "multi-outcome operation has no effect-to-outcome mapping");
            } else {
                outcome = "success";
            }
        }

        EntityStateMap after = states.copy();
        for (EffectRecord r : pending) after.set(r.entityId, r.instanceId, r.stateAfter);

        Debug.get().i(TAG, "'" + op.id + "' by '" + persona + "' -> " + outcome + " " + pending);
        OperationProvenance prov = new OperationProvenance(op.id, persona, bindings, pending,
                collector.factsUsed(), collector.verdictsUsed());
        return new OperationResult(outcome, pending, prov, after);
    }

    private static List<EffectRecord> validate(Contract.Operation op, String persona, List<Contract.Effect> effects,
                                               EntityStateMap states, Map<String, String> bindings) {
        List<EffectRecord> out = new ArrayList<>();
        for (Contract.Effect e : effects) {
            String instance = InstanceBindings.instanceFor(bindings, e.entityId);
            String current = states.get(e.entityId, instance);
            if (current == null) throw OperationException.entityNotFound(op.id, persona, e.entityId, instance);
            if (!current.equals(e.from)) {
                throw OperationException.sourceMismatch(op.id, persona, e.entityId, instance, current, e.from);
            }
            out.add(new EffectRecord(e.entityId, instance, current, e.to));
        }
        return out;
    }

    private static boolean hasLabels(Contract.Operation op) {
        for (Contract.Effect e : op.effects) {
            if (e.outcome != null) return true;
        }
        return false;
    }
}
