package com.tenor.elaborate;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.tenor.elaborate.parser.RawConstruct;
import com.tenor.elaborate.parser.RawStep;

/**
 * Parallel branches must touch disjoint entity sets. Effects reached through
 * sub-flows count at any depth; each flow is expanded once per branch.
 */
final class ParallelValidator {

    private ParallelValidator() {}

    static void validate(ConstructIndex index, List<ElabError> errors) {
        for (RawConstruct.Flow flow : index.flows.values()) {
            checkSteps(index, flow, flow.steps, "steps.", errors);
        }
    }

    private static void checkSteps(ConstructIndex index, RawConstruct.Flow flow, Map<String, RawStep.Step> steps,
                                   String prefix, List<ElabError> errors) {
        for (Map.Entry<String, RawStep.Step> e : steps.entrySet()) {
            if (e.getValue().kind() != RawStep.Kind.PARALLEL) continue;
            RawStep.ParallelStep par = (RawStep.ParallelStep) e.getValue();
            String field = prefix + e.getKey() + ".branches";

            List<RawStep.Branch> branches = par.branches;
            Map<String, Map<String, String>> effects = new LinkedHashMap<>();
            for (RawStep.Branch b : branches) {
                Map<String, String> touched = new LinkedHashMap<>();
                collect(index, b.steps, null, new HashSet<>(), touched);
                effects.put(b.id, touched);
                checkSteps(index, flow, b.steps, field + "." + b.id + ".steps.", errors);
            }

            for (int i = 0; i < branches.size(); i++) {
                for (int j = i + 1; j < branches.size(); j++) {
                    String b1 = branches.get(i).id;
                    String b2 = branches.get(j).id;
                    Map<String, String> e1 = effects.get(b1);
                    Map<String, String> e2 = effects.get(b2);
                    for (String entity : new TreeSet<>(e1.keySet())) {
                        if (!e2.containsKey(entity)) continue;
                        String t1 = e1.get(entity);
                        String t2 = e2.get(entity);
                        String msg;
                        if (t1 == null && t2 == null) {
                            msg = "parallel branches '" + b1 + "' and '" + b2 + "' both declare effects on entity '"
                                    + entity + "'; parallel branch entity effect sets must be disjoint";
                        } else {
                            String via = t1 != null ? b1 : b2;
                            String trace = t1 != null ? t1 : t2;
                            msg = "parallel branches '" + b1 + "' and '" + b2 + "' both affect entity '" + entity
                                    + "' (" + via + " transitively through " + trace
                                    + "); parallel branch entity effect sets must be disjoint";
                        }
                        errors.add(new ElabError(5, "Flow", flow.id, field, flow.file, par.branchesLine, msg));
                        break;
                    }
                }
            }
        }
    }

    /** Records entity id to null (direct) or the sub-flow trace that reaches it. */
    private static void collect(ConstructIndex index, Map<String, RawStep.Step> steps, String trace,
                                Set<String> expanded, Map<String, String> out) {
        for (RawStep.Step step : steps.values()) {
            switch (step.kind()) {
                case OPERATION: {
                    String opId = ((RawStep.OperationStep) step).op;
                    RawConstruct.Operation op = index.operations.get(opId);
                    if (op == null) break;
                    for (RawConstruct.Effect effect : op.effects) {
                        out.putIfAbsent(effect.entityId, trace == null ? null : trace + " → " + opId);
                    }
                    break;
                }
                case SUB_FLOW: {
                    String flowId = ((RawStep.SubFlowStep) step).flow;
                    RawConstruct.Flow sub = index.flows.get(flowId);
                    if (sub == null || !expanded.add(flowId)) break;
                    collect(index, sub.steps, (trace == null ? "SubFlowStep" : trace) + " → " + flowId, expanded, out);
                    break;
                }
                case PARALLEL:
                    for (RawStep.Branch b : ((RawStep.ParallelStep) step).branches) {
                        collect(index, b.steps, trace, expanded, out);
                    }
                    break;
                default:
                    break;
            }
        }
    }
}
