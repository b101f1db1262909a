package com.tenor.elaborate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.tenor.elaborate.parser.RawConstruct;
import com.tenor.elaborate.parser.RawStep;

/**
 * Flow entry and step resolution, mandatory failure handlers, step-graph
 * acyclicity (per flow and per parallel branch), and acyclicity of the
 * sub-flow reference graph across flows.
 */
final class FlowValidator {

    private final ConstructIndex index;
    private final List<ElabError> errors;

    private FlowValidator(ConstructIndex index, List<ElabError> errors) {
        this.index = index;
        this.errors = errors;
    }

    static void validate(ConstructIndex index, List<ElabError> errors) {
        FlowValidator v = new FlowValidator(index, errors);
        for (RawConstruct.Flow flow : index.flows.values()) {
            if (!flow.steps.containsKey(flow.entry)) {
                errors.add(new ElabError(5, "Flow", flow.id, "entry", flow.file, flow.entryLine,
                        "entry step '" + flow.entry + "' is not declared in steps"));
            }
            v.checkSteps(flow, flow.steps, "steps.");
            v.checkAcyclic(flow, flow.steps, "steps");
        }
        v.checkReferenceGraph();
    }

    private void checkSteps(RawConstruct.Flow flow, Map<String, RawStep.Step> steps, String prefix) {
        for (Map.Entry<String, RawStep.Step> e : steps.entrySet()) {
            String sid = e.getKey();
            String field = prefix + sid;
            RawStep.Step step = e.getValue();
            switch (step.kind()) {
                case OPERATION: {
                    RawStep.OperationStep s = (RawStep.OperationStep) step;
                    if (!index.operations.containsKey(s.op)) {
                        error(flow, field + ".op", s.line, "operation '" + s.op + "' is not declared");
                    }
                    for (Map.Entry<String, RawStep.Target> o : s.outcomes.entrySet()) {
                        checkTarget(flow, steps, o.getValue(), field + ".outcomes." + o.getKey());
                    }
                    if (s.onFailure == null) {
                        error(flow, field + ".on_failure", s.line, "OperationStep '" + sid + "' must declare a FailureHandler");
                    } else {
                        checkHandler(flow, steps, s.onFailure, field + ".on_failure");
                    }
                    break;
                }
                case BRANCH: {
                    RawStep.BranchStep s = (RawStep.BranchStep) step;
                    checkTarget(flow, steps, s.ifTrue, field + ".if_true");
                    checkTarget(flow, steps, s.ifFalse, field + ".if_false");
                    break;
                }
                case HANDOFF: {
                    RawStep.HandoffStep s = (RawStep.HandoffStep) step;
                    if (!steps.containsKey(s.next)) {
                        error(flow, field + ".next", s.nextLine, "step reference '" + s.next + "' is not declared in steps");
                    }
                    break;
                }
                case SUB_FLOW: {
                    RawStep.SubFlowStep s = (RawStep.SubFlowStep) step;
                    if (!index.flows.containsKey(s.flow)) {
                        error(flow, field + ".flow", s.flowLine, "sub-flow reference '" + s.flow + "' is not a declared Flow");
                    }
                    checkTarget(flow, steps, s.onSuccess, field + ".on_success");
                    if (s.onFailure == null) {
                        error(flow, field + ".on_failure", s.line, "SubFlowStep '" + sid + "' must declare a FailureHandler");
                    } else {
                        checkHandler(flow, steps, s.onFailure, field + ".on_failure");
                    }
                    break;
                }
                case PARALLEL: {
                    RawStep.ParallelStep s = (RawStep.ParallelStep) step;
                    for (RawStep.Branch b : s.branches) {
                        String bfield = field + ".branches." + b.id;
                        if (!b.steps.containsKey(b.entry)) {
                            error(flow, bfield + ".entry", s.branchesLine,
                                    "branch '" + b.id + "' entry step '" + b.entry + "' is not declared in its steps");
                        }
                        checkSteps(flow, b.steps, bfield + ".steps.");
                        checkAcyclic(flow, b.steps, bfield + ".steps");
                    }
                    checkTarget(flow, steps, s.join.onAllSuccess, field + ".join.on_all_success");
                    checkTarget(flow, steps, s.join.onAllComplete, field + ".join.on_all_complete");
                    if (s.join.onAnyFailure != null) {
                        checkHandler(flow, steps, s.join.onAnyFailure, field + ".join.on_any_failure");
                    }
                    break;
                }
                default:
                    break;
            }
        }
    }

    private void checkTarget(RawConstruct.Flow flow, Map<String, RawStep.Step> steps, RawStep.Target t, String field) {
        if (t == null || t.isTerminal()) return;
        if (!steps.containsKey(t.stepId)) {
            error(flow, field, t.line, "step reference '" + t.stepId + "' is not declared in steps");
        }
    }

    private void checkHandler(RawConstruct.Flow flow, Map<String, RawStep.Step> steps,
                              RawStep.FailureHandler h, String field) {
        switch (h.kind) {
            case ESCALATE:
                if (!steps.containsKey(h.next)) {
                    error(flow, field + ".next", h.line, "step reference '" + h.next + "' is not declared in steps");
                }
                break;
            case COMPENSATE:
                for (RawStep.CompStep c : h.steps) {
                    if (!index.operations.containsKey(c.op)) {
                        error(flow, field + ".steps", h.line, "compensation operation '" + c.op + "' is not declared");
                    }
                }
                break;
            default:
                break;
        }
    }

    private void checkAcyclic(RawConstruct.Flow flow, Map<String, RawStep.Step> steps, String field) {
        CycleDetector graph = new CycleDetector();
        for (String sid : steps.keySet()) graph.node(sid);
        for (Map.Entry<String, RawStep.Step> e : steps.entrySet()) {
            for (String next : successors(e.getValue())) {
                if (steps.containsKey(next)) graph.edge(e.getKey(), next);
            }
        }
        CycleDetector.Cycle cycle = graph.findCycle();
        if (cycle != null) {
            error(flow, field, steps.get(cycle.closing).line,
                    "flow step graph is not acyclic: cycle detected: " + cycle.render());
        }
    }

    /** Step ids reachable in one hop, in declaration order of the step's fields. */
    static List<String> successors(RawStep.Step step) {
        List<String> out = new ArrayList<>();
        switch (step.kind()) {
            case OPERATION: {
                RawStep.OperationStep s = (RawStep.OperationStep) step;
                for (RawStep.Target t : s.outcomes.values()) addTarget(out, t);
                addHandler(out, s.onFailure);
                break;
            }
            case BRANCH: {
                RawStep.BranchStep s = (RawStep.BranchStep) step;
                addTarget(out, s.ifTrue);
                addTarget(out, s.ifFalse);
                break;
            }
            case HANDOFF:
                out.add(((RawStep.HandoffStep) step).next);
                break;
            case SUB_FLOW: {
                RawStep.SubFlowStep s = (RawStep.SubFlowStep) step;
                addTarget(out, s.onSuccess);
                addHandler(out, s.onFailure);
                break;
            }
            case PARALLEL: {
                RawStep.JoinPolicy j = ((RawStep.ParallelStep) step).join;
                addTarget(out, j.onAllSuccess);
                addHandler(out, j.onAnyFailure);
                addTarget(out, j.onAllComplete);
                break;
            }
            default:
                break;
        }
        return out;
    }

    private static void addTarget(List<String> out, RawStep.Target t) {
        if (t != null && !t.isTerminal()) out.add(t.stepId);
    }

    private static void addHandler(List<String> out, RawStep.FailureHandler h) {
        if (h != null && h.kind == RawStep.FailureHandler.Kind.ESCALATE) out.add(h.next);
    }

    // -------------------------
    // Sub-flow reference graph
    // -------------------------

    private void checkReferenceGraph() {
        CycleDetector graph = new CycleDetector();
        for (RawConstruct.Flow flow : index.flows.values()) {
            graph.node(flow.id);
            for (Map.Entry<String, RawStep.SubFlowStep> ref : subFlowSteps(flow.steps)) {
                if (index.flows.containsKey(ref.getValue().flow)) graph.edge(flow.id, ref.getValue().flow);
            }
        }
        CycleDetector.Cycle cycle = graph.findCycle();
        if (cycle == null) return;

        RawConstruct.Flow closing = index.flows.get(cycle.closing);
        String target = cycle.path.get(0);
        for (Map.Entry<String, RawStep.SubFlowStep> ref : subFlowSteps(closing.steps)) {
            if (ref.getValue().flow.equals(target)) {
                error(closing, "steps." + ref.getKey() + ".flow", ref.getValue().flowLine,
                        "flow reference cycle detected: " + cycle.render());
                return;
            }
        }
    }

    /** Sub-flow steps of a step map, including those nested in parallel branches. */
    static List<Map.Entry<String, RawStep.SubFlowStep>> subFlowSteps(Map<String, RawStep.Step> steps) {
        List<Map.Entry<String, RawStep.SubFlowStep>> out = new ArrayList<>();
        for (Map.Entry<String, RawStep.Step> e : steps.entrySet()) {
            if (e.getValue().kind() == RawStep.Kind.SUB_FLOW) {
                out.add(Map.entry(e.getKey(), (RawStep.SubFlowStep) e.getValue()));
            } else if (e.getValue().kind() == RawStep.Kind.PARALLEL) {
                for (RawStep.Branch b : ((RawStep.ParallelStep) e.getValue()).branches) out.addAll(subFlowSteps(b.steps));
            }
        }
        return out;
    }

    private void error(RawConstruct.Flow flow, String field, int line, String message) {
        errors.add(new ElabError(5, "Flow", flow.id, field, flow.file, line, message));
    }
}
