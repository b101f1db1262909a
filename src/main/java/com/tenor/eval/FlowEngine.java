package com.tenor.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.tenor.debug.Debug;
import com.tenor.interchange.Contract;
import com.tenor.interchange.FlowStep;

/**
 * Walks a flow's step graph from its entry to a terminal outcome.
 *
 * Facts and verdicts are frozen when the engine is created and are never
 * recomputed, so state changes made by earlier steps do not alter later
 * branch decisions. Sub-flows share the same snapshot. Entity state is
 * threaded through a private copy; the caller's map is not touched.
 */
final class FlowEngine {

    private static final String TAG = "tenor.flow";

    private final Contract contract;
    private final FactSet facts;
    private final VerdictSet verdicts;
    private final EvalOptions options;

    FlowEngine(Contract contract, FactSet facts, VerdictSet verdicts, EvalOptions options) {
        this.contract = contract;
        this.facts = facts;
        this.verdicts = verdicts;
        this.options = options;
    }

    FlowResult run(Contract.Flow flow, String persona, EntityStateMap states, Map<String, String> bindings) {
        Debug.get().i(TAG, "flow '" + flow.id + "' started by '" + persona + "'");
        Walk w = new Walk(flow.id, states.copy(), bindings, 0);
        String outcome = w.run(flow.steps, flow.entry);
        Debug.get().i(TAG, "flow '" + flow.id + "' ended: " + outcome + " after " + w.records.size() + " steps");
        return new FlowResult(flow.id, outcome, w.records, w.changes, persona, w.states);
    }

    /** Mutable state of one walk over a step graph: a flow, a sub-flow, or a parallel branch. */
    private final class Walk {
        final String flowId;
        final Map<String, String> bindings;
        final int depth;
        EntityStateMap states;
        final List<StepRecord> records = new ArrayList<>();
        final List<EffectRecord> changes = new ArrayList<>();

        Walk(String flowId, EntityStateMap states, Map<String, String> bindings, int depth) {
            this.flowId = flowId;
            this.states = states;
            this.bindings = bindings == null ? Map.of() : bindings;
            this.depth = depth;
        }

        String run(Map<String, FlowStep> steps, String entry) {
            String current = entry;
            int count = 0;
            while (true) {
                if (++count > options.maxFlowSteps()) {
                    throw EvalException.flow(flowId, "exceeded maximum step count (" + options.maxFlowSteps() + ")");
                }
                FlowStep step = steps.get(current);
                if (step == null) throw EvalException.invariant("flow step '" + current + "' not found in flow '" + flowId + "'");

                FlowStep.Target next;
                switch (step.kind()) {
                    case OPERATION:
                        next = operation((FlowStep.OperationStep) step);
                        break;
                    case BRANCH:
                        next = branch((FlowStep.BranchStep) step);
                        break;
                    case HANDOFF: {
                        FlowStep.HandoffStep h = (FlowStep.HandoffStep) step;
                        records.add(new StepRecord(h.id, "handoff", "handoff", bindings));
                        Debug.get().d(TAG, h.id + ": handoff " + h.fromPersona + " -> " + h.toPersona);
                        next = FlowStep.Target.step(h.next);
                        break;
                    }
                    case SUB_FLOW:
                        next = subFlow((FlowStep.SubFlowStep) step);
                        break;
                    case PARALLEL:
                        next = parallel((FlowStep.ParallelStep) step);
                        break;
                    default:
                        throw EvalException.invariant("unknown step kind " + step.kind());
                }
                if (next.isTerminal()) return next.outcome;
                current = next.stepId;
            }
        }

        private FlowStep.Target operation(FlowStep.OperationStep s) {
            Contract.Operation op = requireOperation(s.op);
            Map<String, String> resolved = InstanceBindings.resolve(op, bindings);
            OperationResult result;
            try {
                result = OperationExecutor.execute(op, s.persona, facts, verdicts, states, bindings);
            } catch (OperationException e) {
                records.add(new StepRecord(s.id, "operation", "error: " + e.getMessage(), resolved));
                Debug.get().d(TAG, s.id + ": " + e.getMessage());
                return handleFailure(s.onFailure, s.id);
            }
            states = result.entityStates;
            changes.addAll(result.effects);
            records.add(new StepRecord(s.id, "operation", result.outcome, resolved));

            FlowStep.Target target = s.outcomes.get(result.outcome);
            if (target == null) {
                throw EvalException.flow(flowId, "operation outcome '" + result.outcome + "' not handled in step '" + s.id + "'");
            }
            return target;
        }

        private FlowStep.Target branch(FlowStep.BranchStep s) {
            boolean taken = new PredicateEvaluator(facts, verdicts, new ProvenanceCollector()).test(s.condition);
            records.add(new StepRecord(s.id, "branch", taken ? "true" : "false", bindings));
            return taken ? s.ifTrue : s.ifFalse;
        }

        private FlowStep.Target subFlow(FlowStep.SubFlowStep s) {
            Contract.Flow sub = contract.flow(s.flow);
            if (sub == null) throw EvalException.invariant("sub-flow '" + s.flow + "' not found in contract");
            if (depth + 1 > options.maxSubFlowDepth()) {
                throw EvalException.flow(flowId, "sub-flow nesting exceeded maximum depth (" + options.maxSubFlowDepth() + ")");
            }

            Walk child = new Walk(sub.id, states.copy(), bindings, depth + 1);
            String outcome;
            try {
                outcome = child.run(sub.steps, sub.entry);
            } catch (EvalException e) {
                if (e.kind() == EvalError.INVARIANT) throw e;
                records.add(new StepRecord(s.id, "sub_flow", "error: " + e.getMessage(), bindings));
                records.addAll(child.records);
                return handleFailure(s.onFailure, s.id);
            }
            records.add(new StepRecord(s.id, "sub_flow", outcome, bindings));
            records.addAll(child.records);
            changes.addAll(child.changes);
            states = child.states;
            return s.onSuccess;
        }

        private FlowStep.Target parallel(FlowStep.ParallelStep s) {
            List<Walk> succeeded = new ArrayList<>();
            List<String> summaries = new ArrayList<>();
            List<StepRecord> branchRecords = new ArrayList<>();
            boolean anyFailure = false;

            for (FlowStep.Branch b : s.branches) {
                // every branch starts from the same pre-step state
                Walk child = new Walk(flowId + ":" + b.id, states.copy(), bindings, depth);
                try {
                    String outcome = child.run(b.steps, b.entry);
                    summaries.add(b.id + ":" + outcome);
                    succeeded.add(child);
                } catch (EvalException e) {
                    if (e.kind() == EvalError.INVARIANT) throw e;
                    summaries.add(b.id + ":error:" + e.getMessage());
                    anyFailure = true;
                }
                branchRecords.addAll(child.records);
            }

            records.add(new StepRecord(s.id, "parallel", String.join(", ", summaries), bindings));
            records.addAll(branchRecords);

            // branch effect sets are disjoint, so replaying each branch's changes cannot conflict
            for (Walk child : succeeded) {
                for (EffectRecord r : child.changes) states.set(r.entityId, r.instanceId, r.stateAfter);
                changes.addAll(child.changes);
            }

            FlowStep.JoinPolicy join = s.join;
            if (!anyFailure && join.onAllSuccess != null) return join.onAllSuccess;
            if (anyFailure && join.onAnyFailure != null) return handleFailure(join.onAnyFailure, s.id);
            if (join.onAllComplete != null) return join.onAllComplete;
            throw EvalException.flow(flowId, "parallel step '" + s.id + "' completed but no join policy matched");
        }

        private FlowStep.Target handleFailure(FlowStep.FailureHandler h, String stepId) {
            switch (h.kind) {
                case TERMINATE:
                    return FlowStep.Target.terminal(h.outcome);
                case COMPENSATE:
                    for (FlowStep.CompStep c : h.steps) {
                        Contract.Operation op = requireOperation(c.op);
                        Map<String, String> resolved = InstanceBindings.resolve(op, bindings);
                        try {
                            OperationResult r = OperationExecutor.execute(op, c.persona, facts, verdicts, states, bindings);
                            states = r.entityStates;
                            changes.addAll(r.effects);
                            records.add(new StepRecord("comp:" + c.op, "compensation", r.outcome, resolved));
                        } catch (OperationException e) {
                            records.add(new StepRecord("comp:" + c.op, "compensation", "error: " + e.getMessage(), resolved));
                            return c.onFailure;
                        }
                    }
                    return h.then;
                case ESCALATE:
                    records.add(new StepRecord(stepId, "escalation", "escalated to " + h.toPersona, bindings));
                    return FlowStep.Target.step(h.next);
                default:
                    throw EvalException.invariant("unknown failure handler " + h.kind);
            }
        }

        private Contract.Operation requireOperation(String id) {
            Contract.Operation op = contract.operation(id);
            if (op == null) throw EvalException.invariant("operation '" + id + "' not found in contract");
            return op;
        }
    }
}
