package com.tenor.interchange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of a loaded flow. The set of kinds is closed; the flow engine
 * switches over {@link Kind}.
 */
public abstract class FlowStep {

    public enum Kind { OPERATION, BRANCH, HANDOFF, SUB_FLOW, PARALLEL }

    public final String id;

    protected FlowStep(String id) {
        this.id = id;
    }

    public abstract Kind kind();

    /** A next step id, or a terminal outcome. */
    public static final class Target {
        public final String stepId;
        public final String outcome;

        private Target(String stepId, String outcome) {
            this.stepId = stepId;
            this.outcome = outcome;
        }

        public static Target step(String id) { return new Target(id, null); }
        public static Target terminal(String outcome) { return new Target(null, outcome); }

        public boolean isTerminal() { return outcome != null; }
    }

    public static final class CompStep {
        public final String op;
        public final String persona;
        public final Target onFailure;

        public CompStep(String op, String persona, Target onFailure) {
            this.op = op;
            this.persona = persona;
            this.onFailure = onFailure;
        }
    }

    public static final class FailureHandler {
        public enum Kind { TERMINATE, COMPENSATE, ESCALATE }

        public final Kind kind;
        public final String outcome;
        public final List<CompStep> steps;
        public final Target then;
        public final String toPersona;
        public final String next;

        private FailureHandler(Kind kind, String outcome, List<CompStep> steps, Target then, String toPersona, String next) {
            this.kind = kind;
            this.outcome = outcome;
            this.steps = steps == null ? List.of() : List.copyOf(steps);
            this.then = then;
            this.toPersona = toPersona;
            this.next = next;
        }

        public static FailureHandler terminate(String outcome) {
            return new FailureHandler(Kind.TERMINATE, outcome, null, null, null, null);
        }

        public static FailureHandler compensate(List<CompStep> steps, Target then) {
            return new FailureHandler(Kind.COMPENSATE, null, steps, then, null, null);
        }

        public static FailureHandler escalate(String toPersona, String next) {
            return new FailureHandler(Kind.ESCALATE, null, null, null, toPersona, next);
        }
    }

    public static final class OperationStep extends FlowStep {
        public final String op;
        public final String persona;
        public final Map<String, Target> outcomes;
        public final FailureHandler onFailure;

        public OperationStep(String id, String op, String persona, Map<String, Target> outcomes, FailureHandler onFailure) {
            super(id);
            this.op = op;
            this.persona = persona;
            this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
            this.onFailure = onFailure;
        }

        @Override public Kind kind() { return Kind.OPERATION; }
    }

    public static final class BranchStep extends FlowStep {
        public final Predicate condition;
        public final String persona;
        public final Target ifTrue;
        public final Target ifFalse;

        public BranchStep(String id, Predicate condition, String persona, Target ifTrue, Target ifFalse) {
            super(id);
            this.condition = condition;
            this.persona = persona;
            this.ifTrue = ifTrue;
            this.ifFalse = ifFalse;
        }

        @Override public Kind kind() { return Kind.BRANCH; }
    }

    public static final class HandoffStep extends FlowStep {
        public final String fromPersona;
        public final String toPersona;
        public final String next;

        public HandoffStep(String id, String fromPersona, String toPersona, String next) {
            super(id);
            this.fromPersona = fromPersona;
            this.toPersona = toPersona;
            this.next = next;
        }

        @Override public Kind kind() { return Kind.HANDOFF; }
    }

    public static final class SubFlowStep extends FlowStep {
        public final String flow;
        public final String persona;
        public final Target onSuccess;
        public final FailureHandler onFailure;

        public SubFlowStep(String id, String flow, String persona, Target onSuccess, FailureHandler onFailure) {
            super(id);
            this.flow = flow;
            this.persona = persona;
            this.onSuccess = onSuccess;
            this.onFailure = onFailure;
        }

        @Override public Kind kind() { return Kind.SUB_FLOW; }
    }

    public static final class Branch {
        public final String id;
        public final String entry;
        public final Map<String, FlowStep> steps;

        public Branch(String id, String entry, List<FlowStep> steps) {
            this.id = id;
            this.entry = entry;
            this.steps = index(steps);
        }
    }

    public static final class JoinPolicy {
        public final Target onAllSuccess;
        public final FailureHandler onAnyFailure;
        public final Target onAllComplete;

        public JoinPolicy(Target onAllSuccess, FailureHandler onAnyFailure, Target onAllComplete) {
            this.onAllSuccess = onAllSuccess;
            this.onAnyFailure = onAnyFailure;
            this.onAllComplete = onAllComplete;
        }
    }

    public static final class ParallelStep extends FlowStep {
        public final List<Branch> branches;
        public final JoinPolicy join;

        public ParallelStep(String id, List<Branch> branches, JoinPolicy join) {
            super(id);
            this.branches = List.copyOf(branches);
            this.join = join;
        }

        @Override public Kind kind() { return Kind.PARALLEL; }
    }

    static Map<String, FlowStep> index(List<FlowStep> steps) {
        Map<String, FlowStep> m = new LinkedHashMap<>();
        for (FlowStep s : steps) m.put(s.id, s);
        return Collections.unmodifiableMap(m);
    }
}
