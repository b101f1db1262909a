package com.tenor.elaborate.parser;

import java.util.List;
import java.util.Map;

/**
 * Flow steps. The step set is closed: every consumer switches over {@link Kind}.
 */
public class RawStep {

    public enum Kind { OPERATION, BRANCH, HANDOFF, SUB_FLOW, PARALLEL }

    public abstract static class Step {
        public final int line;

        protected Step(int line) { this.line = line; }

        public abstract Kind kind();

        public String kindName() {
            switch (kind()) {
                case OPERATION: return "OperationStep";
                case BRANCH: return "BranchStep";
                case HANDOFF: return "HandoffStep";
                case SUB_FLOW: return "SubFlowStep";
                default: return "ParallelStep";
            }
        }
    }

    /** A step id, or a terminal outcome when {@code terminal} is set. */
    public static final class Target {
        public final String stepId;
        public final String terminal;
        public final int line;

        private Target(String stepId, String terminal, int line) {
            this.stepId = stepId;
            this.terminal = terminal;
            this.line = line;
        }

        public static Target step(String id, int line) { return new Target(id, null, line); }
        public static Target terminal(String outcome) { return new Target(null, outcome, 0); }

        public boolean isTerminal() { return terminal != null; }
    }

    public static final class CompStep {
        public final String op;
        public final String persona;
        public final String onFailure;

        public CompStep(String op, String persona, String onFailure) {
            this.op = op;
            this.persona = persona;
            this.onFailure = onFailure;
        }
    }

    public static final class FailureHandler {
        public enum Kind { TERMINATE, COMPENSATE, ESCALATE }

        public final Kind kind;
        public final String outcome;          // Terminate
        public final List<CompStep> steps;    // Compensate
        public final String then;             // Compensate
        public final String toPersona;        // Escalate
        public final String next;             // Escalate
        public final int line;

        private FailureHandler(Kind kind, String outcome, List<CompStep> steps, String then,
                               String toPersona, String next, int line) {
            this.kind = kind;
            this.outcome = outcome;
            this.steps = steps == null ? List.of() : List.copyOf(steps);
            this.then = then;
            this.toPersona = toPersona;
            this.next = next;
            this.line = line;
        }

        public static FailureHandler terminate(String outcome, int line) {
            return new FailureHandler(Kind.TERMINATE, outcome, null, null, null, null, line);
        }

        public static FailureHandler compensate(List<CompStep> steps, String then, int line) {
            return new FailureHandler(Kind.COMPENSATE, null, steps, then, null, null, line);
        }

        public static FailureHandler escalate(String toPersona, String next, int line) {
            return new FailureHandler(Kind.ESCALATE, null, null, null, toPersona, next, line);
        }
    }

    public static final class OperationStep extends Step {
        public final String op;
        public final String persona;
        public final Map<String, Target> outcomes;
        public final FailureHandler onFailure;

        public OperationStep(String op, String persona, Map<String, Target> outcomes, FailureHandler onFailure, int line) {
            super(line);
            this.op = op;
            this.persona = persona;
            this.outcomes = outcomes;
            this.onFailure = onFailure;
        }

        @Override public Kind kind() { return Kind.OPERATION; }
    }

    public static final class BranchStep extends Step {
        public final RawExpr.ExprNode condition;
        public final String persona;
        public final Target ifTrue;
        public final Target ifFalse;

        public BranchStep(RawExpr.ExprNode condition, String persona, Target ifTrue, Target ifFalse, int line) {
            super(line);
            this.condition = condition;
            this.persona = persona;
            this.ifTrue = ifTrue;
            this.ifFalse = ifFalse;
        }

        @Override public Kind kind() { return Kind.BRANCH; }
    }

    public static final class HandoffStep extends Step {
        public final String fromPersona;
        public final String toPersona;
        public final String next;
        public final int nextLine;

        public HandoffStep(String fromPersona, String toPersona, String next, int nextLine, int line) {
            super(line);
            this.fromPersona = fromPersona;
            this.toPersona = toPersona;
            this.next = next;
            this.nextLine = nextLine;
        }

        @Override public Kind kind() { return Kind.HANDOFF; }
    }

    public static final class SubFlowStep extends Step {
        public final String flow;
        public final int flowLine;
        public final String persona;
        public final Target onSuccess;
        public final FailureHandler onFailure;

        public SubFlowStep(String flow, int flowLine, String persona, Target onSuccess, FailureHandler onFailure, int line) {
            super(line);
            this.flow = flow;
            this.flowLine = flowLine;
            this.persona = persona;
            this.onSuccess = onSuccess;
            this.onFailure = onFailure;
        }

        @Override public Kind kind() { return Kind.SUB_FLOW; }
    }

    public static final class Branch {
        public final String id;
        public final String entry;
        public final Map<String, Step> steps;

        public Branch(String id, String entry, Map<String, Step> steps) {
            this.id = id;
            this.entry = entry;
            this.steps = steps;
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

    public static final class ParallelStep extends Step {
        public final List<Branch> branches;
        public final int branchesLine;
        public final JoinPolicy join;

        public ParallelStep(List<Branch> branches, int branchesLine, JoinPolicy join, int line) {
            super(line);
            this.branches = List.copyOf(branches);
            this.branchesLine = branchesLine;
            this.join = join;
        }

        @Override public Kind kind() { return Kind.PARALLEL; }
    }
}
