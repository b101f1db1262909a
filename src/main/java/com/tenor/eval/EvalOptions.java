package com.tenor.eval;

/** Resource guards for flow execution. */
public final class EvalOptions {

    public static final int DEFAULT_MAX_FLOW_STEPS = 1000;
    public static final int DEFAULT_MAX_SUB_FLOW_DEPTH = 32;

    private int maxFlowSteps = DEFAULT_MAX_FLOW_STEPS;
    private int maxSubFlowDepth = DEFAULT_MAX_SUB_FLOW_DEPTH;

    public static EvalOptions defaults() {
        return new EvalOptions();
    }

    /** Defaults overridden by {@code tenor.eval.maxFlowSteps} / {@code tenor.eval.maxSubFlowDepth}. */
    public static EvalOptions fromSystemProperties() {
        return new EvalOptions()
                .maxFlowSteps(Integer.getInteger("tenor.eval.maxFlowSteps", DEFAULT_MAX_FLOW_STEPS))
                .maxSubFlowDepth(Integer.getInteger("tenor.eval.maxSubFlowDepth", DEFAULT_MAX_SUB_FLOW_DEPTH));
    }

    public int maxFlowSteps() { return maxFlowSteps; }
    public int maxSubFlowDepth() { return maxSubFlowDepth; }

    public EvalOptions maxFlowSteps(int n) {
        if (n < 1) throw new IllegalArgumentException("maxFlowSteps must be >= 1");
        this.maxFlowSteps = n;
        return this;
    }

    public EvalOptions maxSubFlowDepth(int n) {
        if (n < 1) throw new IllegalArgumentException("maxSubFlowDepth must be >= 1");
        this.maxSubFlowDepth = n;
        return this;
    }
}
