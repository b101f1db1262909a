package com.tenor.eval;

/**
 * Unchecked evaluation failure. {@link #subject()} names the fact or flow the
 * failure is about, when there is one.
 */
public class EvalException extends RuntimeException {

    private final EvalError kind;
    private final String subject;

    public EvalException(EvalError kind, String subject, String message) {
        super(message);
        this.kind = kind;
        this.subject = subject;
    }

    public EvalError kind() {
        return kind;
    }

    public String subject() {
        return subject;
    }

    public static EvalException missingFact(String factId) {
        return new EvalException(EvalError.MISSING_FACT, factId, "missing required fact: " + factId);
    }

    public static EvalException typeMismatch(String factId, String expected, String got) {
        return new EvalException(EvalError.TYPE_MISMATCH, factId,
                "type mismatch for fact '" + factId + "': expected " + expected + ", got " + got);
    }

    public static EvalException typeError(String message) {
        return new EvalException(EvalError.TYPE_ERROR, null, "type error: " + message);
    }

    public static EvalException overflow(String message) {
        return new EvalException(EvalError.OVERFLOW, null, "numeric overflow: " + message);
    }

    public static EvalException invalidOperator(String op) {
        return new EvalException(EvalError.INVALID_OPERATOR, null, "invalid operator: " + op);
    }

    public static EvalException deserialize(String message) {
        return new EvalException(EvalError.DESERIALIZE, null, "deserialization error: " + message);
    }

    public static EvalException flow(String flowId, String message) {
        return new EvalException(EvalError.FLOW_ERROR, flowId, "flow error in '" + flowId + "': " + message);
    }

    public static EvalException invariant(String message) {
        return new EvalException(EvalError.INVARIANT, null, "invariant violated: " + message);
    }
}
