package com.tenor.eval;

public enum OperationError {
    PERSONA_REJECTED,
    PRECONDITION_FAILED,
    TRANSITION_SOURCE_MISMATCH,
    ENTITY_NOT_FOUND,
    /** Precondition evaluation itself failed; the cause is the {@link EvalException}. */
    EVALUATION
}
