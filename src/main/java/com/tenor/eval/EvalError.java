package com.tenor.eval;

/** Categories of evaluation failure. */
public enum EvalError {
    /** A declared fact was not supplied and has no default. */
    MISSING_FACT,
    TYPE_MISMATCH,
    INVALID_ENUM,
    LIST_OVERFLOW,
    TYPE_ERROR,
    UNKNOWN_FACT,
    UNBOUND_VARIABLE,
    NOT_A_RECORD,
    OVERFLOW,
    INVALID_OPERATOR,
    DESERIALIZE,
    FLOW_ERROR,
    /** The bundle breaks a guarantee elaboration should have established. */
    INVARIANT
}
