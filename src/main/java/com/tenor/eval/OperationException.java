package com.tenor.eval;

/**
 * An operation could not run. Nothing was applied: the caller's entity
 * states are exactly as they were before the call.
 */
public class OperationException extends RuntimeException {

    private final OperationError kind;
    private final String operationId;
    private final String persona;
    private final String entityId;
    private final String instanceId;
    private final String currentState;
    private final String requiredState;

    private OperationException(OperationError kind, String message, String operationId, String persona,
                               String entityId, String instanceId, String currentState, String requiredState,
                               Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.operationId = operationId;
        this.persona = persona;
        this.entityId = entityId;
        this.instanceId = instanceId;
        this.currentState = currentState;
        this.requiredState = requiredState;
    }

    static OperationException personaRejected(String operationId, String persona) {
        return new OperationException(OperationError.PERSONA_REJECTED,
                "persona '" + persona + "' not authorized for operation '" + operationId + "'",
                operationId, persona, null, null, null, null, null);
    }

    static OperationException preconditionFailed(String operationId, String persona, String detail) {
        return new OperationException(OperationError.PRECONDITION_FAILED,
                "precondition failed for operation '" + operationId + "': " + detail,
                operationId, persona, null, null, null, null, null);
    }

    static OperationException sourceMismatch(String operationId, String persona, String entityId, String instanceId,
                                             String current, String required) {
        return new OperationException(OperationError.TRANSITION_SOURCE_MISMATCH,
                "entity '" + entityId + "' instance '" + instanceId + "' in state '" + current + "', expected '" + required + "'",
                operationId, persona, entityId, instanceId, current, required, null);
    }

    static OperationException entityNotFound(String operationId, String persona, String entityId, String instanceId) {
        return new OperationException(OperationError.ENTITY_NOT_FOUND,
                "entity '" + entityId + "' instance '" + instanceId + "' not found in state map",
                operationId, persona, entityId, instanceId, null, null, null);
    }

    static OperationException evaluation(String operationId, String persona, EvalException cause) {
        return new OperationException(OperationError.EVALUATION, "evaluation error: " + cause.getMessage(),
                operationId, persona, null, null, null, null, cause);
    }

    public OperationError kind() { return kind; }
    public String operationId() { return operationId; }
    public String persona() { return persona; }
    public String entityId() { return entityId; }
    public String instanceId() { return instanceId; }
    public String currentState() { return currentState; }
    public String requiredState() { return requiredState; }
}
