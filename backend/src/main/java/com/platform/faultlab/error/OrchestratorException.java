package com.platform.faultlab.error;

/**
 * Exception for orchestrator (Docker Engine) request failures.
 */
public class OrchestratorException extends FaultLabException {

    private final String operation;
    private final int statusCode;

    public OrchestratorException(String operation, int statusCode, String message) {
        super(ErrorCode.ORCHESTRATOR_ERROR, message);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public OrchestratorException(String operation, String message, Throwable cause) {
        super(ErrorCode.ORCHESTRATOR_ERROR, message, cause);
        this.operation = operation;
        this.statusCode = -1;
    }

    public static OrchestratorException unexpectedStatus(String operation, int statusCode, String body) {
        return new OrchestratorException(operation, statusCode,
            String.format("Docker %s returned HTTP %d: %s", operation, statusCode, body));
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
