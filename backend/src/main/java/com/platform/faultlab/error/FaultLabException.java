package com.platform.faultlab.error;

/**
 * Base exception for all fault lab exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class FaultLabException extends RuntimeException {

    private final ErrorCode errorCode;

    protected FaultLabException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected FaultLabException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected FaultLabException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
