package com.bko.plansolve.error;

/**
 * Base type for every failure the gateway reports back to a client.
 */
public class PlanSolveException extends RuntimeException {

    private final ErrorCode errorCode;

    public PlanSolveException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PlanSolveException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
