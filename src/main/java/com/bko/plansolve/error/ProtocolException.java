package com.bko.plansolve.error;

/**
 * Malformed envelope. Reported to the offending connection only.
 */
public class ProtocolException extends PlanSolveException {

    public ProtocolException(String message) {
        super(ErrorCode.PROTOCOL, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorCode.PROTOCOL, message, cause);
    }
}
