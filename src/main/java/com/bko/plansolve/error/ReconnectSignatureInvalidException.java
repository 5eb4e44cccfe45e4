package com.bko.plansolve.error;

public class ReconnectSignatureInvalidException extends PlanSolveException {

    public ReconnectSignatureInvalidException(String message) {
        super(ErrorCode.RECONNECT_SIGNATURE_INVALID, message);
    }

    public ReconnectSignatureInvalidException(String message, Throwable cause) {
        super(ErrorCode.RECONNECT_SIGNATURE_INVALID, message, cause);
    }
}
