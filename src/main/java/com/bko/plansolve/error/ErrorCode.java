package com.bko.plansolve.error;

/**
 * Stable error codes carried in {@code metadata.errorCode} of error events.
 */
public enum ErrorCode {
    PROTOCOL("protocol_error"),
    SESSION_NOT_FOUND("session_not_found"),
    VALIDATION("validation_error"),
    CONFIRMATION_TIMEOUT("confirmation_timeout"),
    TASK_EXECUTION("task_execution_error"),
    RECONNECT_SIGNATURE_INVALID("reconnect_signature_invalid"),
    INTERNAL("internal_error");

    private final String wireValue;

    ErrorCode(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
