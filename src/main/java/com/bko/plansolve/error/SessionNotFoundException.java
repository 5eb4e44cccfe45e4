package com.bko.plansolve.error;

public class SessionNotFoundException extends PlanSolveException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        this(sessionId, "Session not found: " + sessionId);
    }

    public SessionNotFoundException(String sessionId, String message) {
        super(ErrorCode.SESSION_NOT_FOUND, message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
