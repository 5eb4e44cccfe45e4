package com.bko.plansolve.session;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds a session's stage and rejects transitions the pipeline does not allow. No I/O happens
 * here; callers emit the matching events.
 */
@Slf4j
public class SessionStateMachine {

    private final String sessionId;
    private volatile SessionStage stage = SessionStage.CREATED;

    public SessionStateMachine(String sessionId) {
        this.sessionId = sessionId;
    }

    public SessionStage stage() {
        return stage;
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }

    public boolean isIn(SessionStage... stages) {
        for (SessionStage candidate : stages) {
            if (stage == candidate) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws IllegalStateException when {@code target} is not reachable from the current stage
     */
    public void transition(SessionStage target) {
        SessionStage current = stage;
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal stage transition " + current + " -> " + target
                    + " for session " + sessionId);
        }
        stage = target;
        log.info("Session {} stage {} -> {}", sessionId, current, target);
    }
}
