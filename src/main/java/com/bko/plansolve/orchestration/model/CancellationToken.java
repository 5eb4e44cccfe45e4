package com.bko.plansolve.orchestration.model;

import java.util.concurrent.CancellationException;

/**
 * Cooperative stop signal handed to a solver attempt. Solvers check it before and after each
 * external call; nothing is interrupted forcibly.
 */
public class CancellationToken {

    private volatile String reason;

    public boolean isCancelled() {
        return reason != null;
    }

    public String reason() {
        return reason;
    }

    public void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason != null ? reason : "cancelled";
        }
    }

    public void throwIfCancelled() {
        if (reason != null) {
            throw new CancellationException(reason);
        }
    }
}
