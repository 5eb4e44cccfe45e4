package com.bko.plansolve.confirm;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

public class PendingConfirmation {

    private final String stepId;
    private final Instant createdAt;
    private final Instant deadline;
    private final CompletableFuture<ConfirmationOutcome> outcome = new CompletableFuture<>();

    PendingConfirmation(String stepId, Instant createdAt, Instant deadline) {
        this.stepId = stepId;
        this.createdAt = createdAt;
        this.deadline = deadline;
    }

    public String stepId() {
        return stepId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant deadline() {
        return deadline;
    }

    public ConfirmationResolution resolution() {
        if (!outcome.isDone()) {
            return ConfirmationResolution.NONE;
        }
        return outcome.join().resolution();
    }

    public CompletableFuture<ConfirmationOutcome> outcome() {
        return outcome;
    }

    boolean complete(ConfirmationOutcome resolved) {
        return outcome.complete(resolved);
    }
}
