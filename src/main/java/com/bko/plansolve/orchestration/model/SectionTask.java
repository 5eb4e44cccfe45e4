package com.bko.plansolve.orchestration.model;

import java.util.concurrent.Future;

/**
 * Runtime state of one task inside a solver run. Only the owning session's mailbox mutates it.
 */
public class SectionTask {

    private final TaskSpec spec;
    private volatile TaskState state = TaskState.PENDING;
    private volatile int attempts;
    private volatile String lastError;
    private volatile String output;

    private CancellationToken token = new CancellationToken();
    private long generation;
    private boolean attemptInFlight;
    private boolean cancelRequested;
    private boolean restartRequested;
    private Future<?> pendingTimer;

    public SectionTask(TaskSpec spec) {
        this.spec = spec;
    }

    public int id() {
        return spec.id();
    }

    public TaskSpec spec() {
        return spec;
    }

    public TaskState state() {
        return state;
    }

    public int attempts() {
        return attempts;
    }

    public String lastError() {
        return lastError;
    }

    public String output() {
        return output;
    }

    public CancellationToken token() {
        return token;
    }

    public long generation() {
        return generation;
    }

    public boolean attemptInFlight() {
        return attemptInFlight;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    public boolean restartRequested() {
        return restartRequested;
    }

    public TaskOutcome toOutcome() {
        return new TaskOutcome(spec, state, output, lastError, attempts);
    }

    /**
     * Starts a new attempt and returns its generation; completions carrying an older generation are stale.
     */
    public long beginAttempt() {
        attempts++;
        state = TaskState.RUNNING;
        token = new CancellationToken();
        attemptInFlight = true;
        cancelRequested = false;
        return ++generation;
    }

    public void attemptFinished() {
        attemptInFlight = false;
    }

    public void succeed(String result) {
        output = result;
        lastError = null;
        state = TaskState.SUCCEEDED;
        clearTimer();
    }

    public void recordFailure(String error) {
        lastError = error;
    }

    public void fail() {
        state = TaskState.FAILED;
        clearTimer();
    }

    public void requestCancel(String reason) {
        cancelRequested = true;
        token.cancel(reason);
    }

    public void markCancelled() {
        state = TaskState.CANCELLED;
        attemptInFlight = false;
        cancelRequested = false;
        generation++;
        clearTimer();
    }

    public void requestRestart(boolean requested) {
        restartRequested = requested;
    }

    /**
     * Back to pending with the attempt count cleared.
     */
    public void reset() {
        state = TaskState.PENDING;
        attempts = 0;
        lastError = null;
        output = null;
        attemptInFlight = false;
        cancelRequested = false;
        restartRequested = false;
        generation++;
        clearTimer();
    }

    public void setPendingTimer(Future<?> timer) {
        clearTimer();
        pendingTimer = timer;
    }

    public void clearTimer() {
        if (pendingTimer != null) {
            pendingTimer.cancel(false);
            pendingTimer = null;
        }
    }
}
