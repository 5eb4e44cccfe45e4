package com.bko.plansolve.session;

import com.bko.plansolve.confirm.ConfirmationCorrelator;
import com.bko.plansolve.orchestration.model.PlanContext;
import com.bko.plansolve.orchestration.service.SolverRun;
import com.bko.plansolve.support.SerialExecutor;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;

/**
 * One logical conversation. Survives connection loss; every mutation runs on {@link #mailbox()}.
 */
public class PipelineSession {

    private final String id;
    private final SerialExecutor mailbox;
    private final SessionStateMachine stateMachine;
    private final ConfirmationCorrelator correlator;
    private final Instant createdAt;
    private volatile String connectionId;
    private volatile Instant lastActiveAt;

    private volatile PlanContext planContext;
    private volatile SolverRun solverRun;
    private volatile String pendingStepId;
    private volatile String finalAnswer;
    private volatile Instant runStartedAt;
    private long generation;
    private boolean directMode;

    public PipelineSession(String id, SerialExecutor mailbox, Clock clock) {
        this.id = id;
        this.mailbox = mailbox;
        this.stateMachine = new SessionStateMachine(id);
        this.correlator = new ConfirmationCorrelator(clock);
        this.createdAt = clock.instant();
        this.lastActiveAt = createdAt;
    }

    public String id() {
        return id;
    }

    public SerialExecutor mailbox() {
        return mailbox;
    }

    public SessionStateMachine stateMachine() {
        return stateMachine;
    }

    public SessionStage stage() {
        return stateMachine.stage();
    }

    public ConfirmationCorrelator correlator() {
        return correlator;
    }

    public Instant createdAt() {
        return createdAt;
    }

    @Nullable
    public String connectionId() {
        return connectionId;
    }

    public boolean isAttached() {
        return connectionId != null;
    }

    public void attach(String connectionId) {
        this.connectionId = connectionId;
    }

    /**
     * Detaches only if {@code connectionId} still owns the session.
     */
    public boolean detach(String connectionId) {
        if (connectionId != null && connectionId.equals(this.connectionId)) {
            this.connectionId = null;
            return true;
        }
        return false;
    }

    public Instant lastActiveAt() {
        return lastActiveAt;
    }

    public void touch(Instant now) {
        lastActiveAt = now;
    }

    @Nullable
    public PlanContext planContext() {
        return planContext;
    }

    public void setPlanContext(PlanContext planContext) {
        this.planContext = planContext;
    }

    @Nullable
    public SolverRun solverRun() {
        return solverRun;
    }

    public void setSolverRun(SolverRun solverRun) {
        this.solverRun = solverRun;
    }

    @Nullable
    public String pendingStepId() {
        return pendingStepId;
    }

    public void setPendingStepId(String pendingStepId) {
        this.pendingStepId = pendingStepId;
    }

    @Nullable
    public String finalAnswer() {
        return finalAnswer;
    }

    public void setFinalAnswer(String finalAnswer) {
        this.finalAnswer = finalAnswer;
    }

    @Nullable
    public Instant runStartedAt() {
        return runStartedAt;
    }

    public void setRunStartedAt(Instant runStartedAt) {
        this.runStartedAt = runStartedAt;
    }

    /**
     * Invalidates results of planning or aggregation calls that are still in flight.
     */
    public long nextGeneration() {
        return ++generation;
    }

    public long generation() {
        return generation;
    }

    public boolean isDirectMode() {
        return directMode;
    }

    public void setDirectMode(boolean directMode) {
        this.directMode = directMode;
    }
}
