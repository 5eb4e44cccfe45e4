package com.bko.plansolve.orchestration.service;

import com.bko.plansolve.orchestration.model.SectionTask;
import com.bko.plansolve.orchestration.model.TaskOutcome;

import java.time.Duration;
import java.util.List;

/**
 * Callbacks from a {@link SolverRun}, always invoked on the owning session's mailbox.
 */
public interface SolverRunListener {

    void onTaskStarted(SectionTask task);

    void onAttemptFailed(SectionTask task, String error, boolean willRetry);

    void onRetryScheduled(SectionTask task, Duration delay);

    /**
     * The task reached {@code SUCCEEDED} or {@code FAILED}.
     */
    void onTaskCompleted(SectionTask task);

    void onTaskCancelled(SectionTask task, String reason);

    void onTaskRestarted(SectionTask task);

    /**
     * Every task is terminal. Not called after {@link SolverRun#cancelAll(String)}.
     */
    void onAllTerminal(List<TaskOutcome> outcomes);
}
