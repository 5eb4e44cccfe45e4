package com.bko.plansolve.orchestration.api;

import com.bko.plansolve.orchestration.model.CancellationToken;
import com.bko.plansolve.orchestration.model.PlanContext;
import com.bko.plansolve.orchestration.model.TaskResult;
import com.bko.plansolve.orchestration.model.TaskSpec;

/**
 * Executes a single task. Called once per attempt, possibly concurrently for different tasks.
 */
public interface TaskSolver {

    /**
     * Solves one task.
     *
     * @param task The task to solve.
     * @param context The plan the task belongs to.
     * @param cancellationToken Signalled when the task or the whole pipeline is cancelled. Implementations
     *                          should check it before and after every external call.
     * @return The task output.
     * @throws com.bko.plansolve.error.TaskExecutionException when the attempt fails; a non-retryable
     *         failure ends the task without further attempts.
     */
    TaskResult solve(TaskSpec task, PlanContext context, CancellationToken cancellationToken);
}
