package com.bko.plansolve.error;

/**
 * Failure of a single solver attempt. Non-retryable failures end the task immediately.
 */
public class TaskExecutionException extends PlanSolveException {

    private final boolean retryable;

    public TaskExecutionException(String message) {
        this(message, true, null);
    }

    public TaskExecutionException(String message, boolean retryable, Throwable cause) {
        super(ErrorCode.TASK_EXECUTION, message, cause);
        this.retryable = retryable;
    }

    public static TaskExecutionException nonRetryable(String message) {
        return new TaskExecutionException(message, false, null);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
