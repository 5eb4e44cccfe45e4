package com.bko.plansolve.orchestration.service;

import com.bko.plansolve.error.TaskExecutionException;
import com.bko.plansolve.error.ValidationException;
import com.bko.plansolve.orchestration.api.TaskSolver;
import com.bko.plansolve.orchestration.model.PlanContext;
import com.bko.plansolve.orchestration.model.RetryPolicy;
import com.bko.plansolve.orchestration.model.SectionTask;
import com.bko.plansolve.orchestration.model.TaskOutcome;
import com.bko.plansolve.orchestration.model.TaskResult;
import com.bko.plansolve.orchestration.model.TaskSpec;
import com.bko.plansolve.orchestration.model.TaskState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes a task list with at most {@code concurrency} tasks running at once, admitting pending
 * tasks in id order. Attempts run on the worker pool; their completions, retry timers and
 * cancellation grace timers are posted back to the session mailbox, which is the only thread
 * that touches this object.
 */
@Slf4j
public class SolverRun {

    public record Settings(int concurrency, RetryPolicy retryPolicy, Duration attemptTimeout, Duration cancelGrace) {
    }

    private final String sessionId;
    private final PlanContext context;
    private final List<SectionTask> tasks;
    private final TaskSolver solver;
    private final Settings settings;
    private final Executor mailbox;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final SolverRunListener listener;
    private boolean finished;
    private boolean cancelled;

    public SolverRun(PlanContext context, TaskSolver solver, Settings settings, Executor mailbox,
                     ExecutorService workers, ScheduledExecutorService scheduler, SolverRunListener listener) {
        this.sessionId = context.sessionId();
        this.context = context;
        this.tasks = context.tasks().stream()
                .sorted(Comparator.comparingInt(TaskSpec::id))
                .map(SectionTask::new)
                .toList();
        this.solver = solver;
        this.settings = settings;
        this.mailbox = mailbox;
        this.workers = workers;
        this.scheduler = scheduler;
        this.listener = listener;
    }

    public void start() {
        log.info("Session {} solving {} tasks (concurrency={}, maxRetry={})",
                sessionId, tasks.size(), settings.concurrency(), settings.retryPolicy().maxRetry());
        admit();
        checkAllTerminal();
    }

    public List<SectionTask> tasks() {
        return tasks;
    }

    public PlanContext context() {
        return context;
    }

    public long runningCount() {
        return tasks.stream().filter(task -> task.state() == TaskState.RUNNING).count();
    }

    public List<TaskOutcome> outcomes() {
        return tasks.stream().map(SectionTask::toOutcome).toList();
    }

    /**
     * Cooperatively cancels one task. A task with an attempt in flight is marked cancelled once
     * the attempt returns or the grace period elapses.
     *
     * @return {@code false} when the task was already terminal
     */
    public boolean cancelTask(int taskId, String reason) {
        SectionTask task = require(taskId);
        if (task.state().isTerminal()) {
            return false;
        }
        if (task.attemptInFlight()) {
            if (!task.cancelRequested()) {
                requestCancellation(task, reason);
            }
            return true;
        }
        task.markCancelled();
        listener.onTaskCancelled(task, reason);
        admit();
        checkAllTerminal();
        return true;
    }

    /**
     * Re-admits a task with its attempt count reset. A running attempt is cancelled first.
     */
    public void restartTask(int taskId) {
        SectionTask task = require(taskId);
        if (task.attemptInFlight()) {
            task.requestRestart(true);
            if (!task.cancelRequested()) {
                requestCancellation(task, "restart");
            }
            return;
        }
        if (task.state() == TaskState.RUNNING) {
            task.markCancelled();
            listener.onTaskCancelled(task, "restart");
        }
        restart(task);
    }

    /**
     * Signals every non-terminal task and marks it cancelled without waiting for acknowledgement.
     */
    public void cancelAll(String reason) {
        if (cancelled) {
            return;
        }
        cancelled = true;
        finished = true;
        for (SectionTask task : tasks) {
            if (task.state().isTerminal()) {
                continue;
            }
            task.token().cancel(reason);
            task.markCancelled();
            listener.onTaskCancelled(task, reason);
        }
        log.info("Session {} solver run cancelled ({})", sessionId, reason);
    }

    private void admit() {
        if (cancelled) {
            return;
        }
        long running = runningCount();
        for (SectionTask task : tasks) {
            if (running >= settings.concurrency()) {
                return;
            }
            if (task.state() == TaskState.PENDING) {
                launchAttempt(task);
                running++;
            }
        }
    }

    private void launchAttempt(SectionTask task) {
        long generation = task.beginAttempt();
        var token = task.token();
        listener.onTaskStarted(task);
        CompletableFuture
                .supplyAsync(() -> solver.solve(task.spec(), context, token), workers)
                .orTimeout(settings.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, error) -> mailbox.execute(() -> onAttemptFinished(task, generation, result, error)));
    }

    private void onAttemptFinished(SectionTask task, long generation, TaskResult result, Throwable error) {
        if (generation != task.generation()) {
            log.debug("Discarding stale completion of task {} in session {}", task.id(), sessionId);
            return;
        }
        task.attemptFinished();
        if (task.cancelRequested()) {
            finishCancellation(task);
        } else if (error == null) {
            task.succeed(result != null ? result.output() : null);
            listener.onTaskCompleted(task);
        } else {
            handleFailure(task, generation, unwrap(error));
        }
        admit();
        checkAllTerminal();
    }

    private void handleFailure(SectionTask task, long generation, Throwable cause) {
        if (cause instanceof TimeoutException) {
            task.token().cancel("timeout");
        }
        String message = describe(cause);
        task.recordFailure(message);
        boolean retryable = !(cause instanceof TaskExecutionException tee) || tee.isRetryable();
        boolean willRetry = !cancelled && retryable && settings.retryPolicy().allowsRetry(task.attempts());
        listener.onAttemptFailed(task, message, willRetry);
        if (!willRetry) {
            task.fail();
            listener.onTaskCompleted(task);
            return;
        }
        Duration delay = settings.retryPolicy().delayAfter(task.attempts());
        listener.onRetryScheduled(task, delay);
        task.setPendingTimer(scheduler.schedule(
                () -> mailbox.execute(() -> onRetryDue(task, generation)),
                delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void onRetryDue(SectionTask task, long generation) {
        if (cancelled || generation != task.generation() || task.state() != TaskState.RUNNING) {
            return;
        }
        launchAttempt(task);
    }

    private void requestCancellation(SectionTask task, String reason) {
        task.requestCancel(reason);
        long generation = task.generation();
        task.setPendingTimer(scheduler.schedule(
                () -> mailbox.execute(() -> onGraceExpired(task, generation)),
                settings.cancelGrace().toMillis(), TimeUnit.MILLISECONDS));
    }

    private void onGraceExpired(SectionTask task, long generation) {
        if (generation != task.generation() || !task.cancelRequested()) {
            return;
        }
        log.warn("Task {} in session {} did not acknowledge cancellation within {}ms",
                task.id(), sessionId, settings.cancelGrace().toMillis());
        finishCancellation(task);
        admit();
        checkAllTerminal();
    }

    private void finishCancellation(SectionTask task) {
        String reason = task.token().reason();
        task.markCancelled();
        listener.onTaskCancelled(task, reason);
        if (task.restartRequested()) {
            restart(task);
        }
    }

    private void restart(SectionTask task) {
        task.reset();
        listener.onTaskRestarted(task);
        admit();
        checkAllTerminal();
    }

    private void checkAllTerminal() {
        if (finished || cancelled) {
            return;
        }
        if (tasks.stream().allMatch(task -> task.state().isTerminal())) {
            finished = true;
            listener.onAllTerminal(outcomes());
        }
    }

    private SectionTask require(int taskId) {
        return tasks.stream()
                .filter(task -> task.id() == taskId)
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown task id " + taskId));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "Attempt timed out after " + settings.attemptTimeout().toSeconds() + "s";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
