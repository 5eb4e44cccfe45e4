package com.bko.plansolve.orchestration.service;

import com.bko.plansolve.config.PlanSolveProperties;
import com.bko.plansolve.confirm.ConfirmationOutcome;
import com.bko.plansolve.confirm.PendingConfirmation;
import com.bko.plansolve.error.ConfirmationTimeoutException;
import com.bko.plansolve.error.ErrorCode;
import com.bko.plansolve.error.PlanSolveException;
import com.bko.plansolve.error.ValidationException;
import com.bko.plansolve.orchestration.api.Aggregator;
import com.bko.plansolve.orchestration.api.Planner;
import com.bko.plansolve.orchestration.api.TaskSolver;
import com.bko.plansolve.orchestration.api.TraceSink;
import com.bko.plansolve.orchestration.model.AggregateReport;
import com.bko.plansolve.orchestration.model.PipelineTrace;
import com.bko.plansolve.orchestration.model.PlanContext;
import com.bko.plansolve.orchestration.model.PlanRequest;
import com.bko.plansolve.orchestration.model.PlanResult;
import com.bko.plansolve.orchestration.model.RetryPolicy;
import com.bko.plansolve.orchestration.model.SectionTask;
import com.bko.plansolve.orchestration.model.TaskOutcome;
import com.bko.plansolve.orchestration.model.TaskSpec;
import com.bko.plansolve.orchestration.model.TaskState;
import com.bko.plansolve.protocol.EventType;
import com.bko.plansolve.session.PipelineSession;
import com.bko.plansolve.session.SessionStage;
import com.bko.plansolve.stream.SessionEventPublisher;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives a session through plan, confirmation, parallel solve and aggregation. Every method that
 * takes a session must run on that session's mailbox; callers go through {@link #submit}.
 * Planner and aggregator calls run on the worker pool and post their results back, tagged with
 * the session generation so that results of a cancelled or replanned run are dropped.
 */
@Service
@Slf4j
public class PipelineOrchestrator {

    private static final String CONFIRM_STEP_PREFIX = "confirm_plan_";

    private final SessionEventPublisher publisher;
    private final Planner planner;
    private final TaskSolver solver;
    private final Aggregator aggregator;
    private final TraceSink traceSink;
    private final TaskListMapper taskListMapper;
    private final PipelineMetricsService metrics;
    private final PlanSolveProperties properties;
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public PipelineOrchestrator(SessionEventPublisher publisher,
                                Planner planner,
                                TaskSolver solver,
                                Aggregator aggregator,
                                TraceSink traceSink,
                                TaskListMapper taskListMapper,
                                PipelineMetricsService metrics,
                                PlanSolveProperties properties,
                                @Qualifier("workerExecutor") ExecutorService workerExecutor,
                                @Qualifier("pipelineScheduler") ScheduledExecutorService scheduler,
                                Clock clock) {
        this.publisher = publisher;
        this.planner = planner;
        this.solver = solver;
        this.aggregator = aggregator;
        this.traceSink = traceSink;
        this.taskListMapper = taskListMapper;
        this.metrics = metrics;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Queues a command on the session mailbox. Validation failures are reported as
     * {@code error.validation} without touching the stage; anything else moves the session to ERROR.
     */
    public void submit(PipelineSession session, String label, Runnable command) {
        session.mailbox().execute(() -> {
            try {
                command.run();
            } catch (ValidationException ex) {
                log.warn("Session {} rejected {}: {}", session.id(), label, ex.getMessage());
                publisher.emitError(session, EventType.ERROR_VALIDATION, ex);
            } catch (RuntimeException ex) {
                fail(session, label, ex);
            }
        });
    }

    // --- planning -------------------------------------------------------------------------

    public void startPipeline(PipelineSession session, String question) {
        requireStage(session, "start a pipeline", SessionStage.CREATED);
        if (!StringUtils.hasText(question)) {
            throw new ValidationException("Message content is empty");
        }
        session.setRunStartedAt(clock.instant());
        beginPlanning(session, question.trim());
    }

    private void beginPlanning(PipelineSession session, String question) {
        session.stateMachine().transition(SessionStage.PLANNING);
        session.setDirectMode(false);
        long generation = session.nextGeneration();
        session.setPlanContext(new PlanContext(session.id(), question, null, List.of()));
        publisher.emit(session, EventType.PLAN_START, Map.of("question", question));
        CompletableFuture
                .supplyAsync(() -> planner.plan(new PlanRequest(session.id(), question)), workerExecutor)
                .orTimeout(attemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((plan, error) -> submit(session, "plan",
                        () -> onPlanReady(session, generation, plan, error)));
    }

    private void onPlanReady(PipelineSession session, long generation, PlanResult plan, Throwable error) {
        if (generation != session.generation() || session.stage() != SessionStage.PLANNING) {
            log.debug("Discarding stale plan for session {}", session.id());
            return;
        }
        if (error != null) {
            throw stageFailed(session, "Planning", error);
        }
        if (plan == null || plan.tasks().isEmpty()) {
            publisher.emit(session, EventType.PLAN_VALIDATION_ERROR, Map.of("message", "Planner returned no tasks"));
            throw new PlanSolveException(ErrorCode.INTERNAL, "Planner returned no tasks");
        }
        PlanContext previous = session.planContext();
        PlanContext context = new PlanContext(session.id(), previous != null ? previous.question() : null,
                plan.summary(), plan.tasks());
        session.setPlanContext(context);
        metrics.recordPlan(session.id(), context.tasks().size());

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("summary", context.planSummary());
        content.put("tasks", context.tasks());
        publisher.emit(session, EventType.PLAN_COMPLETED, content, Map.of("taskCount", context.tasks().size()));

        if (properties.getPipeline().isRequireConfirmation()) {
            requestConfirmation(session, context);
        } else {
            startSolving(session, context);
        }
    }

    private void requestConfirmation(PipelineSession session, PlanContext context) {
        session.stateMachine().transition(SessionStage.AWAITING_CONFIRM);
        String stepId = CONFIRM_STEP_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        Duration timeout = properties.getPipeline().getConfirmationTimeout();
        PendingConfirmation pending = session.correlator().open(stepId, timeout);
        session.setPendingStepId(stepId);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("requiresConfirmation", true);
        metadata.put("scope", "plan");
        metadata.put("planSummary", context.planSummary());
        metadata.put("tasks", context.tasks());
        metadata.put("deadline", pending.deadline().toString());
        publisher.emit(session, EventType.AGENT_USER_CONFIRM, stepId,
                Map.of("message", "Review the plan and confirm to start solving."), metadata);

        pending.outcome()
                .thenAccept(outcome -> submit(session, "confirmation", () -> onConfirmation(session, outcome)));
    }

    /**
     * Records the client's answer to a confirmation request. Unknown or stale step ids are ignored.
     */
    public void handleResponse(PipelineSession session, @Nullable String stepId, boolean confirmed, @Nullable JsonNode extra) {
        if (!StringUtils.hasText(stepId)) {
            log.debug("Session {} response without stepId ignored", session.id());
            return;
        }
        session.correlator().resolve(stepId, confirmed, extra);
    }

    private void onConfirmation(PipelineSession session, ConfirmationOutcome outcome) {
        if (session.stage() != SessionStage.AWAITING_CONFIRM || !outcome.stepId().equals(session.pendingStepId())) {
            log.debug("Session {} ignoring resolution of step {}", session.id(), outcome.stepId());
            return;
        }
        session.setPendingStepId(null);
        switch (outcome.resolution()) {
            case CONFIRMED -> onPlanConfirmed(session, outcome.extra());
            case TIMED_OUT -> {
                publisher.emitError(session, EventType.ERROR_TIMEOUT,
                        new ConfirmationTimeoutException(outcome.stepId(), properties.getPipeline().getConfirmationTimeout()));
                cancelPlanning(session, "timeout");
            }
            default -> cancelPlanning(session, "declined");
        }
    }

    private void onPlanConfirmed(PipelineSession session, @Nullable JsonNode extra) {
        PlanContext context = session.planContext();
        if (extra != null && !extra.isNull() && !extra.isMissingNode()) {
            List<TaskSpec> edited;
            try {
                edited = taskListMapper.fromJson(extra);
            } catch (ValidationException ex) {
                publisher.emitError(session, EventType.PLAN_COERCION_ERROR, ex);
                cancelPlanning(session, "invalid_tasks");
                return;
            }
            context = context.withTasks(edited);
            session.setPlanContext(context);
            log.info("Session {} plan replaced by {} edited tasks", session.id(), edited.size());
        }
        startSolving(session, context);
    }

    private void cancelPlanning(PipelineSession session, String reason) {
        publisher.emit(session, EventType.PLAN_CANCELLED, Map.of("reason", reason));
        session.stateMachine().transition(SessionStage.CANCELLED);
        finishRun(session, "cancelled");
    }

    // --- solving --------------------------------------------------------------------------

    /**
     * Runs a client-supplied task list without planning or aggregation.
     */
    public void solveTasks(PipelineSession session, List<TaskSpec> tasks, @Nullable String question, @Nullable String summary) {
        requireStage(session, "solve tasks", SessionStage.CREATED);
        session.setDirectMode(true);
        session.setRunStartedAt(clock.instant());
        PlanContext context = new PlanContext(session.id(), question, summary, tasks);
        session.setPlanContext(context);
        startSolving(session, context);
    }

    private void startSolving(PipelineSession session, PlanContext context) {
        session.stateMachine().transition(SessionStage.SOLVING);
        Executor mailbox = command -> submit(session, "solver", command);
        SolverRun run = new SolverRun(context, solver, solverSettings(), mailbox, workerExecutor, scheduler,
                new SessionSolverListener(session));
        session.setSolverRun(run);
        run.start();
    }

    public void cancelTask(PipelineSession session, int taskId) {
        requireStage(session, "cancel a task", SessionStage.SOLVING);
        if (!session.solverRun().cancelTask(taskId, "user_cancel")) {
            throw new ValidationException("Task " + taskId + " already finished");
        }
    }

    public void restartTask(PipelineSession session, int taskId) {
        requireStage(session, "restart a task", SessionStage.SOLVING);
        session.solverRun().restartTask(taskId);
    }

    private void onSolvingFinished(PipelineSession session, List<TaskOutcome> outcomes) {
        if (session.stage() != SessionStage.SOLVING) {
            return;
        }
        Map<String, Object> counts = counts(outcomes);
        if (session.isDirectMode()) {
            Map<String, Object> content = new LinkedHashMap<>(counts);
            content.put("action", "solve_tasks");
            content.put("message", "All tasks finished");
            publisher.emit(session, EventType.SYSTEM_NOTICE, content);
            session.stateMachine().transition(SessionStage.COMPLETED);
            finishRun(session, "completed");
            return;
        }
        session.stateMachine().transition(SessionStage.AGGREGATING);
        publisher.emit(session, EventType.AGGREGATE_START, counts);
        long generation = session.nextGeneration();
        PlanContext context = session.planContext();
        CompletableFuture
                .supplyAsync(() -> aggregator.aggregate(context, outcomes), workerExecutor)
                .orTimeout(attemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((report, error) -> submit(session, "aggregate",
                        () -> onAggregated(session, generation, outcomes, report, error)));
    }

    private void onAggregated(PipelineSession session, long generation, List<TaskOutcome> outcomes,
                              AggregateReport report, Throwable error) {
        if (generation != session.generation() || session.stage() != SessionStage.AGGREGATING) {
            log.debug("Discarding stale aggregate for session {}", session.id());
            return;
        }
        if (error != null || report == null) {
            throw stageFailed(session, "Aggregation", error);
        }
        session.setFinalAnswer(report.content());
        Map<String, Object> reportContent = new LinkedHashMap<>();
        reportContent.put("summary", report.summary());
        reportContent.put("report", report.content());
        publisher.emit(session, EventType.AGGREGATE_COMPLETED, reportContent);
        publisher.emit(session, EventType.AGENT_FINAL_ANSWER, Map.of("answer", String.valueOf(report.content())));
        Map<String, Object> summary = new LinkedHashMap<>(counts(outcomes));
        summary.put("status", "completed");
        publisher.emit(session, EventType.PIPELINE_COMPLETED, summary);
        session.stateMachine().transition(SessionStage.COMPLETED);
        finishRun(session, "completed");
    }

    // --- cancellation and replanning ------------------------------------------------------

    public void cancel(PipelineSession session, String reason) {
        if (session.stage().isTerminal()) {
            throw new ValidationException("Session already " + session.stage().name().toLowerCase());
        }
        stopActiveWork(session, reason);
        session.stateMachine().transition(SessionStage.CANCELLED);
        publisher.emit(session, EventType.AGENT_INTERRUPTED, Map.of("reason", reason));
        finishRun(session, "cancelled");
    }

    public void cancelPlan(PipelineSession session) {
        requireStage(session, "cancel the plan", SessionStage.PLANNING, SessionStage.AWAITING_CONFIRM);
        stopActiveWork(session, "plan_cancelled");
        cancelPlanning(session, "user");
    }

    public void replan(PipelineSession session, @Nullable String question) {
        requireStage(session, "replan", SessionStage.PLANNING, SessionStage.AWAITING_CONFIRM,
                SessionStage.SOLVING, SessionStage.AGGREGATING);
        PlanContext previous = session.planContext();
        String effective = StringUtils.hasText(question) ? question.trim()
                : previous != null ? previous.question() : null;
        if (!StringUtils.hasText(effective)) {
            throw new ValidationException("Nothing to replan: no question given");
        }
        stopActiveWork(session, "replan");
        session.setSolverRun(null);
        publisher.emit(session, EventType.PLAN_CANCELLED, Map.of("reason", "replan"));
        beginPlanning(session, effective);
    }

    /**
     * Quietly stops whatever is still running, used before a session is evicted.
     */
    public void shutdown(PipelineSession session) {
        if (!session.stage().isTerminal()) {
            stopActiveWork(session, "evicted");
        }
    }

    private void stopActiveWork(PipelineSession session, String reason) {
        session.nextGeneration();
        session.setPendingStepId(null);
        session.correlator().cancelAll();
        SolverRun run = session.solverRun();
        if (run != null) {
            run.cancelAll(reason);
        }
    }

    // --- failure and bookkeeping ----------------------------------------------------------

    private void fail(PipelineSession session, String label, RuntimeException ex) {
        if (session.stage().isTerminal()) {
            log.error("Session {} failed during {} after reaching {}", session.id(), label, session.stage(), ex);
            return;
        }
        log.error("Session {} failed during {}", session.id(), label, ex);
        stopActiveWork(session, "error");
        session.stateMachine().transition(SessionStage.ERROR);
        PlanSolveException error = ex instanceof PlanSolveException pse
                ? pse
                : new PlanSolveException(ErrorCode.INTERNAL, describe(ex), ex);
        publisher.emitError(session, EventType.AGENT_ERROR, error);
        finishRun(session, "error");
    }

    /**
     * Reports a failed planner or aggregator call as {@code error.execution}; the returned
     * exception moves the session to ERROR.
     */
    private PlanSolveException stageFailed(PipelineSession session, String stage, @Nullable Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        PlanSolveException failure = new PlanSolveException(ErrorCode.INTERNAL,
                stage + " failed: " + (cause != null ? describe(cause) : "no result"), cause);
        publisher.emitError(session, EventType.ERROR_EXECUTION, failure);
        return failure;
    }

    private void finishRun(PipelineSession session, String status) {
        metrics.recordPipelineCompleted(session.id(), status);
        SolverRun run = session.solverRun();
        PlanContext context = session.planContext();
        PipelineTrace trace = new PipelineTrace(
                session.id(),
                context != null ? context.question() : null,
                context != null ? context.planSummary() : null,
                status,
                session.finalAnswer(),
                run != null ? run.outcomes() : List.of(),
                session.runStartedAt() != null ? session.runStartedAt() : session.createdAt(),
                clock.instant());
        try {
            workerExecutor.execute(() -> traceSink.append(trace));
        } catch (RejectedExecutionException ex) {
            log.warn("Trace for session {} not stored: {}", session.id(), ex.getMessage());
        }
    }

    private void requireStage(PipelineSession session, String action, SessionStage... allowed) {
        if (!session.stateMachine().isIn(allowed)) {
            throw new ValidationException("Cannot " + action + " while session is " + session.stage()
                    + " (expected one of " + Arrays.toString(allowed) + ")");
        }
    }

    private SolverRun.Settings solverSettings() {
        PlanSolveProperties.Pipeline pipeline = properties.getPipeline();
        RetryPolicy retryPolicy = new RetryPolicy(pipeline.getMaxRetry(), pipeline.getRetryDelay(),
                pipeline.getBackoffMultiplier(), pipeline.getMaxRetryDelay());
        return new SolverRun.Settings(pipeline.getConcurrency(), retryPolicy, attemptTimeout(), pipeline.getCancelGrace());
    }

    private Duration attemptTimeout() {
        return properties.getPipeline().getAttemptTimeout();
    }

    private static Map<String, Object> counts(List<TaskOutcome> outcomes) {
        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("taskCount", outcomes.size());
        counts.put("succeeded", outcomes.stream().filter(o -> o.state() == TaskState.SUCCEEDED).count());
        counts.put("failed", outcomes.stream().filter(o -> o.state() == TaskState.FAILED).count());
        counts.put("cancelled", outcomes.stream().filter(o -> o.state() == TaskState.CANCELLED).count());
        return counts;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Turns solver run callbacks into {@code solver.*} events for one session.
     */
    private final class SessionSolverListener implements SolverRunListener {

        private final PipelineSession session;

        private SessionSolverListener(PipelineSession session) {
            this.session = session;
        }

        @Override
        public void onTaskStarted(SectionTask task) {
            metrics.recordAttempt();
            Map<String, Object> content = new LinkedHashMap<>();
            content.put("taskId", task.id());
            content.put("title", task.spec().title());
            content.put("objective", task.spec().objective());
            publisher.emit(session, EventType.SOLVER_START, content, taskMetadata(task));
        }

        @Override
        public void onAttemptFailed(SectionTask task, String error, boolean willRetry) {
            Map<String, Object> metadata = taskMetadata(task);
            metadata.put("willRetry", willRetry);
            metadata.put("errorCode", ErrorCode.TASK_EXECUTION.wireValue());
            publisher.emit(session, EventType.SOLVER_STEP_FAILED, Map.of("taskId", task.id(), "error", error), metadata);
        }

        @Override
        public void onRetryScheduled(SectionTask task, Duration delay) {
            metrics.recordRetry();
            publisher.emit(session, EventType.SOLVER_RETRY,
                    Map.of("taskId", task.id(), "nextAttempt", task.attempts() + 1, "delayMs", delay.toMillis()),
                    taskMetadata(task));
        }

        @Override
        public void onTaskCompleted(SectionTask task) {
            Map<String, Object> content = new LinkedHashMap<>();
            content.put("taskId", task.id());
            content.put("title", task.spec().title());
            if (task.state() == TaskState.SUCCEEDED) {
                content.put("result", task.output());
            } else {
                metrics.recordTaskFailed();
                content.put("error", task.lastError());
            }
            publisher.emit(session, EventType.SOLVER_COMPLETED, content, taskMetadata(task));
        }

        @Override
        public void onTaskCancelled(SectionTask task, String reason) {
            publisher.emit(session, EventType.SOLVER_CANCELLED,
                    Map.of("taskId", task.id(), "reason", reason != null ? reason : "cancelled"), taskMetadata(task));
        }

        @Override
        public void onTaskRestarted(SectionTask task) {
            publisher.emit(session, EventType.SOLVER_RESTARTED, Map.of("taskId", task.id()), taskMetadata(task));
        }

        @Override
        public void onAllTerminal(List<TaskOutcome> outcomes) {
            onSolvingFinished(session, outcomes);
        }

        private Map<String, Object> taskMetadata(SectionTask task) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("taskId", task.id());
            metadata.put("state", task.state().name().toLowerCase());
            metadata.put("attempt", task.attempts());
            return metadata;
        }
    }
}
