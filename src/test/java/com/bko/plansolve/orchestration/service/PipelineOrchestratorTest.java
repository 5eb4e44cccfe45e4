package com.bko.plansolve.orchestration.service;

import com.bko.plansolve.error.TaskExecutionException;
import com.bko.plansolve.orchestration.api.Aggregator;
import com.bko.plansolve.orchestration.api.Planner;
import com.bko.plansolve.orchestration.api.TaskSolver;
import com.bko.plansolve.orchestration.model.AggregateReport;
import com.bko.plansolve.orchestration.model.PlanResult;
import com.bko.plansolve.orchestration.model.TaskResult;
import com.bko.plansolve.orchestration.model.TaskSpec;
import com.bko.plansolve.session.SessionStage;
import com.bko.plansolve.support.PipelineHarness;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class PipelineOrchestratorTest {

    private final PipelineHarness harness = new PipelineHarness();

    private final Planner threeTasks = request -> new PlanResult("Three sections", List.of(
            task(1, "Intro"), task(2, "Body"), task(3, "Outro")));
    private final TaskSolver echoSolver = (task, context, token) -> new TaskResult("out-" + task.id());
    private final Aggregator joiner = (context, outcomes) -> new AggregateReport("joined", outcomes.stream()
            .map(outcome -> String.valueOf(outcome.output()))
            .collect(Collectors.joining("|")));

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private static TaskSpec task(int id, String title) {
        return new TaskSpec(id, title, "Write " + title, List.of(), List.of());
    }

    @Test
    void testConfirmedPlanRunsToCompletion() {
        harness.properties.getPipeline().setConcurrency(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peakInFlight = new AtomicInteger();
        TaskSolver trackingSolver = (task, context, token) -> {
            peakInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                TimeUnit.MILLISECONDS.sleep(40);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return new TaskResult("out-" + task.id());
        };
        harness.start(threeTasks, trackingSolver, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();

        client.send("user.message", Map.of("question", "Write a report"));
        JsonNode confirm = client.awaitEvent("agent.user_confirm");
        String stepId = confirm.path("stepId").asText();
        assertTrue(stepId.startsWith("confirm_plan_"));
        assertTrue(confirm.path("metadata").path("requiresConfirmation").asBoolean());
        assertEquals(3, confirm.path("metadata").path("tasks").size());

        client.send("user.response", stepId, Map.of("confirmed", true));
        JsonNode completed = client.awaitEvent("pipeline.completed");
        assertEquals("completed", completed.path("content").path("status").asText());
        assertEquals(3, completed.path("content").path("succeeded").asInt());

        JsonNode answer = client.awaitEvent("agent.final_answer");
        assertEquals("out-1|out-2|out-3", answer.path("content").path("answer").asText());
        assertEquals(SessionStage.COMPLETED, harness.session(sessionId).stage());

        List<String> names = client.transport().eventNames();
        assertTrue(names.indexOf("plan.start") < names.indexOf("plan.completed"));
        assertTrue(names.indexOf("plan.completed") < names.indexOf("agent.user_confirm"));
        assertTrue(names.lastIndexOf("solver.completed") < names.indexOf("aggregate.start"));
        assertTrue(names.indexOf("aggregate.completed") < names.indexOf("agent.final_answer"));
        assertTrue(names.indexOf("agent.final_answer") < names.indexOf("pipeline.completed"));

        assertTrue(peakInFlight.get() >= 1);
        assertTrue(peakInFlight.get() <= 2, "peak in-flight solver calls " + peakInFlight.get());
        List<Integer> completedTaskIds = client.transport().frames("solver.completed").stream()
                .map(frame -> frame.path("content").path("taskId").asInt())
                .sorted()
                .toList();
        assertEquals(List.of(1, 2, 3), completedTaskIds);
        assertEquals(1, names.stream().filter("aggregate.start"::equals).count());

        await().atMost(PipelineHarness.WAIT).until(() -> harness.traces.size() == 1);
        assertEquals("completed", harness.traces.get(0).status());
        assertEquals(3, harness.traces.get(0).outcomes().size());
    }

    @Test
    void testSessionEventsCarryGapFreeSequence() {
        harness.properties.getPipeline().setRequireConfirmation(false);
        harness.start(threeTasks, echoSolver, joiner);
        PipelineHarness.Client client = harness.connect();
        client.createSession();
        client.send("user.message", "Write a report");
        client.awaitEvent("pipeline.completed");

        long expected = 1;
        for (JsonNode frame : client.transport().frames()) {
            if (frame.has("seq")) {
                assertEquals(expected++, frame.path("seq").asLong(), "seq of " + frame.path("event").asText());
                assertFalse(frame.path("eventId").asText().isBlank());
            }
        }
        assertTrue(expected > 10);
        assertFalse(client.transport().frames("system.connected").get(0).has("seq"));
    }

    @Test
    void testDeclinedConfirmationCancelsPlan() {
        harness.start(threeTasks, echoSolver, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();
        client.send("user.message", "Write a report");
        String stepId = client.awaitEvent("agent.user_confirm").path("stepId").asText();

        client.send("user.response", stepId, Map.of("confirmed", false));
        JsonNode cancelled = client.awaitEvent("plan.cancelled");

        assertEquals("declined", cancelled.path("content").path("reason").asText());
        harness.awaitStage(sessionId, SessionStage.CANCELLED);
        assertTrue(client.transport().frames("solver.start").isEmpty());
    }

    @Test
    void testResponseWithUnknownStepIsIgnored() throws Exception {
        harness.start(threeTasks, echoSolver, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();
        client.send("user.message", "Write a report");
        String stepId = client.awaitEvent("agent.user_confirm").path("stepId").asText();

        client.send("user.response", "confirm_plan_deadbeef", Map.of("confirmed", true));
        TimeUnit.MILLISECONDS.sleep(200);
        assertEquals(SessionStage.AWAITING_CONFIRM, harness.session(sessionId).stage());

        client.send("user.response", stepId, Map.of("confirmed", true));
        client.awaitEvent("pipeline.completed");

        client.send("user.response", stepId, Map.of("confirmed", false));
        TimeUnit.MILLISECONDS.sleep(200);
        assertEquals(SessionStage.COMPLETED, harness.session(sessionId).stage());
        assertTrue(client.transport().frames("plan.cancelled").isEmpty());
    }

    @Test
    void testConfirmationTimeoutCancelsPlan() {
        harness.properties.getPipeline().setConfirmationTimeout(Duration.ofMillis(200));
        harness.start(threeTasks, echoSolver, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();
        client.send("user.message", "Write a report");

        JsonNode timeout = client.awaitEvent("error.timeout");
        assertEquals("confirmation_timeout", timeout.path("metadata").path("errorCode").asText());
        JsonNode cancelled = client.awaitEvent("plan.cancelled");
        assertEquals("timeout", cancelled.path("content").path("reason").asText());
        harness.awaitStage(sessionId, SessionStage.CANCELLED);
    }

    @Test
    void testEditedTasksReplacePlan() {
        harness.start(threeTasks, echoSolver, joiner);
        PipelineHarness.Client client = harness.connect();
        client.createSession();
        client.send("user.message", "Write a report");
        String stepId = client.awaitEvent("agent.user_confirm").path("stepId").asText();

        client.send("user.response", stepId, Map.of("confirmed", true,
                "tasks", List.of(Map.of("title", "Only section", "objective", "Everything at once"))));
        client.awaitEvent("pipeline.completed");

        List<JsonNode> started = client.transport().frames("solver.start");
        assertEquals(1, started.size());
        assertEquals("Only section", started.get(0).path("content").path("title").asText());
    }

    @Test
    void testMalformedEditedTasksReportCoercionError() {
        harness.start(threeTasks, echoSolver, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();
        client.send("user.message", "Write a report");
        String stepId = client.awaitEvent("agent.user_confirm").path("stepId").asText();

        client.send("user.response", stepId, Map.of("confirmed", true, "tasks", "not a list"));

        JsonNode coercion = client.awaitEvent("plan.coercion_error");
        assertEquals("validation_error", coercion.path("metadata").path("errorCode").asText());
        assertEquals("invalid_tasks", client.awaitEvent("plan.cancelled").path("content").path("reason").asText());
        harness.awaitStage(sessionId, SessionStage.CANCELLED);
    }

    @Test
    void testEmptyPlanMovesSessionToError() {
        harness.start(request -> new PlanResult("nothing", List.of()), echoSolver, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();
        client.send("user.message", "Write a report");

        client.awaitEvent("plan.validation_error");
        JsonNode error = client.awaitEvent("agent.error");
        assertEquals("internal_error", error.path("metadata").path("errorCode").asText());
        harness.awaitStage(sessionId, SessionStage.ERROR);
        await().atMost(PipelineHarness.WAIT).until(() -> !harness.traces.isEmpty());
        assertEquals("error", harness.traces.get(0).status());
    }

    @Test
    void testAggregatorFailureIsReportedAsExecutionError() {
        harness.start(threeTasks, echoSolver, (context, outcomes) -> {
            throw new IllegalStateException("model unavailable");
        });
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();
        client.send("user.message", "Write a report");
        String stepId = client.awaitEvent("agent.user_confirm").path("stepId").asText();
        client.send("user.response", stepId, Map.of("confirmed", true));

        JsonNode failure = client.awaitEvent("error.execution");
        assertTrue(failure.path("content").path("message").asText().contains("model unavailable"));
        client.awaitEvent("agent.error");
        harness.awaitStage(sessionId, SessionStage.ERROR);
        assertTrue(client.transport().frames("pipeline.completed").isEmpty());
    }

    @Test
    void testCancelStopsRunningTasks() {
        harness.properties.getPipeline().setRequireConfirmation(false);
        TaskSolver waitsForCancel = (task, context, token) -> {
            while (!token.isCancelled()) {
                try {
                    TimeUnit.MILLISECONDS.sleep(10);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            token.throwIfCancelled();
            return new TaskResult("late");
        };
        harness.start(threeTasks, waitsForCancel, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();
        client.send("user.message", "Write a report");
        client.awaitEvents("solver.start", 3);

        client.send("user.cancel", null);

        assertEquals("user_cancel", client.awaitEvent("agent.interrupted").path("content").path("reason").asText());
        assertEquals(3, client.awaitEvents("solver.cancelled", 3).size());
        harness.awaitStage(sessionId, SessionStage.CANCELLED);
        assertTrue(client.transport().frames("aggregate.start").isEmpty());
        await().atMost(PipelineHarness.WAIT).until(() -> !harness.traces.isEmpty());
        assertEquals("cancelled", harness.traces.get(0).status());
    }

    @Test
    void testFailedAttemptIsRetriedOnce() {
        harness.properties.getPipeline().setRequireConfirmation(false);
        AtomicInteger calls = new AtomicInteger();
        TaskSolver flaky = (task, context, token) -> {
            if (task.id() == 2 && calls.getAndIncrement() == 0) {
                throw new TaskExecutionException("upstream hiccup");
            }
            return new TaskResult("out-" + task.id());
        };
        harness.start(threeTasks, flaky, joiner);
        PipelineHarness.Client client = harness.connect();
        client.createSession();
        client.send("user.message", "Write a report");
        client.awaitEvent("pipeline.completed");

        JsonNode failed = client.awaitEvent("solver.step_failed");
        assertEquals(2, failed.path("content").path("taskId").asInt());
        assertTrue(failed.path("metadata").path("willRetry").asBoolean());
        JsonNode retry = client.awaitEvent("solver.retry");
        assertEquals(2, retry.path("content").path("nextAttempt").asInt());
        assertEquals(3, client.transport().frames("pipeline.completed").get(0).path("content").path("succeeded").asInt());
    }

    @Test
    void testTaskFailsAfterRetriesAreExhausted() {
        harness.properties.getPipeline().setRequireConfirmation(false);
        TaskSolver alwaysFails = (task, context, token) -> {
            if (task.id() == 3) {
                throw new TaskExecutionException("broken");
            }
            return new TaskResult("out-" + task.id());
        };
        harness.start(threeTasks, alwaysFails, joiner);
        PipelineHarness.Client client = harness.connect();
        client.createSession();
        client.send("user.message", "Write a report");

        JsonNode completed = client.awaitEvent("pipeline.completed");
        assertEquals(2, completed.path("content").path("succeeded").asInt());
        assertEquals(1, completed.path("content").path("failed").asInt());
        List<JsonNode> failures = client.transport().frames("solver.step_failed");
        assertEquals(2, failures.size());
        assertFalse(failures.get(1).path("metadata").path("willRetry").asBoolean());
    }

    @Test
    void testReplanDiscardsRunningWork() {
        harness.properties.getPipeline().setRequireConfirmation(false);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger plans = new AtomicInteger();
        Planner planner = request -> plans.incrementAndGet() == 1
                ? new PlanResult("first", List.of(task(1, "Slow")))
                : new PlanResult("second", List.of(task(1, "Fast")));
        TaskSolver solver = (task, context, token) -> {
            if ("Slow".equals(task.title())) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            return new TaskResult(task.title());
        };
        harness.start(planner, solver, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();
        client.send("user.message", "Write a report");
        client.awaitEvent("solver.start");

        client.send("user.replan", Map.of("question", "Write it faster"));
        JsonNode answer = client.awaitEvent("agent.final_answer");
        release.countDown();

        assertEquals("Fast", answer.path("content").path("answer").asText());
        assertEquals("replan", client.awaitEvent("plan.cancelled").path("content").path("reason").asText());
        assertEquals(2, client.transport().frames("plan.start").size());
        assertEquals(SessionStage.COMPLETED, harness.session(sessionId).stage());
    }

    @Test
    void testSolveTasksRunsWithoutPlanningOrAggregation() {
        harness.start(threeTasks, echoSolver, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();

        client.send("user.solve_tasks", Map.of("tasks", List.of(
                Map.of("title", "A"), Map.of("title", "B"))));

        JsonNode notice = client.awaitEvent("system.notice");
        assertEquals("solve_tasks", notice.path("content").path("action").asText());
        assertEquals(2, notice.path("content").path("succeeded").asInt());
        harness.awaitStage(sessionId, SessionStage.COMPLETED);
        assertTrue(client.transport().frames("plan.start").isEmpty());
        assertTrue(client.transport().frames("aggregate.start").isEmpty());
    }

    @Test
    void testCommandInWrongStageIsRejectedWithoutChangingStage() {
        harness.start(threeTasks, echoSolver, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();

        client.send("user.cancel_task", Map.of("taskId", 1));

        JsonNode error = client.awaitEvent("error.validation");
        assertEquals("validation_error", error.path("metadata").path("errorCode").asText());
        assertEquals(SessionStage.CREATED, harness.session(sessionId).stage());
    }

    @Test
    void testCancelAndRestartSingleTask() {
        harness.properties.getPipeline().setRequireConfirmation(false);
        harness.properties.getPipeline().setConcurrency(1);
        CountDownLatch firstTaskGate = new CountDownLatch(1);
        List<Integer> solved = new ArrayList<>();
        TaskSolver solver = (task, context, token) -> {
            if (task.id() == 1) {
                try {
                    firstTaskGate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            synchronized (solved) {
                solved.add(task.id());
            }
            return new TaskResult("out-" + task.id());
        };
        harness.start(threeTasks, solver, joiner);
        PipelineHarness.Client client = harness.connect();
        String sessionId = client.createSession();
        client.send("user.message", "Write a report");
        client.awaitEvent("solver.start");

        client.send("user.cancel_task", Map.of("taskId", 3));
        JsonNode cancelled = client.awaitEvent("solver.cancelled");
        assertEquals(3, cancelled.path("content").path("taskId").asInt());

        client.send("user.restart_task", Map.of("taskId", 3));
        assertEquals(3, client.awaitEvent("solver.restarted").path("content").path("taskId").asInt());
        firstTaskGate.countDown();

        JsonNode completed = client.awaitEvent("pipeline.completed");
        assertEquals(3, completed.path("content").path("succeeded").asInt());
        assertEquals(SessionStage.COMPLETED, harness.session(sessionId).stage());
        synchronized (solved) {
            assertEquals(List.of(1, 2, 3), solved);
        }
    }
}
