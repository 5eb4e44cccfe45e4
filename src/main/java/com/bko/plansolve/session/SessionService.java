package com.bko.plansolve.session;

import com.bko.plansolve.connection.ClientConnection;
import com.bko.plansolve.connection.ConnectionRegistry;
import com.bko.plansolve.error.ProtocolException;
import com.bko.plansolve.error.SessionNotFoundException;
import com.bko.plansolve.error.ValidationException;
import com.bko.plansolve.orchestration.model.PlanContext;
import com.bko.plansolve.orchestration.model.SectionTask;
import com.bko.plansolve.orchestration.model.TaskSpec;
import com.bko.plansolve.orchestration.service.PipelineOrchestrator;
import com.bko.plansolve.orchestration.service.SolverRun;
import com.bko.plansolve.orchestration.service.TaskListMapper;
import com.bko.plansolve.protocol.ContentReader;
import com.bko.plansolve.protocol.Envelope;
import com.bko.plansolve.protocol.EventType;
import com.bko.plansolve.reconnect.ReconnectionManager;
import com.bko.plansolve.reconnect.StateSnapshotService;
import com.bko.plansolve.stream.EventLog;
import com.bko.plansolve.stream.SessionEventPublisher;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * Routes decoded inbound events to the owning session. Runs on the connection's inbound
 * executor; every state change is handed to the session mailbox.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService {

    private final SessionRegistry sessionRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final PipelineOrchestrator orchestrator;
    private final SessionEventPublisher publisher;
    private final EventLog eventLog;
    private final ReconnectionManager reconnectionManager;
    private final StateSnapshotService stateSnapshotService;
    private final TaskListMapper taskListMapper;
    private final Clock clock;

    public void handle(ClientConnection connection, Envelope envelope) {
        EventType type = envelope.type();
        switch (type) {
            case USER_CREATE_SESSION -> createSession(connection);
            case USER_RECONNECT_WITH_STATE -> reconnectionManager.reconnect(connection, envelope);
            case USER_MESSAGE, USER_RESPONSE, USER_CANCEL, USER_CANCEL_TASK, USER_RESTART_TASK, USER_CANCEL_PLAN,
                 USER_REPLAN, USER_SOLVE_TASKS, USER_ACK, USER_REQUEST_STATE ->
                    route(requireOwned(connection, envelope.sessionId()), type, envelope);
            default -> throw new ProtocolException("Unsupported event " + envelope.event());
        }
    }

    public PipelineSession createSession(ClientConnection connection) {
        PipelineSession session = sessionRegistry.create(connection.id());
        connectionRegistry.attach(connection.id(), session.id())
                .flatMap(sessionRegistry::find)
                .ifPresent(previous -> orchestrator.submit(previous, "detach", () -> previous.detach(connection.id())));
        orchestrator.submit(session, "create_session", () -> publisher.emit(session, EventType.AGENT_SESSION_CREATED,
                Map.of("sessionId", session.id()), Map.of("connectionId", connection.id())));
        return session;
    }

    private void route(PipelineSession session, EventType type, Envelope envelope) {
        session.touch(clock.instant());
        JsonNode content = envelope.content();
        switch (type) {
            case USER_MESSAGE -> orchestrator.submit(session, "message", () -> orchestrator.startPipeline(session,
                    ContentReader.textOrField(content, "question", "message", "text")
                            .orElseThrow(() -> new ValidationException("Message content is empty"))));
            case USER_RESPONSE -> orchestrator.submit(session, "response", () -> orchestrator.handleResponse(session,
                    envelope.stepId() != null ? envelope.stepId() : ContentReader.text(content, "stepId").orElse(null),
                    ContentReader.flag(content, "confirmed"),
                    content.get("tasks")));
            case USER_CANCEL -> orchestrator.submit(session, "cancel", () -> orchestrator.cancel(session, "user_cancel"));
            case USER_CANCEL_TASK -> orchestrator.submit(session, "cancel_task",
                    () -> orchestrator.cancelTask(session, ContentReader.requiredTaskId(content)));
            case USER_RESTART_TASK -> orchestrator.submit(session, "restart_task",
                    () -> orchestrator.restartTask(session, ContentReader.requiredTaskId(content)));
            case USER_CANCEL_PLAN -> orchestrator.submit(session, "cancel_plan", () -> orchestrator.cancelPlan(session));
            case USER_REPLAN -> orchestrator.submit(session, "replan", () -> orchestrator.replan(session,
                    ContentReader.textOrField(content, "question", "message").orElse(null)));
            case USER_SOLVE_TASKS -> orchestrator.submit(session, "solve_tasks", () -> {
                List<TaskSpec> tasks = taskListMapper.fromJson(content);
                orchestrator.solveTasks(session, tasks,
                        ContentReader.text(content, "question").orElse(null),
                        ContentReader.text(content, "planSummary").orElse(null));
            });
            case USER_ACK -> orchestrator.submit(session, "ack", () -> acknowledge(session, content));
            case USER_REQUEST_STATE -> orchestrator.submit(session, "request_state", () -> stateSnapshotService.export(session));
            default -> throw new ProtocolException("Unsupported event " + envelope.event());
        }
    }

    private void acknowledge(PipelineSession session, JsonNode content) {
        OptionalLong lastSeq = ContentReader.number(content, "lastSeq");
        if (lastSeq.isPresent()) {
            eventLog.acknowledge(session.id(), lastSeq.getAsLong());
            return;
        }
        String lastEventId = ContentReader.text(content, "lastEventId")
                .orElseThrow(() -> new ValidationException("ack requires lastSeq or lastEventId"));
        eventLog.acknowledgeEventId(session.id(), lastEventId);
    }

    private PipelineSession requireOwned(ClientConnection connection, String sessionId) {
        PipelineSession session = sessionRegistry.require(sessionId);
        if (!connection.id().equals(session.connectionId())) {
            log.warn("Connection {} addressed session {} owned by {}", connection.id(), sessionId, session.connectionId());
            throw new SessionNotFoundException(sessionId, "Session does not belong to this connection");
        }
        return session;
    }

    /**
     * Detaches the connection's session, which keeps running and buffering until it is resumed or evicted.
     */
    public void onConnectionClosed(ClientConnection connection) {
        String sessionId = connection.attachedSessionId();
        sessionRegistry.find(sessionId).ifPresent(session -> orchestrator.submit(session, "detach", () -> {
            if (session.detach(connection.id())) {
                log.info("Session {} detached from connection {}; buffering {} events",
                        session.id(), connection.id(), eventLog.buffered(session.id()));
            }
        }));
    }

    /**
     * @return how many sessions were scheduled for eviction
     */
    public int evictIdle(Duration idleTimeout) {
        List<PipelineSession> idle = sessionRegistry.idleSessions(idleTimeout);
        for (PipelineSession session : idle) {
            orchestrator.submit(session, "evict", () -> {
                if (session.isAttached()) {
                    return;
                }
                orchestrator.shutdown(session);
                sessionRegistry.remove(session.id());
                eventLog.remove(session.id());
                log.info("Session {} evicted after {} idle", session.id(), idleTimeout);
            });
        }
        return idle.size();
    }

    /**
     * Diagnostic view of a session, read on its mailbox.
     */
    public CompletableFuture<SessionView> describe(String sessionId) {
        PipelineSession session = sessionRegistry.require(sessionId);
        CompletableFuture<SessionView> view = new CompletableFuture<>();
        session.mailbox().execute(() -> {
            try {
                view.complete(toView(session));
            } catch (RuntimeException ex) {
                view.completeExceptionally(ex);
            }
        });
        return view;
    }

    private SessionView toView(PipelineSession session) {
        SolverRun run = session.solverRun();
        List<SessionView.TaskView> tasks = run == null ? List.of() : run.tasks().stream()
                .map(SessionService::toTaskView)
                .toList();
        PlanContext context = session.planContext();
        return new SessionView(
                session.id(),
                session.stage().name(),
                session.connectionId(),
                context != null ? context.question() : null,
                context != null ? context.planSummary() : null,
                session.pendingStepId(),
                eventLog.lastSeq(session.id()),
                eventLog.acknowledgedSeq(session.id()),
                eventLog.buffered(session.id()),
                tasks,
                session.createdAt(),
                session.lastActiveAt());
    }

    private static SessionView.TaskView toTaskView(SectionTask task) {
        return new SessionView.TaskView(task.id(), task.spec().title(), task.state().name(), task.attempts(), task.lastError());
    }
}
