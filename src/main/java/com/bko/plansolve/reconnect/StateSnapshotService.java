package com.bko.plansolve.reconnect;

import com.bko.plansolve.confirm.PendingConfirmation;
import com.bko.plansolve.orchestration.model.SectionTask;
import com.bko.plansolve.orchestration.service.SolverRun;
import com.bko.plansolve.protocol.EventType;
import com.bko.plansolve.session.PipelineSession;
import com.bko.plansolve.stream.EventLog;
import com.bko.plansolve.stream.SessionEventPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds and exports signed session snapshots. Runs on the session mailbox.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StateSnapshotService {

    private final StateSigner signer;
    private final EventLog eventLog;
    private final SessionEventPublisher publisher;
    private final ObjectMapper objectMapper;

    public ObjectNode snapshot(PipelineSession session) {
        ObjectNode state = objectMapper.createObjectNode();
        state.put("sessionId", session.id());
        state.put("stage", session.stage().name());
        state.put("lastSeq", eventLog.lastSeq(session.id()));
        state.put("createdAt", session.createdAt().toString());
        state.put("lastActiveAt", session.lastActiveAt().toString());
        ArrayNode confirmations = state.putArray("pendingConfirmations");
        for (PendingConfirmation pending : session.correlator().pending()) {
            confirmations.addObject()
                    .put("stepId", pending.stepId())
                    .put("deadline", pending.deadline().toString());
        }
        ArrayNode tasks = state.putArray("tasks");
        SolverRun run = session.solverRun();
        if (run != null) {
            for (SectionTask task : run.tasks()) {
                tasks.addObject()
                        .put("id", task.id())
                        .put("title", task.spec().title())
                        .put("state", task.state().name())
                        .put("attempts", task.attempts());
            }
        }
        return state;
    }

    public SignedState export(PipelineSession session) {
        SignedState signed = signer.sign(snapshot(session));
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("sessionId", session.id());
        content.put("stage", session.stage().name());
        content.put("lastSeq", signed.state().path("lastSeq").asLong());
        publisher.emit(session, EventType.AGENT_STATE_EXPORTED, content, Map.of("signedState", signed));
        log.debug("Exported state of session {} at seq {}", session.id(), content.get("lastSeq"));
        return signed;
    }
}
