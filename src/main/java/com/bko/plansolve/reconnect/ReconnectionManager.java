package com.bko.plansolve.reconnect;

import com.bko.plansolve.connection.ClientConnection;
import com.bko.plansolve.connection.ConnectionRegistry;
import com.bko.plansolve.error.ReconnectSignatureInvalidException;
import com.bko.plansolve.orchestration.service.PipelineOrchestrator;
import com.bko.plansolve.protocol.ContentReader;
import com.bko.plansolve.protocol.Envelope;
import com.bko.plansolve.protocol.EventType;
import com.bko.plansolve.session.PipelineSession;
import com.bko.plansolve.session.SessionRegistry;
import com.bko.plansolve.stream.EventLog;
import com.bko.plansolve.stream.SessionEventPublisher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Resumes a detached session on a new connection from a signed snapshot, replaying every
 * buffered event after the client's last known position before live events continue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconnectionManager {

    private final StateSigner signer;
    private final SessionRegistry sessionRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final EventLog eventLog;
    private final SessionEventPublisher publisher;
    private final PipelineOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    /**
     * Verifies the presented state and attaches the session to {@code connection}. Verification
     * failures leave the session detached with its buffer intact.
     *
     * @throws ReconnectSignatureInvalidException if the signed state is missing, forged, expired
     *         or belongs to another session
     * @throws com.bko.plansolve.error.SessionNotFoundException if the session is unknown
     */
    public void reconnect(ClientConnection connection, Envelope envelope) {
        JsonNode content = envelope.content();
        SignedState signed = readSignedState(content.get("signedState"));
        JsonNode state = signer.verify(signed);
        String sessionId = envelope.sessionId();
        if (!state.path("sessionId").asText().equals(sessionId)) {
            throw new ReconnectSignatureInvalidException("Signed state belongs to a different session");
        }
        PipelineSession session = sessionRegistry.require(sessionId);
        OptionalLong lastSeq = ContentReader.number(content, "lastSeq");
        Optional<String> lastEventId = ContentReader.text(content, "lastEventId");

        connectionRegistry.attach(connection.id(), sessionId)
                .flatMap(sessionRegistry::find)
                .ifPresent(previous -> orchestrator.submit(previous, "detach", () -> previous.detach(connection.id())));
        orchestrator.submit(session, "reconnect", () -> resume(session, connection.id(), lastSeq, lastEventId));
    }

    private void resume(PipelineSession session, String connectionId, OptionalLong lastSeq, Optional<String> lastEventId) {
        String previous = session.connectionId();
        if (previous != null && !previous.equals(connectionId)) {
            connectionRegistry.detach(previous, session.id());
            connectionRegistry.notify(previous, EventType.SYSTEM_NOTICE, session.id(),
                    Map.of("message", "Session resumed on another connection"), Map.of());
            log.info("Session {} taken over from connection {} by {}", session.id(), previous, connectionId);
        }
        session.attach(connectionId);

        long afterSeq = resolvePosition(session, lastSeq, lastEventId);
        List<Envelope> pending = eventLog.replayFrom(session.id(), afterSeq);
        int replayed = publisher.replay(session, pending);

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("sessionId", session.id());
        content.put("stage", session.stage().name());
        content.put("replayed", replayed);
        content.put("lastSeq", eventLog.lastSeq(session.id()));
        publisher.emit(session, EventType.AGENT_STATE_RESTORED, content, Map.of("replayedFrom", afterSeq));
        log.info("Session {} resumed on connection {} ({} events replayed after seq {})",
                session.id(), connectionId, replayed, afterSeq);
    }

    private long resolvePosition(PipelineSession session, OptionalLong lastSeq, Optional<String> lastEventId) {
        if (lastSeq.isPresent()) {
            return Math.max(0L, lastSeq.getAsLong());
        }
        if (lastEventId.isPresent()) {
            OptionalLong seq = eventLog.seqOf(session.id(), lastEventId.get());
            if (seq.isPresent()) {
                return seq.getAsLong();
            }
        }
        return eventLog.acknowledgedSeq(session.id());
    }

    private SignedState readSignedState(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ReconnectSignatureInvalidException("signedState is required");
        }
        try {
            return objectMapper.treeToValue(node, SignedState.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new ReconnectSignatureInvalidException("Malformed signed state", ex);
        }
    }
}
