package com.bko.plansolve.stream;

import com.bko.plansolve.connection.ConnectionRegistry;
import com.bko.plansolve.error.PlanSolveException;
import com.bko.plansolve.protocol.Envelope;
import com.bko.plansolve.protocol.EnvelopeCodec;
import com.bko.plansolve.protocol.EventType;
import com.bko.plansolve.session.PipelineSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits session events: stamps them in the {@link EventLog} and forwards them to the attached
 * connection, if there is one. Must be called from the session's mailbox so that transmission
 * order equals seq order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionEventPublisher {

    private final EventLog eventLog;
    private final ConnectionRegistry connectionRegistry;
    private final EnvelopeCodec codec;
    private final Clock clock;

    public Envelope emit(PipelineSession session, EventType type, @Nullable Object content) {
        return emit(session, type, null, content, Map.of());
    }

    public Envelope emit(PipelineSession session, EventType type, @Nullable Object content, Map<String, Object> metadata) {
        return emit(session, type, null, content, metadata);
    }

    public Envelope emit(PipelineSession session, EventType type, @Nullable String stepId,
                         @Nullable Object content, Map<String, Object> metadata) {
        Envelope envelope = codec.outbound(type, session.id(), stepId, clock.instant(), content, metadata)
                .withConnectionId(session.connectionId());
        Envelope stamped = eventLog.append(envelope);
        session.touch(stamped.timestamp());
        String connectionId = session.connectionId();
        if (connectionId != null) {
            connectionRegistry.send(connectionId, stamped);
        }
        log.debug("Session {} emitted {} seq={}", session.id(), type.wireName(), stamped.seq());
        return stamped;
    }

    public Envelope emitError(PipelineSession session, EventType type, PlanSolveException error) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("errorCode", error.getErrorCode().wireValue());
        return emit(session, type, Map.of("message", String.valueOf(error.getMessage())), metadata);
    }

    /**
     * Re-sends already stamped events to the session's current connection, preserving their seq.
     */
    public int replay(PipelineSession session, List<Envelope> events) {
        String connectionId = session.connectionId();
        if (connectionId == null) {
            return 0;
        }
        int sent = 0;
        for (Envelope event : events) {
            if (connectionRegistry.send(connectionId, event)) {
                sent++;
            }
        }
        return sent;
    }
}
