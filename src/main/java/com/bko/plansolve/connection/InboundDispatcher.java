package com.bko.plansolve.connection;

import com.bko.plansolve.error.ErrorCode;
import com.bko.plansolve.error.PlanSolveException;
import com.bko.plansolve.error.ProtocolException;
import com.bko.plansolve.protocol.Envelope;
import com.bko.plansolve.protocol.EnvelopeCodec;
import com.bko.plansolve.protocol.EventType;
import com.bko.plansolve.session.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Per-connection inbound loop: frames are queued on the connection's serial executor, decoded
 * and routed to the owning session. Failures are reported to the offending connection only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundDispatcher {

    private final EnvelopeCodec codec;
    private final SessionService sessionService;
    private final ConnectionRegistry connectionRegistry;
    private final Clock clock;

    public void submit(ClientConnection connection, byte[] payload) {
        connection.inbound().execute(() -> dispatch(connection, payload));
    }

    void dispatch(ClientConnection connection, byte[] payload) {
        connection.markSeen(clock.instant());
        Envelope envelope;
        try {
            envelope = codec.decode(payload);
        } catch (ProtocolException ex) {
            log.warn("Rejected frame from connection {}: {}", connection.id(), ex.getMessage());
            connectionRegistry.notifyError(connection.id(), EventType.SYSTEM_ERROR, null, ex);
            return;
        }
        log.debug("Connection {} received {} for session {}", connection.id(), envelope.event(), envelope.sessionId());
        if (envelope.type() == EventType.UNRECOGNIZED) {
            log.debug("Ignoring unknown event {} from connection {}", envelope.event(), connection.id());
            return;
        }
        try {
            if (!envelope.type().isInbound()) {
                throw new ProtocolException("Event " + envelope.event() + " is not accepted from clients");
            }
            sessionService.handle(connection, envelope);
        } catch (ProtocolException ex) {
            log.warn("Rejected {} from connection {}: {}", envelope.event(), connection.id(), ex.getMessage());
            connectionRegistry.notifyError(connection.id(), EventType.SYSTEM_ERROR, envelope.sessionId(), ex);
        } catch (PlanSolveException ex) {
            log.warn("Failed {} from connection {}: {}", envelope.event(), connection.id(), ex.getMessage());
            connectionRegistry.notifyError(connection.id(), EventType.AGENT_ERROR, envelope.sessionId(), ex);
        } catch (RuntimeException ex) {
            log.error("Unexpected failure handling {} from connection {}", envelope.event(), connection.id(), ex);
            connectionRegistry.notifyError(connection.id(), EventType.SYSTEM_ERROR, envelope.sessionId(),
                    new PlanSolveException(ErrorCode.INTERNAL, "Internal error handling " + envelope.event(), ex));
        }
    }
}
