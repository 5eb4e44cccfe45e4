package com.bko.plansolve.connection;

import com.bko.plansolve.error.PlanSolveException;
import com.bko.plansolve.protocol.Envelope;
import com.bko.plansolve.protocol.EnvelopeCodec;
import com.bko.plansolve.protocol.EventType;
import com.bko.plansolve.support.SerialExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Process-wide map of live connections. The only structure shared between inbound dispatch,
 * session mailboxes and the heartbeat timer.
 */
@Component
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final EnvelopeCodec codec;
    private final ExecutorService orchestrationExecutor;
    private final Clock clock;
    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

    public ConnectionRegistry(EnvelopeCodec codec,
                              @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor,
                              Clock clock) {
        this.codec = codec;
        this.orchestrationExecutor = orchestrationExecutor;
        this.clock = clock;
    }

    public ClientConnection register(Transport transport) {
        String id = UUID.randomUUID().toString();
        ClientConnection connection = new ClientConnection(id, transport,
                new SerialExecutor(orchestrationExecutor, "connection-" + id), clock.instant());
        connections.put(id, connection);
        log.info("Connection {} opened ({} active)", id, connections.size());
        notify(id, EventType.SYSTEM_CONNECTED, null, Map.of("connectionId", id), Map.of());
        return connection;
    }

    /**
     * Forgets the connection. Its attached session, if any, stays alive and keeps buffering.
     */
    public Optional<ClientConnection> unregister(String connectionId) {
        ClientConnection removed = connectionId == null ? null : connections.remove(connectionId);
        if (removed != null) {
            log.info("Connection {} closed ({} active)", connectionId, connections.size());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<ClientConnection> find(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Collection<ClientConnection> all() {
        return List.copyOf(connections.values());
    }

    public int size() {
        return connections.size();
    }

    /**
     * Binds a session to a connection.
     *
     * @return the session previously attached to that connection, if any
     */
    public Optional<String> attach(String connectionId, String sessionId) {
        ClientConnection connection = connections.get(connectionId);
        if (connection == null) {
            return Optional.empty();
        }
        String previous = connection.attachedSessionId();
        connection.setAttachedSessionId(sessionId);
        return previous == null || previous.equals(sessionId) ? Optional.empty() : Optional.of(previous);
    }

    public void detach(String connectionId, String sessionId) {
        ClientConnection connection = connections.get(connectionId);
        if (connection != null && sessionId.equals(connection.attachedSessionId())) {
            connection.setAttachedSessionId(null);
        }
    }

    /**
     * Sends an already built envelope. Failures are logged; sequenced events stay in the
     * session's replay buffer either way.
     *
     * @return {@code true} when the frame was handed to an open transport
     */
    public boolean send(String connectionId, Envelope envelope) {
        ClientConnection connection = connectionId == null ? null : connections.get(connectionId);
        if (connection == null || !connection.transport().isOpen()) {
            return false;
        }
        try {
            connection.transport().send(codec.encode(envelope.withConnectionId(connectionId)));
            return true;
        } catch (IOException | PlanSolveException ex) {
            log.debug("Failed to send {} to connection {}: {}", envelope.event(), connectionId, ex.getMessage());
            return false;
        }
    }

    /**
     * Sends a connection-level event that is neither sequenced nor buffered.
     */
    public boolean notify(String connectionId, EventType type, @Nullable String sessionId,
                          @Nullable Object content, Map<String, Object> metadata) {
        Envelope envelope;
        try {
            envelope = codec.outbound(type, sessionId, null, clock.instant(), content, metadata);
        } catch (PlanSolveException ex) {
            log.warn("Dropping {} for connection {}: {}", type.wireName(), connectionId, ex.getMessage());
            return false;
        }
        return send(connectionId, envelope);
    }

    public void notifyError(String connectionId, EventType type, @Nullable String sessionId, PlanSolveException error) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("errorCode", error.getErrorCode().wireValue());
        notify(connectionId, type, sessionId, Map.of("message", String.valueOf(error.getMessage())), metadata);
    }

    public void recordPong(String connectionId) {
        find(connectionId).ifPresent(connection -> connection.markSeen(clock.instant()));
    }

    /**
     * Sends {@code system.heartbeat} plus a transport ping to every connection. A connection that
     * cannot take either is flagged for the next {@link #evictSilent} sweep.
     *
     * @return the number of connections that received both
     */
    public int broadcastHeartbeat(int activeSessions) {
        int delivered = 0;
        Instant now = clock.instant();
        for (ClientConnection connection : connections.values()) {
            boolean sent = notify(connection.id(), EventType.SYSTEM_HEARTBEAT, connection.attachedSessionId(),
                    Map.of("activeSessions", activeSessions, "activeConnections", connections.size()), Map.of());
            if (sent && ping(connection)) {
                connection.pingSent(now);
                delivered++;
            } else {
                connection.markDeliveryFailed();
            }
        }
        return delivered;
    }

    private boolean ping(ClientConnection connection) {
        try {
            connection.transport().ping();
            return true;
        } catch (IOException ex) {
            log.debug("Failed to ping connection {}: {}", connection.id(), ex.getMessage());
            return false;
        }
    }

    /**
     * Closes connections that are provably dead: the transport is closed, a heartbeat could not be
     * delivered, or a ping went unanswered for longer than {@code livenessTimeout}. A client that
     * simply has nothing to say stays connected as long as it answers pings.
     *
     * @return the evicted connections
     */
    public List<ClientConnection> evictSilent(Duration livenessTimeout) {
        Instant cutoff = clock.instant().minus(livenessTimeout);
        List<ClientConnection> evicted = new ArrayList<>();
        for (ClientConnection connection : connections.values()) {
            Instant awaitingPong = connection.awaitingPongSince();
            if (!connection.transport().isOpen()
                    || connection.deliveryFailed()
                    || (awaitingPong != null && awaitingPong.isBefore(cutoff))) {
                evicted.add(connection);
            }
        }
        for (ClientConnection connection : evicted) {
            log.warn("Connection {} unresponsive (last seen {}); closing", connection.id(), connection.lastSeenAt());
            connections.remove(connection.id());
            connection.transport().close("liveness timeout");
        }
        return evicted;
    }
}
