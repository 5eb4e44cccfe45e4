package com.bko.plansolve.connection;

import com.bko.plansolve.support.SerialExecutor;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * A live transport channel. Inbound frames are handled one at a time on {@link #inbound()}.
 * Closing the connection never destroys the session attached to it.
 */
public class ClientConnection {

    private final String id;
    private final Transport transport;
    private final SerialExecutor inbound;
    private final Instant openedAt;
    private volatile Instant lastSeenAt;
    private volatile String attachedSessionId;
    private volatile Instant awaitingPongSince;
    private volatile boolean deliveryFailed;

    public ClientConnection(String id, Transport transport, SerialExecutor inbound, Instant openedAt) {
        this.id = id;
        this.transport = transport;
        this.inbound = inbound;
        this.openedAt = openedAt;
        this.lastSeenAt = openedAt;
    }

    public String id() {
        return id;
    }

    public Transport transport() {
        return transport;
    }

    public SerialExecutor inbound() {
        return inbound;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public Instant lastSeenAt() {
        return lastSeenAt;
    }

    /**
     * Records traffic from the client. Any frame or pong proves the peer is alive and answers an outstanding ping.
     */
    public void markSeen(Instant now) {
        lastSeenAt = now;
        awaitingPongSince = null;
    }

    /**
     * Instant of the oldest ping the client has not answered yet.
     */
    @Nullable
    public Instant awaitingPongSince() {
        return awaitingPongSince;
    }

    void pingSent(Instant now) {
        if (awaitingPongSince == null) {
            awaitingPongSince = now;
        }
    }

    public boolean deliveryFailed() {
        return deliveryFailed;
    }

    void markDeliveryFailed() {
        deliveryFailed = true;
    }

    @Nullable
    public String attachedSessionId() {
        return attachedSessionId;
    }

    void setAttachedSessionId(@Nullable String sessionId) {
        this.attachedSessionId = sessionId;
    }
}
