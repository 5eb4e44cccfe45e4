package com.bko.plansolve.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unit exchanged over the transport. {@code seq} and {@code eventId} are assigned when the
 * event is appended to a session's event log and stay {@code null} for connection-level events.
 */
public record Envelope(
        String event,
        @Nullable String sessionId,
        @Nullable String connectionId,
        @Nullable String stepId,
        Instant timestamp,
        JsonNode content,
        Map<String, Object> metadata,
        @Nullable Long seq,
        @Nullable String eventId
) {

    public Envelope {
        content = content != null ? content : NullNode.getInstance();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static Envelope of(EventType type, @Nullable String sessionId, @Nullable String stepId,
                              Instant timestamp, JsonNode content, Map<String, Object> metadata) {
        return new Envelope(type.wireName(), sessionId, null, stepId, timestamp, content, metadata, null, null);
    }

    public EventType type() {
        return EventType.fromWire(event);
    }

    public boolean isSequenced() {
        return seq != null;
    }

    public Envelope withSequence(long seq, String eventId) {
        return new Envelope(event, sessionId, connectionId, stepId, timestamp, content, metadata, seq, eventId);
    }

    public Envelope withConnectionId(@Nullable String connectionId) {
        return new Envelope(event, sessionId, connectionId, stepId, timestamp, content, metadata, seq, eventId);
    }
}
