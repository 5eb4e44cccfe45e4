package com.bko.plansolve.protocol;

import com.bko.plansolve.error.ErrorCode;
import com.bko.plansolve.error.PlanSolveException;
import com.bko.plansolve.error.ProtocolException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts envelopes to and from their JSON wire form. Only the envelope shape is checked
 * here; content is validated by whoever handles the event.
 * <p>
 * Integral numbers are always read as {@code long}, and outbound envelopes are built through
 * {@link #outbound} with the same reader, so a decoded envelope equals the one that was encoded.
 */
@Component
@Slf4j
public class EnvelopeCodec {

    private static final Pattern EVENT_NAME = Pattern.compile("^[a-z][a-z0-9_]*\\.[a-z][a-z0-9_]*$");
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ObjectReader wireReader;
    private final Clock clock;

    public EnvelopeCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.wireReader = objectMapper.reader().with(DeserializationFeature.USE_LONG_FOR_INTS);
        this.clock = clock;
    }

    /**
     * Builds an outbound envelope whose content and metadata hold exactly what a client decoding
     * the frame will see.
     */
    public Envelope outbound(EventType type, @Nullable String sessionId, @Nullable String stepId, Instant timestamp,
                             @Nullable Object content, Map<String, Object> metadata) {
        return Envelope.of(type, sessionId, stepId, timestamp, toWireContent(content), toWireMetadata(metadata));
    }

    JsonNode toWireContent(@Nullable Object content) {
        if (content == null) {
            return NullNode.getInstance();
        }
        try {
            return wireReader.readTree(objectMapper.writeValueAsBytes(content));
        } catch (IOException ex) {
            throw new PlanSolveException(ErrorCode.INTERNAL, "Failed to convert content of type "
                    + content.getClass().getSimpleName(), ex);
        }
    }

    Map<String, Object> toWireMetadata(Map<String, Object> metadata) {
        if (metadata.isEmpty()) {
            return Map.of();
        }
        try {
            return wireReader.forType(METADATA_TYPE).readValue(objectMapper.writeValueAsBytes(metadata));
        } catch (IOException ex) {
            throw new PlanSolveException(ErrorCode.INTERNAL, "Failed to convert metadata", ex);
        }
    }

    public byte[] encode(Envelope envelope) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("event", envelope.event());
        putIfPresent(node, "sessionId", envelope.sessionId());
        putIfPresent(node, "connectionId", envelope.connectionId());
        putIfPresent(node, "stepId", envelope.stepId());
        node.put("timestamp", envelope.timestamp().toString());
        if (!envelope.content().isNull()) {
            node.set("content", envelope.content());
        }
        if (!envelope.metadata().isEmpty()) {
            node.set("metadata", objectMapper.valueToTree(envelope.metadata()));
        }
        if (envelope.seq() != null) {
            node.put("seq", envelope.seq());
        }
        putIfPresent(node, "eventId", envelope.eventId());
        try {
            return objectMapper.writeValueAsBytes(node);
        } catch (JsonProcessingException ex) {
            throw new PlanSolveException(ErrorCode.INTERNAL, "Failed to encode event " + envelope.event(), ex);
        }
    }

    public String encodeToString(Envelope envelope) {
        return new String(encode(envelope), StandardCharsets.UTF_8);
    }

    public Envelope decode(String payload) {
        return decode(payload.getBytes(StandardCharsets.UTF_8));
    }

    public Envelope decode(byte[] payload) {
        JsonNode root;
        try {
            root = wireReader.readTree(payload);
        } catch (IOException ex) {
            throw new ProtocolException("Payload is not valid JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Payload must be a JSON object");
        }
        JsonNode eventNode = root.get("event");
        if (eventNode == null || !eventNode.isTextual() || !EVENT_NAME.matcher(eventNode.asText()).matches()) {
            throw new ProtocolException("Missing or malformed event name");
        }
        String event = eventNode.asText();
        String sessionId = text(root, "sessionId");
        if (!StringUtils.hasText(sessionId) && EventType.fromWire(event) != EventType.USER_CREATE_SESSION) {
            throw new ProtocolException("sessionId is required for " + event);
        }
        JsonNode content = root.hasNonNull("content") ? root.get("content") : NullNode.getInstance();
        JsonNode seqNode = root.get("seq");
        Long seq = seqNode != null && seqNode.canConvertToLong() ? seqNode.asLong() : null;
        return new Envelope(
                event,
                sessionId,
                text(root, "connectionId"),
                text(root, "stepId"),
                parseTimestamp(root.get("timestamp")),
                content,
                parseMetadata(root.get("metadata")),
                seq,
                text(root, "eventId"));
    }

    private Map<String, Object> parseMetadata(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        try {
            return wireReader.forType(METADATA_TYPE).readValue(node);
        } catch (IOException ex) {
            throw new ProtocolException("Malformed metadata", ex);
        }
    }

    private Instant parseTimestamp(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return clock.instant();
        }
        String value = node.asText();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException nested) {
                log.debug("Unparsable timestamp {}, using receive time", value);
                return clock.instant();
            }
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : null;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
