package com.bko.plansolve.protocol;

import com.bko.plansolve.error.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Lenient accessors for inbound envelope content, which clients send either as a bare value
 * or as an object wrapping it.
 */
public final class ContentReader {

    private ContentReader() {
    }

    public static Optional<String> text(JsonNode content, String field) {
        if (content == null) {
            return Optional.empty();
        }
        JsonNode value = content.get(field);
        if (value == null || !value.isValueNode() || value.isNull()) {
            return Optional.empty();
        }
        String text = value.asText();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    /**
     * The text of a bare string payload, or the first of {@code fields} present in an object payload.
     */
    public static Optional<String> textOrField(JsonNode content, String... fields) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return Optional.empty();
        }
        if (content.isTextual()) {
            return content.asText().isBlank() ? Optional.empty() : Optional.of(content.asText());
        }
        for (String field : fields) {
            Optional<String> value = text(content, field);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public static OptionalLong number(JsonNode content, String field) {
        if (content == null) {
            return OptionalLong.empty();
        }
        if (content.isIntegralNumber()) {
            return OptionalLong.of(content.asLong());
        }
        JsonNode value = content.get(field);
        if (value == null) {
            return OptionalLong.empty();
        }
        if (value.isIntegralNumber()) {
            return OptionalLong.of(value.asLong());
        }
        if (value.isTextual()) {
            try {
                return OptionalLong.of(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException ex) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    public static int requiredTaskId(JsonNode content) {
        OptionalLong taskId = number(content, "taskId");
        if (taskId.isEmpty() || taskId.getAsLong() < 1 || taskId.getAsLong() > Integer.MAX_VALUE) {
            throw new ValidationException("A positive taskId is required");
        }
        return (int) taskId.getAsLong();
    }

    public static boolean flag(JsonNode content, String field) {
        if (content == null) {
            return false;
        }
        JsonNode value = content.get(field);
        if (value == null) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return value.isTextual() && Boolean.parseBoolean(value.asText());
    }
}
