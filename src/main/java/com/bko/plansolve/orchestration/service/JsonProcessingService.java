package com.bko.plansolve.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Pulls JSON payloads out of model responses that may wrap them in prose or code fences.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private static final int LOG_SNIPPET_LENGTH = 240;
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public <T> @Nullable T parseJsonResponse(String label, @Nullable String raw, Class<T> type) {
        return parseJsonResponse(label, raw, type, null);
    }

    /**
     * Binds the first JSON value of {@code raw} to {@code type}. A bare array is accepted when
     * {@code arrayField} names the property it stands for.
     *
     * @return the bound value, or {@code null} when the response holds no usable JSON
     */
    public <T> @Nullable T parseJsonResponse(String label, @Nullable String raw, Class<T> type,
                                             @Nullable String arrayField) {
        JsonNode node = readJson(label, raw);
        if (node == null) {
            return null;
        }
        if (node.isArray()) {
            if (arrayField == null) {
                log.warn("Expected a JSON object for {} but got an array.", label);
                return null;
            }
            ObjectNode wrapper = objectMapper.createObjectNode();
            wrapper.set(arrayField, node);
            node = wrapper;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("{} response does not match {}: {}", label, type.getSimpleName(), ex.getMessage());
            return null;
        }
    }

    @Nullable
    JsonNode readJson(String label, @Nullable String raw) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty response for {}. Unable to parse JSON.", label);
            return null;
        }
        String candidate = extractJson(stripFence(raw.trim()));
        if (candidate == null) {
            log.warn("No JSON found in {} response. Snippet: {}", label, snippet(raw));
            return null;
        }
        try {
            return objectMapper.readTree(candidate);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to parse {} response as JSON. Snippet: {}", label, snippet(raw));
            return null;
        }
    }

    private static String stripFence(String text) {
        int open = text.indexOf(FENCE);
        if (open < 0) {
            return text;
        }
        int bodyStart = text.indexOf('\n', open);
        int close = bodyStart < 0 ? -1 : text.indexOf(FENCE, bodyStart);
        return close < 0 ? text : text.substring(bodyStart + 1, close).trim();
    }

    private static @Nullable String extractJson(String text) {
        int objectStart = text.indexOf('{');
        int arrayStart = text.indexOf('[');
        boolean array = arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart);
        int start = array ? arrayStart : objectStart;
        int end = text.lastIndexOf(array ? ']' : '}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }

    private static String snippet(String raw) {
        String flat = raw.replace("\r", " ").replace("\n", " ").trim();
        return flat.length() <= LOG_SNIPPET_LENGTH ? flat : flat.substring(0, LOG_SNIPPET_LENGTH) + "...";
    }
}
