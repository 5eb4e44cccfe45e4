package com.bko.plansolve.orchestration.service;

import com.bko.plansolve.error.ValidationException;
import com.bko.plansolve.orchestration.model.TaskSpec;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural coercion of client-supplied task lists (edited plans, direct solve requests).
 * Only the shape is checked; the content is taken verbatim.
 */
@Component
public class TaskListMapper {

    public List<TaskSpec> fromJson(JsonNode node) {
        JsonNode array = node != null && node.isObject() ? node.get("tasks") : node;
        if (array == null || !array.isArray()) {
            throw new ValidationException("Task list must be an array");
        }
        if (array.isEmpty()) {
            throw new ValidationException("Task list is empty");
        }
        List<TaskSpec> tasks = new ArrayList<>();
        Set<Integer> ids = new HashSet<>();
        int position = 0;
        for (JsonNode item : array) {
            position++;
            if (!item.isObject()) {
                throw new ValidationException("Task " + position + " must be an object");
            }
            int id = item.path("id").canConvertToInt() ? item.path("id").asInt() : position;
            if (id < 1 || !ids.add(id)) {
                throw new ValidationException("Task " + position + " has an invalid or duplicate id " + id);
            }
            String title = text(item, "title");
            String objective = StringUtils.hasText(text(item, "objective")) ? text(item, "objective") : text(item, "description");
            if (!StringUtils.hasText(title) && !StringUtils.hasText(objective)) {
                throw new ValidationException("Task " + position + " needs a title or an objective");
            }
            tasks.add(new TaskSpec(
                    id,
                    StringUtils.hasText(title) ? title : objective,
                    StringUtils.hasText(objective) ? objective : title,
                    strings(item.get("inputs")),
                    strings(item.get("hints"))));
        }
        return tasks;
    }

    private static String text(JsonNode item, String field) {
        JsonNode value = item.get(field);
        return value != null && value.isTextual() ? value.asText().trim() : null;
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode value : node) {
                if (value.isValueNode()) {
                    values.add(value.asText());
                }
            }
        }
        return values;
    }
}
