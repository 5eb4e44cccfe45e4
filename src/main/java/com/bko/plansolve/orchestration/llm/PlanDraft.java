package com.bko.plansolve.orchestration.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Planner response as the model returns it, before ids are assigned.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanDraft(
        String summary,
        List<TaskDraft> tasks
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskDraft(
            String title,
            String objective,
            String description,
            List<String> inputs,
            List<String> hints
    ) {
    }
}
