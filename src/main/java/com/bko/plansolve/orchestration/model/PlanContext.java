package com.bko.plansolve.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * What solvers and the aggregator know about the run they belong to.
 */
public record PlanContext(
        String sessionId,
        @Nullable String question,
        @Nullable String planSummary,
        List<TaskSpec> tasks
) {

    public PlanContext {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    public PlanContext withTasks(List<TaskSpec> replacement) {
        return new PlanContext(sessionId, question, planSummary, replacement);
    }
}
