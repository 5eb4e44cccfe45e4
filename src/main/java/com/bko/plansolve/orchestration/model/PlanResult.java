package com.bko.plansolve.orchestration.model;

import java.util.List;

public record PlanResult(
        String summary,
        List<TaskSpec> tasks
) {

    public PlanResult {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }
}
