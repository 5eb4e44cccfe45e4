package com.bko.plansolve.orchestration.model;

public record PlanRequest(
        String sessionId,
        String question
) {
}
