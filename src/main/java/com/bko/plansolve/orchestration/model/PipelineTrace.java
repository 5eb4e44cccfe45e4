package com.bko.plansolve.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Record of a finished run, handed to the trace sink.
 */
public record PipelineTrace(
        String sessionId,
        @Nullable String question,
        @Nullable String planSummary,
        String status,
        @Nullable String finalAnswer,
        List<TaskOutcome> outcomes,
        Instant startedAt,
        Instant finishedAt
) {
}
