package com.bko.plansolve.session;

import java.time.Instant;
import java.util.List;

public record SessionView(
        String sessionId,
        String stage,
        String connectionId,
        String question,
        String planSummary,
        String pendingStepId,
        long lastSeq,
        long acknowledgedSeq,
        int bufferedEvents,
        List<TaskView> tasks,
        Instant createdAt,
        Instant lastActiveAt
) {

    public record TaskView(
            int id,
            String title,
            String state,
            int attempts,
            String lastError
    ) {
    }
}
