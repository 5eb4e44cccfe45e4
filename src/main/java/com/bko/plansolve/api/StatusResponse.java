package com.bko.plansolve.api;

public record StatusResponse(
        int activeSessions,
        int activeConnections,
        long attempts,
        long retries,
        long failedTasks,
        long llmRequests,
        long pipelinesCompleted
) {
}
