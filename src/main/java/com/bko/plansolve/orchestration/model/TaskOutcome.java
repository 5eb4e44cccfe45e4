package com.bko.plansolve.orchestration.model;

import org.springframework.lang.Nullable;

public record TaskOutcome(
        TaskSpec task,
        TaskState state,
        @Nullable String output,
        @Nullable String error,
        int attempts
) {
}
