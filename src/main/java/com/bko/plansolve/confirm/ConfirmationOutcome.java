package com.bko.plansolve.confirm;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

/**
 * How a pending confirmation ended, with whatever extra payload the client sent back.
 */
public record ConfirmationOutcome(
        String stepId,
        ConfirmationResolution resolution,
        @Nullable JsonNode extra
) {

    static ConfirmationOutcome timedOut(String stepId) {
        return new ConfirmationOutcome(stepId, ConfirmationResolution.TIMED_OUT, null);
    }
}
