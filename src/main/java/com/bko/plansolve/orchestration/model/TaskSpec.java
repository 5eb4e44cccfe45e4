package com.bko.plansolve.orchestration.model;

import java.util.List;

/**
 * Immutable description of one unit of solver work. {@code id} is the 1-based ordinal that
 * decides admission and aggregation order.
 */
public record TaskSpec(
        int id,
        String title,
        String objective,
        List<String> inputs,
        List<String> hints
) {

    public TaskSpec {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        hints = hints != null ? List.copyOf(hints) : List.of();
    }
}
