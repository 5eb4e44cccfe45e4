package com.bko.plansolve.orchestration.model;

import java.time.Duration;

/**
 * Up to {@code maxRetry} additional attempts after the first. The delay before retry {@code n}
 * is {@code delay * multiplier^(n-1)}, capped at {@code maxDelay}.
 */
public record RetryPolicy(
        int maxRetry,
        Duration delay,
        double multiplier,
        Duration maxDelay
) {

    public static RetryPolicy fixed(int maxRetry, Duration delay) {
        return new RetryPolicy(maxRetry, delay, 1.0, delay);
    }

    public boolean allowsRetry(int attemptsMade) {
        return attemptsMade <= maxRetry;
    }

    public Duration delayAfter(int attemptsMade) {
        double factor = Math.pow(multiplier, Math.max(0, attemptsMade - 1));
        long millis = Math.round(delay.toMillis() * factor);
        long cap = maxDelay != null ? Math.max(maxDelay.toMillis(), delay.toMillis()) : millis;
        return Duration.ofMillis(Math.min(millis, cap));
    }
}
