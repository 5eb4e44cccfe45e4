package com.bko.plansolve.confirm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Pairs outbound confirmation requests with the client's {@code user.response}. Waiting never
 * blocks a thread: {@link #await(String)} hands back a future that completes on the response or
 * when the deadline passes, whichever comes first.
 */
@Slf4j
public class ConfirmationCorrelator {

    private final Clock clock;
    private final Map<String, PendingConfirmation> pending = new ConcurrentHashMap<>();

    public ConfirmationCorrelator(Clock clock) {
        this.clock = clock;
    }

    public PendingConfirmation open(String stepId, Duration timeout) {
        PendingConfirmation confirmation = new PendingConfirmation(stepId, clock.instant(), clock.instant().plus(timeout));
        if (pending.putIfAbsent(stepId, confirmation) != null) {
            throw new IllegalArgumentException("Confirmation step already pending: " + stepId);
        }
        confirmation.outcome()
                .completeOnTimeout(ConfirmationOutcome.timedOut(stepId), timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((outcome, error) -> pending.remove(stepId, confirmation));
        return confirmation;
    }

    /**
     * Resolves a pending confirmation. Unknown and already resolved step ids are ignored.
     *
     * @return the extra payload recorded with the resolution, empty when nothing was resolved
     */
    public Optional<JsonNode> resolve(String stepId, boolean confirmed, @Nullable JsonNode extra) {
        PendingConfirmation confirmation = stepId == null ? null : pending.get(stepId);
        if (confirmation == null || confirmation.resolution() != ConfirmationResolution.NONE) {
            log.debug("Ignoring response for unknown or resolved step {}", stepId);
            return Optional.empty();
        }
        ConfirmationResolution resolution = confirmed ? ConfirmationResolution.CONFIRMED : ConfirmationResolution.DECLINED;
        if (!confirmation.complete(new ConfirmationOutcome(stepId, resolution, extra))) {
            log.debug("Step {} already resolved", stepId);
            return Optional.empty();
        }
        return Optional.ofNullable(extra);
    }

    /**
     * @throws IllegalStateException if the step was never opened or has already been resolved;
     *         resolved steps are forgotten
     */
    public CompletableFuture<ConfirmationOutcome> await(String stepId) {
        PendingConfirmation confirmation = pending.get(stepId);
        if (confirmation == null) {
            throw new IllegalStateException("No open confirmation for step " + stepId);
        }
        return confirmation.outcome();
    }

    int size() {
        return pending.size();
    }

    public boolean isPending(String stepId) {
        PendingConfirmation confirmation = stepId == null ? null : pending.get(stepId);
        return confirmation != null && confirmation.resolution() == ConfirmationResolution.NONE;
    }

    public List<PendingConfirmation> pending() {
        return pending.values().stream()
                .filter(confirmation -> confirmation.resolution() == ConfirmationResolution.NONE)
                .sorted(Comparator.comparing(PendingConfirmation::createdAt))
                .toList();
    }

    /**
     * Declines everything still outstanding, e.g. when the pipeline is cancelled or replanned.
     */
    public void cancelAll() {
        for (PendingConfirmation confirmation : List.copyOf(pending.values())) {
            confirmation.complete(new ConfirmationOutcome(confirmation.stepId(), ConfirmationResolution.DECLINED, null));
        }
    }
}
