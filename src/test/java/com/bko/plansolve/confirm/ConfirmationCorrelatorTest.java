package com.bko.plansolve.confirm;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ConfirmationCorrelatorTest {

    private final ConfirmationCorrelator correlator = new ConfirmationCorrelator(Clock.systemUTC());

    @Test
    void testResolveCompletesAwaiter() throws Exception {
        correlator.open("step-1", Duration.ofSeconds(30));
        CompletableFuture<ConfirmationOutcome> awaiting = correlator.await("step-1");
        ObjectNode extra = JsonNodeFactory.instance.objectNode().put("note", "ok");

        Optional<?> recorded = correlator.resolve("step-1", true, extra);
        ConfirmationOutcome outcome = awaiting.get(1, TimeUnit.SECONDS);

        assertTrue(recorded.isPresent());
        assertEquals(ConfirmationResolution.CONFIRMED, outcome.resolution());
        assertTrue(outcome.resolution().isAccepted());
        assertEquals("ok", outcome.extra().path("note").asText());
        assertFalse(correlator.isPending("step-1"));
    }

    @Test
    void testDeclineIsNotAccepted() throws Exception {
        PendingConfirmation pending = correlator.open("step-1", Duration.ofSeconds(30));
        correlator.resolve("step-1", false, null);

        ConfirmationOutcome outcome = pending.outcome().get(1, TimeUnit.SECONDS);

        assertEquals(ConfirmationResolution.DECLINED, outcome.resolution());
        assertFalse(outcome.resolution().isAccepted());
    }

    @Test
    void testTimeoutResolvesAsTimedOut() throws Exception {
        PendingConfirmation pending = correlator.open("step-1", Duration.ofMillis(50));

        ConfirmationOutcome outcome = correlator.await("step-1").get(2, TimeUnit.SECONDS);

        assertEquals(ConfirmationResolution.TIMED_OUT, outcome.resolution());
        assertEquals(ConfirmationResolution.TIMED_OUT, pending.resolution());
        assertTrue(correlator.resolve("step-1", true, null).isEmpty());
    }

    @Test
    void testUnknownAndRepeatedResolutionsAreIgnored() throws Exception {
        CompletableFuture<ConfirmationOutcome> awaiting = correlator.open("step-1", Duration.ofSeconds(30)).outcome();

        assertTrue(correlator.resolve("other", true, null).isEmpty());
        correlator.resolve("step-1", false, null);
        assertTrue(correlator.resolve("step-1", true, null).isEmpty());

        assertEquals(ConfirmationResolution.DECLINED, awaiting.get(1, TimeUnit.SECONDS).resolution());
    }

    @Test
    void testDuplicateOpenIsRejected() {
        correlator.open("step-1", Duration.ofSeconds(30));

        assertThrows(IllegalArgumentException.class, () -> correlator.open("step-1", Duration.ofSeconds(30)));
        assertThrows(IllegalStateException.class, () -> correlator.await("never-opened"));
    }

    @Test
    void testPendingListsOnlyUnresolvedSteps() throws Exception {
        PendingConfirmation first = correlator.open("step-1", Duration.ofSeconds(30));
        PendingConfirmation second = correlator.open("step-2", Duration.ofSeconds(30));
        correlator.resolve("step-1", true, null);

        assertEquals(1, correlator.pending().size());
        assertEquals("step-2", correlator.pending().get(0).stepId());

        correlator.cancelAll();

        assertTrue(correlator.pending().isEmpty());
        assertEquals(ConfirmationResolution.DECLINED, second.outcome().get(1, TimeUnit.SECONDS).resolution());
        assertEquals(ConfirmationResolution.CONFIRMED, first.outcome().get(1, TimeUnit.SECONDS).resolution());
    }

    @Test
    void testResolvedStepsAreForgotten() {
        for (int i = 0; i < 5; i++) {
            correlator.open("step-" + i, Duration.ofSeconds(30));
            correlator.resolve("step-" + i, i % 2 == 0, null);
        }
        correlator.open("step-timeout", Duration.ofMillis(20));
        correlator.open("step-cancelled", Duration.ofSeconds(30));
        correlator.cancelAll();

        await().atMost(Duration.ofSeconds(2)).until(() -> correlator.size() == 0);
        assertThrows(IllegalStateException.class, () -> correlator.await("step-0"));
        correlator.open("step-0", Duration.ofSeconds(30));
        assertTrue(correlator.isPending("step-0"));
    }
}
