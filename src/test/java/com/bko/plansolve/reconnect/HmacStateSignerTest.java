package com.bko.plansolve.reconnect;

import com.bko.plansolve.config.PlanSolveProperties;
import com.bko.plansolve.error.ReconnectSignatureInvalidException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class HmacStateSignerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HmacStateSigner signer(String secret, Clock clock) {
        PlanSolveProperties properties = new PlanSolveProperties();
        properties.getState().setSecret(secret);
        properties.getState().setTtl(Duration.ofHours(1));
        return new HmacStateSigner(objectMapper, properties, clock);
    }

    private ObjectNode state() {
        ObjectNode state = objectMapper.createObjectNode();
        state.put("sessionId", "s-1");
        state.put("stage", "SOLVING");
        state.put("lastSeq", 7);
        state.putArray("tasks").addObject().put("id", 1).put("state", "RUNNING");
        return state;
    }

    @Test
    void testSignedStateVerifies() {
        HmacStateSigner signer = signer("secret", Clock.fixed(NOW, ZoneOffset.UTC));
        SignedState signed = signer.sign(state());

        JsonNode verified = signer.verify(signed);

        assertEquals("s-1", verified.path("sessionId").asText());
        assertEquals(NOW.getEpochSecond(), signed.timestamp());
        assertEquals("1.0", signed.version());
        assertEquals(64, signed.signature().length());
    }

    @Test
    void testSurvivesJsonRoundTrip() throws Exception {
        HmacStateSigner signer = signer("secret", Clock.fixed(NOW, ZoneOffset.UTC));
        SignedState signed = signer.sign(state());

        String wire = objectMapper.writeValueAsString(signed);
        SignedState received = objectMapper.readValue(wire, SignedState.class);

        assertEquals("SOLVING", signer.verify(received).path("stage").asText());
    }

    @Test
    void testCanonicalJsonIgnoresKeyOrder() {
        HmacStateSigner signer = signer("secret", Clock.fixed(NOW, ZoneOffset.UTC));
        ObjectNode reordered = objectMapper.createObjectNode();
        reordered.putArray("tasks").addObject().put("state", "RUNNING").put("id", 1);
        reordered.put("lastSeq", 7);
        reordered.put("stage", "SOLVING");
        reordered.put("sessionId", "s-1");

        assertEquals(signer.canonicalJson(state()), signer.canonicalJson(reordered));
    }

    @Test
    void testDifferentSecretIsRejected() {
        SignedState signed = signer("secret", Clock.fixed(NOW, ZoneOffset.UTC)).sign(state());

        HmacStateSigner other = signer("other-secret", Clock.fixed(NOW, ZoneOffset.UTC));

        assertThrows(ReconnectSignatureInvalidException.class, () -> other.verify(signed));
    }

    @Test
    void testTamperedStateIsRejected() {
        HmacStateSigner signer = signer("secret", Clock.fixed(NOW, ZoneOffset.UTC));
        SignedState signed = signer.sign(state());
        ObjectNode tampered = signed.state().deepCopy();
        tampered.put("lastSeq", 0);

        SignedState forged = new SignedState(tampered, signed.timestamp(), signed.signature(), signed.version(), signed.checksum());

        assertThrows(ReconnectSignatureInvalidException.class, () -> signer.verify(forged));
    }

    @Test
    void testExpiredStateIsRejected() {
        SignedState signed = signer("secret", Clock.fixed(NOW, ZoneOffset.UTC)).sign(state());
        HmacStateSigner later = signer("secret", Clock.fixed(NOW.plus(Duration.ofHours(2)), ZoneOffset.UTC));

        ReconnectSignatureInvalidException ex = assertThrows(ReconnectSignatureInvalidException.class,
                () -> later.verify(signed));
        assertEquals("State expired", ex.getMessage());
    }

    @Test
    void testFutureTimestampIsRejected() {
        SignedState signed = signer("secret", Clock.fixed(NOW.plus(Duration.ofMinutes(10)), ZoneOffset.UTC)).sign(state());
        HmacStateSigner now = signer("secret", Clock.fixed(NOW, ZoneOffset.UTC));

        assertThrows(ReconnectSignatureInvalidException.class, () -> now.verify(signed));
    }

    @Test
    void testUnknownVersionIsRejected() {
        HmacStateSigner signer = signer("secret", Clock.fixed(NOW, ZoneOffset.UTC));
        SignedState signed = signer.sign(state());
        SignedState otherVersion = new SignedState(signed.state(), signed.timestamp(), signed.signature(), "2.0", signed.checksum());

        assertThrows(ReconnectSignatureInvalidException.class, () -> signer.verify(otherVersion));
    }

    @Test
    void testMissingSecretFailsFast() {
        assertThrows(IllegalStateException.class, () -> signer("", Clock.systemUTC()));
    }
}
