package com.bko.plansolve.reconnect;

import com.bko.plansolve.config.PlanSolveProperties;
import com.bko.plansolve.error.ReconnectSignatureInvalidException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;

/**
 * HMAC-SHA256 over the canonical JSON of the snapshot (keys sorted), its timestamp and the
 * format version, plus a SHA-256 checksum of the canonical JSON.
 */
@Component
@Slf4j
public class HmacStateSigner implements StateSigner {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Duration CLOCK_SKEW = Duration.ofMinutes(1);

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final byte[] secret;
    private final Duration ttl;
    private final String version;

    public HmacStateSigner(ObjectMapper objectMapper, PlanSolveProperties properties, Clock clock) {
        PlanSolveProperties.State state = properties.getState();
        if (!StringUtils.hasText(state.getSecret())) {
            throw new IllegalStateException("plansolve.state.secret must be configured");
        }
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.secret = state.getSecret().getBytes(StandardCharsets.UTF_8);
        this.ttl = state.getTtl();
        this.version = state.getVersion();
    }

    @Override
    public SignedState sign(JsonNode state) {
        String canonical = canonicalJson(state);
        long timestamp = clock.instant().getEpochSecond();
        return new SignedState(state, timestamp, hmac(message(canonical, timestamp, version)), version, sha256(canonical));
    }

    @Override
    public JsonNode verify(SignedState signed) {
        if (signed == null || signed.state() == null || signed.signature() == null) {
            throw new ReconnectSignatureInvalidException("Signed state is incomplete");
        }
        if (!version.equals(signed.version())) {
            throw new ReconnectSignatureInvalidException("Unsupported state version " + signed.version());
        }
        String canonical = canonicalJson(signed.state());
        if (!constantTimeEquals(sha256(canonical), signed.checksum())) {
            throw new ReconnectSignatureInvalidException("State checksum mismatch");
        }
        String expected = hmac(message(canonical, signed.timestamp(), signed.version()));
        if (!constantTimeEquals(expected, signed.signature())) {
            log.warn("Rejected state with invalid signature for session {}", signed.state().path("sessionId").asText());
            throw new ReconnectSignatureInvalidException("State signature is invalid");
        }
        long now = clock.instant().getEpochSecond();
        if (signed.timestamp() > now + CLOCK_SKEW.toSeconds()) {
            throw new ReconnectSignatureInvalidException("State timestamp is in the future");
        }
        if (now - signed.timestamp() > ttl.toSeconds()) {
            throw new ReconnectSignatureInvalidException("State expired");
        }
        return signed.state();
    }

    String canonicalJson(JsonNode state) {
        try {
            Object plain = objectMapper.convertValue(state, Object.class);
            return objectMapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsString(plain);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new ReconnectSignatureInvalidException("State is not serializable", ex);
        }
    }

    private static String message(String canonical, long timestamp, String version) {
        return canonical + ":" + timestamp + ":" + version;
    }

    private String hmac(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }

    private static String sha256(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("SHA-256 unavailable", ex);
        }
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
