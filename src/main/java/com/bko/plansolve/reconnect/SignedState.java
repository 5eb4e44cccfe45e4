package com.bko.plansolve.reconnect;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Snapshot of a session plus the HMAC that lets a client present it back on reconnect.
 */
public record SignedState(
        JsonNode state,
        long timestamp,
        String signature,
        String version,
        String checksum
) {
}
