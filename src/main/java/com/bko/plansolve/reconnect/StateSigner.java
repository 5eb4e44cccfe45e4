package com.bko.plansolve.reconnect;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Signs and verifies session snapshots handed to clients.
 */
public interface StateSigner {

    /**
     * Signs a snapshot.
     *
     * @param state The snapshot to sign.
     * @return The snapshot with its signature, version and checksum.
     */
    SignedState sign(JsonNode state);

    /**
     * Verifies a snapshot previously produced by {@link #sign(JsonNode)}.
     *
     * @param signed The signed snapshot presented by a client.
     * @return The verified snapshot.
     * @throws com.bko.plansolve.error.ReconnectSignatureInvalidException if the signature, version,
     *         checksum or age is not acceptable.
     */
    JsonNode verify(SignedState signed);
}
