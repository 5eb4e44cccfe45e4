package com.bko.plansolve.connection;

import java.io.IOException;

/**
 * Outbound half of a live channel to one client. Sends to one transport are serialized by the implementation.
 */
public interface Transport {

    void send(byte[] payload) throws IOException;

    /**
     * Sends a transport-level liveness check. The client answers it without application involvement.
     */
    void ping() throws IOException;

    boolean isOpen();

    void close(String reason);
}
