package com.bko.plansolve.support;

import com.bko.plansolve.connection.Transport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport that keeps every frame it was asked to send, parsed back to JSON.
 */
public class RecordingTransport implements Transport {

    private final ObjectMapper objectMapper;
    private final List<JsonNode> frames = new CopyOnWriteArrayList<>();
    private final AtomicInteger pings = new AtomicInteger();
    private volatile boolean open = true;
    private volatile boolean failing;
    private volatile String closeReason;

    public RecordingTransport(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(byte[] payload) throws IOException {
        if (!open || failing) {
            throw new IOException("closed");
        }
        frames.add(objectMapper.readTree(payload));
    }

    @Override
    public void ping() throws IOException {
        if (!open || failing) {
            throw new IOException("closed");
        }
        pings.incrementAndGet();
    }

    /**
     * Makes every later write fail while the transport still reports itself open, like a half-closed socket.
     */
    public void failWrites() {
        failing = true;
    }

    public int pings() {
        return pings.get();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close(String reason) {
        open = false;
        closeReason = reason;
    }

    public List<JsonNode> frames() {
        return List.copyOf(frames);
    }

    public List<JsonNode> frames(String event) {
        return frames.stream()
                .filter(frame -> event.equals(frame.path("event").asText()))
                .toList();
    }

    public List<String> eventNames() {
        return frames.stream()
                .map(frame -> frame.path("event").asText())
                .toList();
    }

    public String closeReason() {
        return closeReason;
    }
}
