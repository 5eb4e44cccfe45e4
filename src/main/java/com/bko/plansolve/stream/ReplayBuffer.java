package com.bko.plansolve.stream;

import com.bko.plansolve.protocol.Envelope;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Unacknowledged events of one session, ordered by seq.
 */
class ReplayBuffer {

    private final String sessionId;
    private final Deque<Envelope> buffer = new ArrayDeque<>();
    private long lastSeq;
    private long acknowledgedSeq;
    private long dropped;

    ReplayBuffer(String sessionId) {
        this.sessionId = sessionId;
    }

    String sessionId() {
        return sessionId;
    }

    synchronized Envelope append(Envelope event, int capacity) {
        Envelope stamped = event.withSequence(++lastSeq, UUID.randomUUID().toString());
        buffer.addLast(stamped);
        if (capacity > 0 && buffer.size() > capacity) {
            buffer.removeFirst();
            dropped++;
        }
        return stamped;
    }

    /**
     * @return {@code true} when the acknowledged position moved forward
     */
    synchronized boolean acknowledge(long seq) {
        long target = Math.min(seq, lastSeq);
        if (target <= acknowledgedSeq) {
            return false;
        }
        acknowledgedSeq = target;
        while (!buffer.isEmpty() && buffer.peekFirst().seq() <= target) {
            buffer.removeFirst();
        }
        return true;
    }

    synchronized OptionalLong seqOf(String eventId) {
        for (Envelope envelope : buffer) {
            if (eventId.equals(envelope.eventId())) {
                return OptionalLong.of(envelope.seq());
            }
        }
        return OptionalLong.empty();
    }

    synchronized List<Envelope> snapshotSince(long afterSeq) {
        return buffer.stream()
                .filter(event -> event.seq() > afterSeq)
                .toList();
    }

    synchronized long lastSeq() {
        return lastSeq;
    }

    synchronized long acknowledgedSeq() {
        return acknowledgedSeq;
    }

    synchronized int size() {
        return buffer.size();
    }

    synchronized long dropped() {
        return dropped;
    }
}
