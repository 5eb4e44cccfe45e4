package com.bko.plansolve.stream;

import com.bko.plansolve.config.PlanSolveProperties;
import com.bko.plansolve.protocol.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session sequencing, acknowledgement and replay of emitted events.
 * Sequence numbers start at 1 and are gap-free within a session.
 */
@Component
public class EventLog {
    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final PlanSolveProperties properties;
    private final Map<String, ReplayBuffer> buffers = new ConcurrentHashMap<>();

    public EventLog(PlanSolveProperties properties) {
        this.properties = properties;
    }

    /**
     * Stamps the event with the session's next seq and a fresh event id, then buffers it.
     *
     * @return the stamped copy to transmit
     */
    public Envelope append(Envelope event) {
        if (event.sessionId() == null) {
            throw new IllegalArgumentException("Only session events can be sequenced: " + event.event());
        }
        ReplayBuffer buffer = buffers.computeIfAbsent(event.sessionId(), ReplayBuffer::new);
        int capacity = properties.getSession().getReplayCapacity();
        long droppedBefore = buffer.dropped();
        Envelope stamped = buffer.append(event, capacity);
        if (buffer.dropped() > droppedBefore) {
            log.warn("Replay buffer for session {} exceeded {} entries; oldest unacknowledged event dropped",
                    event.sessionId(), capacity);
        }
        return stamped;
    }

    /**
     * Drops every buffered event with seq at or below {@code lastSeq}. Lower or repeated
     * acknowledgements leave the buffer untouched.
     */
    public void acknowledge(String sessionId, long lastSeq) {
        ReplayBuffer buffer = buffers.get(sessionId);
        if (buffer == null) {
            return;
        }
        if (buffer.acknowledge(lastSeq)) {
            log.debug("Session {} acknowledged up to seq {} ({} still buffered)", sessionId, lastSeq, buffer.size());
        }
    }

    /**
     * Acknowledges up to the event with the given id. Unknown ids are ignored.
     */
    public void acknowledgeEventId(String sessionId, String eventId) {
        OptionalLong seq = seqOf(sessionId, eventId);
        if (seq.isEmpty()) {
            log.debug("Ignoring ack for unknown event {} in session {}", eventId, sessionId);
            return;
        }
        acknowledge(sessionId, seq.getAsLong());
    }

    public OptionalLong seqOf(String sessionId, String eventId) {
        ReplayBuffer buffer = buffers.get(sessionId);
        if (buffer == null || eventId == null) {
            return OptionalLong.empty();
        }
        return buffer.seqOf(eventId);
    }

    /**
     * Buffered events with seq greater than {@code afterSeq}, ascending. Empty when nothing is buffered.
     */
    public List<Envelope> replayFrom(String sessionId, long afterSeq) {
        ReplayBuffer buffer = buffers.get(sessionId);
        if (buffer == null) {
            return List.of();
        }
        return buffer.snapshotSince(afterSeq);
    }

    public long lastSeq(String sessionId) {
        ReplayBuffer buffer = buffers.get(sessionId);
        return buffer == null ? 0L : buffer.lastSeq();
    }

    public long acknowledgedSeq(String sessionId) {
        ReplayBuffer buffer = buffers.get(sessionId);
        return buffer == null ? 0L : buffer.acknowledgedSeq();
    }

    public int buffered(String sessionId) {
        ReplayBuffer buffer = buffers.get(sessionId);
        return buffer == null ? 0 : buffer.size();
    }

    public void remove(String sessionId) {
        buffers.remove(sessionId);
    }
}
