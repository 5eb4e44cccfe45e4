package com.bko.plansolve.session;

import com.bko.plansolve.error.SessionNotFoundException;
import com.bko.plansolve.support.SerialExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

@Component
@Slf4j
public class SessionRegistry {

    private final ExecutorService orchestrationExecutor;
    private final Clock clock;
    private final Map<String, PipelineSession> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(@Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor, Clock clock) {
        this.orchestrationExecutor = orchestrationExecutor;
        this.clock = clock;
    }

    public PipelineSession create(String connectionId) {
        String id = UUID.randomUUID().toString();
        PipelineSession session = new PipelineSession(id, new SerialExecutor(orchestrationExecutor, "session-" + id), clock);
        session.attach(connectionId);
        sessions.put(id, session);
        log.info("Session {} created for connection {}", id, connectionId);
        return session;
    }

    public Optional<PipelineSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public PipelineSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Collection<PipelineSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    public void remove(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.info("Session {} removed", sessionId);
        }
    }

    /**
     * Detached sessions whose last activity is older than {@code idleTimeout}.
     */
    public List<PipelineSession> idleSessions(Duration idleTimeout) {
        Instant cutoff = clock.instant().minus(idleTimeout);
        return sessions.values().stream()
                .filter(session -> !session.isAttached())
                .filter(session -> session.lastActiveAt().isBefore(cutoff))
                .toList();
    }
}
