package com.bko.plansolve.session;

import com.bko.plansolve.config.PlanSolveProperties;
import com.bko.plansolve.connection.ClientConnection;
import com.bko.plansolve.connection.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Periodic connection heartbeat, liveness sweep and idle-session eviction. Runs on the Spring
 * scheduler, independent of any session mailbox.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionMaintenanceService {

    private final ConnectionRegistry connectionRegistry;
    private final SessionRegistry sessionRegistry;
    private final SessionService sessionService;
    private final PlanSolveProperties properties;

    @Scheduled(fixedDelayString = "${plansolve.connection.heartbeat-interval:PT30S}",
            initialDelayString = "${plansolve.connection.heartbeat-interval:PT30S}")
    public void heartbeat() {
        int delivered = connectionRegistry.broadcastHeartbeat(sessionRegistry.size());
        log.debug("Heartbeat delivered to {} connections", delivered);
    }

    @Scheduled(fixedDelayString = "${plansolve.connection.heartbeat-interval:PT30S}",
            initialDelayString = "${plansolve.connection.heartbeat-interval:PT30S}")
    public void sweepConnections() {
        List<ClientConnection> evicted = connectionRegistry.evictSilent(properties.getConnection().getLivenessTimeout());
        evicted.forEach(sessionService::onConnectionClosed);
    }

    @Scheduled(fixedDelayString = "${plansolve.session.eviction-interval:PT60S}",
            initialDelayString = "${plansolve.session.eviction-interval:PT60S}")
    public void evictIdleSessions() {
        int evicted = sessionService.evictIdle(properties.getSession().getIdleTimeout());
        if (evicted > 0) {
            log.info("Evicting {} idle sessions ({} remain)", evicted, sessionRegistry.size() - evicted);
        }
    }
}
