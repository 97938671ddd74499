package me.golemcore.agent.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.SessionNotFoundException;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.inbound.AgentSessionPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Closes sessions that have been idle for longer than
 * {@code agent.session.ttl}. Sessions with a run in flight are never
 * expired. A zero TTL disables the sweeper.
 */
@Slf4j
public class SessionExpirySweeper {

    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private final SessionRegistry sessionRegistry;
    private final AgentSessionPort sessionPort;
    private final AgentProperties.SessionProperties settings;
    private final Clock clock;

    private final ScheduledExecutorService sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "session-expiry");
        t.setDaemon(true);
        return t;
    });

    public SessionExpirySweeper(SessionRegistry sessionRegistry, AgentSessionPort sessionPort,
            AgentProperties.SessionProperties settings, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.sessionPort = sessionPort;
        this.settings = settings;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        Duration ttl = settings.getTtl();
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            log.info("[Sessions] Session expiry disabled");
            return;
        }
        long intervalMs = Math.max(1, settings.getSweepInterval().toMillis());
        sweepExecutor.scheduleAtFixedRate(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Sessions] Session expiry enabled: ttl={}, sweep every {}ms", ttl, intervalMs);
    }

    @PreDestroy
    void destroy() {
        sweepExecutor.shutdownNow();
        try {
            sweepExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Closes every idle session older than the TTL.
     *
     * @return number of sessions closed
     */
    public int sweep() {
        Duration ttl = settings.getTtl();
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(ttl);
        int closed = 0;
        for (AgentSession session : sessionRegistry.snapshot()) {
            if (!session.getUpdatedAt().isBefore(cutoff) || session.getRunLock().isLocked()) {
                continue;
            }
            try {
                sessionPort.closeSession(session.getId());
                closed++;
            } catch (SessionNotFoundException e) {
                log.debug("[Sessions] Session {} already closed", session.getId());
            }
        }
        if (closed > 0) {
            log.info("[Sessions] Expired {} idle session(s)", closed);
        }
        return closed;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.warn("[Sessions] Expiry sweep failed: {}", e.getMessage(), e);
        }
    }
}
