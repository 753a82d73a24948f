package me.golemcore.browser.domain.service;

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

import me.golemcore.browser.infrastructure.config.BrowserProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background sweep that closes sessions idle for longer than
 * {@code browser.sessions.idle-timeout}.
 *
 * <p>
 * Runs every {@code browser.sessions.reap-interval} on a daemon thread. Each
 * cycle snapshots last-activity times and asks the registry to close the stale
 * ones. The registry re-checks idleness atomically, so a session resolved
 * between the snapshot and the close survives, and a session closed in the
 * meantime is a no-op.
 */
@Component
@Slf4j
public class IdleSessionReaper {

    private final BrowserSessionRegistry registry;
    private final BrowserProperties properties;
    private final Clock clock;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "browser-session-reaper");
        t.setDaemon(true);
        return t;
    });

    public IdleSessionReaper(BrowserSessionRegistry registry, BrowserProperties properties, Clock clock) {
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        long intervalMs = properties.getSessions().getReapInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::runSweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Reaper] Idle sweep every {}, idle timeout {}",
                properties.getSessions().getReapInterval(), properties.getSessions().getIdleTimeout());
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Close every session idle beyond the timeout.
     *
     * @return number of sessions closed by this sweep
     */
    public int sweep() {
        Duration idleTimeout = properties.getSessions().getIdleTimeout();
        Instant cutoff = clock.instant().minus(idleTimeout);
        int reaped = 0;
        for (Map.Entry<String, Instant> entry : registry.activitySnapshot().entrySet()) {
            if (!entry.getValue().isBefore(cutoff)) {
                continue;
            }
            try {
                if (registry.closeIfIdle(entry.getKey(), cutoff)) {
                    reaped++;
                    log.info("[Reaper] Closed idle session '{}' (last active {})", entry.getKey(), entry.getValue());
                }
            } catch (RuntimeException e) {
                log.warn("[Reaper] Failed to close idle session '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        return reaped;
    }

    private void runSweep() {
        try {
            int reaped = sweep();
            if (reaped > 0) {
                log.info("[Reaper] Sweep closed {} idle sessions, {} resident", reaped, registry.size());
            }
        } catch (RuntimeException e) { // NOSONAR - a failed sweep must not cancel the schedule
            log.error("[Reaper] Idle sweep failed", e);
        }
    }
}
