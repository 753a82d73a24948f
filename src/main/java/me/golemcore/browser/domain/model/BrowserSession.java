package me.golemcore.browser.domain.model;

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

import me.golemcore.browser.domain.exception.SessionNotFoundException;
import me.golemcore.browser.port.outbound.ContextHandle;
import me.golemcore.browser.port.outbound.DriverHandle;
import me.golemcore.browser.port.outbound.PageHandle;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * One isolated browser automation context for one client.
 *
 * <p>
 * A session is either fully closed (no driver, no tabs) or fully open (driver,
 * context and at least one tab). All work against the session, driver calls
 * included, runs on its single-thread {@link #getExecutor() executor}, which
 * serializes tab edits and gives the driver the thread affinity it needs.
 *
 * <p>
 * A session is <em>retired</em> once teardown has started for removal from the
 * registry. Retired sessions never reopen and reject new work.
 */
public class BrowserSession {

    @Getter
    private final String id;
    @Getter
    private final long sequence;
    @Getter
    private final Instant createdAt;
    @Getter
    private final TabList tabs = new TabList();
    @Getter
    private final EventBuffer<ConsoleMessage> consoleBuffer;
    @Getter
    private final EventBuffer<NetworkRequest> networkBuffer;
    @Getter
    private final ExecutorService executor;

    private Instant lastActivityAt;
    private boolean retired;

    private volatile DriverHandle driver;
    private volatile ContextHandle context;
    @Getter
    private volatile boolean headless;
    @Getter
    private volatile Viewport viewport;

    public BrowserSession(String id, long sequence, Instant createdAt, int maxConsoleMessages,
            int maxNetworkRequests) {
        this.id = id;
        this.sequence = sequence;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
        this.consoleBuffer = new EventBuffer<>(maxConsoleMessages);
        this.networkBuffer = new EventBuffer<>(maxNetworkRequests);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "browser-session-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== Activity ====================

    /**
     * Record an access. The timestamp never moves backwards.
     *
     * @return false if the session is already retired
     */
    public synchronized boolean touch(Instant now) {
        if (retired) {
            return false;
        }
        if (now.isAfter(lastActivityAt)) {
            lastActivityAt = now;
        }
        return true;
    }

    public synchronized Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public synchronized long idleSeconds(Instant now) {
        return Math.max(0, Duration.between(lastActivityAt, now).getSeconds());
    }

    // ==================== Retirement ====================

    /**
     * Mark the session for removal.
     *
     * @return true if this call retired it
     */
    public synchronized boolean retire() {
        if (retired) {
            return false;
        }
        retired = true;
        return true;
    }

    /**
     * Retire the session only if it has not been touched since {@code cutoff}.
     * Atomic with respect to {@link #touch(Instant)}.
     */
    public synchronized boolean retireIfIdleSince(Instant cutoff) {
        if (retired || !lastActivityAt.isBefore(cutoff)) {
            return false;
        }
        retired = true;
        return true;
    }

    public synchronized boolean isRetired() {
        return retired;
    }

    // ==================== Driver state ====================

    public boolean isOpen() {
        return driver != null;
    }

    public Optional<PageHandle> activePage() {
        return tabs.active();
    }

    public Optional<ContextHandle> getContext() {
        return Optional.ofNullable(context);
    }

    public Optional<DriverHandle> getDriver() {
        return Optional.ofNullable(driver);
    }

    /**
     * Install freshly launched driver resources with their first page.
     */
    public synchronized void attach(DriverHandle driver, ContextHandle context, PageHandle firstPage,
            boolean headless, Viewport viewport) {
        if (retired) {
            throw new SessionNotFoundException(id);
        }
        if (this.driver != null) {
            throw new IllegalStateException("Session " + id + " is already open");
        }
        this.driver = driver;
        this.context = context;
        this.headless = headless;
        this.viewport = viewport;
        tabs.add(firstPage);
    }

    /**
     * Take ownership of the driver resources away from the session, leaving it
     * fully closed. A second call returns an empty result, so resources are
     * released at most once.
     */
    public synchronized DetachedResources detach() {
        DetachedResources detached = new DetachedResources(driver, context, tabs.clear());
        driver = null;
        context = null;
        return detached;
    }

    /**
     * {@link #detach()} only while {@code expected} is still the session's
     * driver. Used when a browser dies on its own, so that a late notification
     * cannot tear down a newer browser of the same session.
     */
    public synchronized DetachedResources detachIfOwnedBy(DriverHandle expected) {
        if (driver == null || driver != expected) {
            return new DetachedResources(null, null, List.of());
        }
        return detach();
    }

    /**
     * Clear both capture buffers.
     */
    public void resetBuffers() {
        consoleBuffer.clear();
        networkBuffer.clear();
    }

    public SessionSummary summarize(Instant now) {
        return SessionSummary.builder()
                .id(id)
                .open(isOpen())
                .tabCount(tabs.size())
                .createdAt(createdAt)
                .lastActivityAt(getLastActivityAt())
                .idleSeconds(idleSeconds(now))
                .build();
    }

    /**
     * Driver resources removed from a session by {@link #detach()}.
     */
    public record DetachedResources(DriverHandle driver, ContextHandle context, List<PageHandle> pages) {

        public boolean isEmpty() {
            return driver == null && context == null && pages.isEmpty();
        }
    }
}
