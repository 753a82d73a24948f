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

import me.golemcore.browser.domain.exception.BrowserActionException;
import me.golemcore.browser.domain.exception.NoActivePageException;
import me.golemcore.browser.domain.exception.SessionNotFoundException;
import me.golemcore.browser.domain.model.BrowserSession;
import me.golemcore.browser.domain.model.BrowserSession.DetachedResources;
import me.golemcore.browser.domain.model.ContextOptions;
import me.golemcore.browser.domain.model.LaunchOptions;
import me.golemcore.browser.domain.model.OpenOptions;
import me.golemcore.browser.domain.model.OpenResult;
import me.golemcore.browser.domain.model.SessionSummary;
import me.golemcore.browser.domain.model.TabInfo;
import me.golemcore.browser.domain.model.Viewport;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.port.outbound.BrowserDriverPort;
import me.golemcore.browser.port.outbound.ContextHandle;
import me.golemcore.browser.port.outbound.DriverHandle;
import me.golemcore.browser.port.outbound.PageHandle;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Multi-tenant registry of browser sessions keyed by client-supplied id.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Lazy creation: a session is created on first reference to an unknown id
 * (unless {@code browser.sessions.auto-create} is off)
 * <li>Capacity: at most {@code browser.sessions.capacity} resident sessions; the
 * least recently active one (earliest inserted on ties) is torn down before a
 * new one is admitted
 * <li>Lifecycle: idempotent open and close, tab create/close/select
 * <li>Isolation: every session owns its driver, context, tabs and capture
 * buffers
 * </ul>
 *
 * <p>
 * Locking:
 * <ul>
 * <li>the map monitor is held only for lookups and insert/remove
 * <li>the admission lock serializes insertion and removal of entries and the
 * choice of eviction victims; it is released while a victim is torn down
 * <li>per-session work runs on the session's single-thread executor
 * </ul>
 * No registry lock is held across a driver call. An evicted session stays in
 * the map, retired, until its driver is released, so it keeps occupying its
 * slot and the new entry is installed only once it is gone.
 *
 * <p>
 * Explicit close, capacity eviction and idle reaping all go through
 * {@link #teardown(BrowserSession)}.
 */
@Service
@Slf4j
public class BrowserSessionRegistry {

    private final BrowserDriverPort driverPort;
    private final BrowserProperties properties;
    private final Clock clock;

    private final Map<String, BrowserSession> sessions = new LinkedHashMap<>();
    private final ReentrantLock admissionLock = new ReentrantLock();
    private final Condition entryRemoved = admissionLock.newCondition();
    private final AtomicLong sequence = new AtomicLong();

    public BrowserSessionRegistry(BrowserDriverPort driverPort, BrowserProperties properties, Clock clock) {
        if (properties.getSessions().getCapacity() < 1) {
            throw new IllegalArgumentException(
                    "browser.sessions.capacity must be at least 1, got " + properties.getSessions().getCapacity());
        }
        this.driverPort = driverPort;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Resolution ====================

    /**
     * Return the session for {@code id}, creating an unopened one if absent.
     * Creating at capacity first tears down the least recently active session.
     * Every call marks the session as active.
     */
    public BrowserSession resolve(String id) {
        String sessionId = requireId(id);
        BrowserSession existing = lookup(sessionId);
        if (existing != null && existing.touch(clock.instant())) {
            return existing;
        }

        BrowserSession evicted = null;
        while (true) {
            BrowserSession stale = null;
            admissionLock.lock();
            try {
                if (evicted != null) {
                    removeEntry(evicted, "evicted");
                    evicted = null;
                }
                existing = lookup(sessionId);
                if (existing != null) {
                    if (existing.touch(clock.instant())) {
                        return existing;
                    }
                    stale = existing;
                } else if (size() < getCapacity()) {
                    return install(sessionId);
                } else {
                    evicted = claimEvictionVictim();
                    if (evicted == null) {
                        // every resident session is already being torn down
                        entryRemoved.awaitUninterruptibly();
                        continue;
                    }
                }
            } finally {
                admissionLock.unlock();
            }

            if (stale != null) {
                // being torn down by a close or an eviction: finish it, then start over
                dispose(stale, "replaced");
            } else {
                teardown(evicted);
            }
        }
    }

    /**
     * Resolution used by action tools. Respects
     * {@code browser.sessions.auto-create}: when disabled, unknown ids fail with
     * {@link SessionNotFoundException}.
     */
    public BrowserSession acquire(String id) {
        if (properties.getSessions().isAutoCreate()) {
            return resolve(id);
        }
        String sessionId = requireId(id);
        BrowserSession existing = lookup(sessionId);
        if (existing == null || !existing.touch(clock.instant())) {
            throw new SessionNotFoundException(sessionId);
        }
        return existing;
    }

    /**
     * Create a session under a freshly generated id.
     */
    public BrowserSession create() {
        return resolve(UUID.randomUUID().toString());
    }

    /**
     * Look up a resident session without creating it or marking it active.
     */
    public Optional<BrowserSession> find(String id) {
        return Optional.ofNullable(lookup(id));
    }

    // ==================== Lifecycle ====================

    /**
     * Launch a browser for the session unless it is already open. Resets the
     * capture buffers on a fresh open.
     */
    public CompletableFuture<OpenResult> open(String id, OpenOptions options) {
        BrowserSession session = resolve(id);
        return submit(session, s -> openSession(s, options != null ? options : OpenOptions.defaults()));
    }

    /**
     * Tear down and remove a session. Unknown or already closed ids are a no-op.
     *
     * @return true if this call removed the session
     */
    public boolean close(String id) {
        BrowserSession session = lookup(id);
        if (session == null) {
            log.debug("[Sessions] Close requested for unknown session '{}'", id);
            return false;
        }
        return dispose(session, "closed");
    }

    /**
     * Close the session only if it has not been active since {@code cutoff}.
     */
    public boolean closeIfIdle(String id, Instant cutoff) {
        BrowserSession session = lookup(id);
        if (session == null || !session.retireIfIdleSince(cutoff)) {
            return false;
        }
        return dispose(session, "reaped after inactivity");
    }

    @PreDestroy
    public void closeAll() {
        List<BrowserSession> all;
        synchronized (sessions) {
            all = new ArrayList<>(sessions.values());
        }
        if (!all.isEmpty()) {
            log.info("[Sessions] Shutting down {} sessions", all.size());
        }
        for (BrowserSession session : all) {
            dispose(session, "closed on shutdown");
        }
    }

    // ==================== Inspection ====================

    /**
     * Snapshot of every resident session in insertion order. Does not mark any
     * session as active.
     */
    public List<SessionSummary> list() {
        Instant now = clock.instant();
        synchronized (sessions) {
            return sessions.values().stream()
                    .map(session -> session.summarize(now))
                    .toList();
        }
    }

    /**
     * Last activity per resident session, for the idle sweep.
     */
    public Map<String, Instant> activitySnapshot() {
        synchronized (sessions) {
            Map<String, Instant> snapshot = new LinkedHashMap<>();
            sessions.forEach((id, session) -> snapshot.put(id, session.getLastActivityAt()));
            return snapshot;
        }
    }

    public int size() {
        synchronized (sessions) {
            return sessions.size();
        }
    }

    public int getCapacity() {
        return properties.getSessions().getCapacity();
    }

    // ==================== Session work ====================

    /**
     * Run {@code task} on the session's executor, serialized with every other
     * task of that session.
     */
    public <T> CompletableFuture<T> execute(String id, SessionTask<T> task) {
        BrowserSession session = acquire(id);
        return submit(session, task);
    }

    /**
     * Run {@code task} against the active page.
     *
     * @param openIfClosed
     *            launch the browser with default options if the session is not
     *            open; otherwise a closed session fails with
     *            {@link NoActivePageException}
     */
    public <T> CompletableFuture<T> executeOnActivePage(String id, boolean openIfClosed, PageTask<T> task) {
        return execute(id, session -> {
            if (!session.isOpen() && openIfClosed) {
                openSession(session, OpenOptions.defaults());
            }
            PageHandle page = session.activePage()
                    .orElseThrow(() -> new NoActivePageException(session.getId()));
            return task.execute(page);
        });
    }

    // ==================== Tabs ====================

    /**
     * Open a new tab in the session's context and make it active. Opens the
     * session first if needed.
     *
     * @return index of the new tab
     */
    public CompletableFuture<Integer> createTab(String id) {
        return execute(id, session -> {
            if (!session.isOpen()) {
                openSession(session, OpenOptions.defaults());
            }
            ContextHandle context = session.getContext()
                    .orElseThrow(() -> new NoActivePageException(session.getId()));
            PageHandle page;
            try {
                page = context.newPage();
            } catch (RuntimeException e) {
                throw new BrowserActionException("create tab", session.getId(), e);
            }
            bindCapture(session, page);
            int index = session.getTabs().add(page);
            log.debug("[Sessions] Session '{}' created tab {}", session.getId(), index);
            return index;
        });
    }

    /**
     * Close the tab at {@code index}, or the active tab when null. Closing the
     * last tab releases the browser; the session stays resident and closed.
     *
     * @return index of the closed tab
     */
    public CompletableFuture<Integer> closeTab(String id, Integer index) {
        return execute(id, session -> {
            int target = index != null ? index : session.getTabs().getActiveIndex();
            PageHandle page = session.getTabs().get(target);
            session.getTabs().remove(target);
            try {
                page.close();
            } catch (RuntimeException e) {
                log.warn("[Sessions] Failed to close tab {} of session '{}': {}", target, session.getId(),
                        e.getMessage());
            }
            if (session.getTabs().isEmpty()) {
                log.info("[Sessions] Last tab of session '{}' closed, releasing browser", session.getId());
                release(session.getId(), session.detach());
            }
            return target;
        });
    }

    /**
     * Make the tab at {@code index} active. No driver call.
     */
    public CompletableFuture<Integer> selectTab(String id, int index) {
        return execute(id, session -> {
            session.getTabs().select(index);
            return index;
        });
    }

    public CompletableFuture<List<TabInfo>> listTabs(String id) {
        return execute(id, session -> {
            List<PageHandle> pages = session.getTabs().snapshot();
            int active = session.getTabs().getActiveIndex();
            List<TabInfo> tabs = new ArrayList<>(pages.size());
            try {
                for (int i = 0; i < pages.size(); i++) {
                    PageHandle page = pages.get(i);
                    tabs.add(TabInfo.builder()
                            .index(i)
                            .title(page.title())
                            .url(page.url())
                            .active(i == active)
                            .build());
                }
            } catch (RuntimeException e) {
                throw new BrowserActionException("list tabs", session.getId(), e);
            }
            return tabs;
        });
    }

    // ==================== Internals ====================

    private <T> CompletableFuture<T> submit(BrowserSession session, SessionTask<T> task) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                if (session.isRetired()) {
                    throw new SessionNotFoundException(session.getId());
                }
                try {
                    return task.execute(session);
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, session.getExecutor());
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new SessionNotFoundException(session.getId()));
        }
    }

    @SuppressWarnings("PMD.CloseResource")
    private OpenResult openSession(BrowserSession session, OpenOptions options) {
        if (session.isOpen()) {
            PageHandle page = session.activePage()
                    .orElseThrow(() -> new NoActivePageException(session.getId()));
            return new OpenResult(page, false, session.isHeadless(), session.getViewport());
        }

        BrowserProperties.DriverProperties driverProps = properties.getDriver();
        boolean headless = options.getHeadless() != null ? options.getHeadless() : driverProps.isHeadless();
        Viewport viewport = options.getViewport() != null
                ? options.getViewport()
                : new Viewport(driverProps.getViewportWidth(), driverProps.getViewportHeight());

        DriverHandle driver = null;
        ContextHandle context = null;
        try {
            driver = driverPort.launch(LaunchOptions.builder()
                    .browserType(driverProps.getBrowserType())
                    .headless(headless)
                    .actionTimeout(driverProps.getActionTimeout())
                    .build());
            context = driver.newContext(ContextOptions.builder()
                    .viewport(viewport)
                    .userAgent(driverProps.getUserAgent())
                    .locale(driverProps.getLocale())
                    .timezoneId(driverProps.getTimezoneId())
                    .build());
            PageHandle page = context.newPage();

            DriverHandle owned = driver;
            driver.onDisconnected(() -> handleDisconnect(session, owned));
            session.resetBuffers();
            bindCapture(session, page);
            session.attach(driver, context, page, headless, viewport);

            log.info("[Sessions] Opened browser for session '{}' ({} mode, viewport {})",
                    session.getId(), headless ? "headless" : "headed", viewport);
            return new OpenResult(page, true, headless, viewport);
        } catch (SessionNotFoundException e) {
            release(session.getId(), new DetachedResources(driver, context, List.of()));
            throw e;
        } catch (RuntimeException e) {
            release(session.getId(), new DetachedResources(driver, context, List.of()));
            throw new BrowserActionException("open browser", session.getId(), e);
        }
    }

    private void bindCapture(BrowserSession session, PageHandle page) {
        page.onConsole(session.getConsoleBuffer()::append);
        page.onRequest(session.getNetworkBuffer()::append);
    }

    private void handleDisconnect(BrowserSession session, DriverHandle driver) {
        DetachedResources detached = session.detachIfOwnedBy(driver);
        if (!detached.isEmpty()) {
            log.warn("[Sessions] Browser of session '{}' disconnected, session is now closed", session.getId());
            release(session.getId(), detached);
        }
    }

    /**
     * Retire, release and remove a session. Safe to call repeatedly and
     * concurrently; only one caller observes the removal.
     */
    private boolean dispose(BrowserSession session, String reason) {
        teardown(session);
        admissionLock.lock();
        try {
            return removeEntry(session, reason);
        } finally {
            admissionLock.unlock();
        }
    }

    /**
     * Retire the session and release its driver resources. The entry stays in
     * the map.
     *
     * <p>
     * The release is queued behind the session's pending work and awaited for
     * at most {@code browser.sessions.teardown-timeout}. Past that, the session
     * executor is still inside a driver call, and Playwright objects are not
     * safe to use from two threads. The forced path therefore skips the
     * context and browser and only closes the driver connection, which ends
     * the driver process and the browser it launched. The stuck call then fails
     * as an ordinary driver error.
     */
    private void teardown(BrowserSession session) {
        session.retire();
        long timeoutMs = properties.getSessions().getTeardownTimeout().toMillis();
        try {
            Future<?> pending = session.getExecutor().submit(() -> release(session.getId(), session.detach()));
            pending.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[Sessions] Session '{}' still busy after {}, closing its driver connection",
                    session.getId(), Duration.ofMillis(timeoutMs));
            forceRelease(session.getId(), session.detach());
        } catch (ExecutionException | RejectedExecutionException e) {
            release(session.getId(), session.detach());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forceRelease(session.getId(), session.detach());
        }
        session.getExecutor().shutdown();
    }

    private BrowserSession install(String sessionId) {
        BrowserSession created = new BrowserSession(sessionId, sequence.incrementAndGet(), clock.instant(),
                properties.getCapture().getMaxConsoleMessages(),
                properties.getCapture().getMaxNetworkRequests());
        synchronized (sessions) {
            sessions.put(sessionId, created);
        }
        log.info("[Sessions] Created session '{}' ({} resident)", sessionId, size());
        return created;
    }

    /**
     * Remove a torn-down entry and wake admissions waiting for a free slot.
     * Caller holds the admission lock.
     */
    private boolean removeEntry(BrowserSession session, String reason) {
        boolean removed;
        synchronized (sessions) {
            removed = sessions.remove(session.getId(), session);
        }
        if (removed) {
            log.info("[Sessions] Session '{}' {} ({} resident)", session.getId(), reason, size());
        }
        entryRemoved.signalAll();
        return removed;
    }

    /**
     * Release driver resources: context, then browser, then the driver itself.
     * Each step runs even if an earlier one failed; failures are logged only.
     */
    private void release(String sessionId, DetachedResources resources) {
        if (resources.isEmpty()) {
            return;
        }
        ContextHandle context = resources.context();
        DriverHandle driver = resources.driver();
        if (context != null) {
            releaseStep(sessionId, "close context", context::close);
        }
        if (driver != null) {
            releaseStep(sessionId, "close browser", driver::closeBrowser);
            releaseStep(sessionId, "close driver", driver::closeDriver);
        }
        log.debug("[Sessions] Released browser resources of session '{}'", sessionId);
    }

    private void forceRelease(String sessionId, DetachedResources resources) {
        if (resources.driver() != null) {
            releaseStep(sessionId, "close driver", resources.driver()::closeDriver);
        }
    }

    private void releaseStep(String sessionId, String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("[Sessions] Failed to {} for session '{}': {}", step, sessionId, e.getMessage());
        }
    }

    /**
     * Retire the least recently active session that is not already being torn
     * down. Caller holds the admission lock.
     *
     * @return the retired victim, or null if there is none to take
     */
    private BrowserSession claimEvictionVictim() {
        BrowserSession victim;
        synchronized (sessions) {
            victim = sessions.values().stream()
                    .filter(session -> !session.isRetired())
                    .min(Comparator.comparing(BrowserSession::getLastActivityAt)
                            .thenComparingLong(BrowserSession::getSequence))
                    .orElse(null);
        }
        if (victim == null || !victim.retire()) {
            return null;
        }
        log.info("[Sessions] Capacity {} reached, evicting least recently active session '{}'",
                getCapacity(), victim.getId());
        return victim;
    }

    private BrowserSession lookup(String id) {
        if (id == null) {
            return null;
        }
        synchronized (sessions) {
            return sessions.get(id);
        }
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("session id is required");
        }
        return id;
    }
}
