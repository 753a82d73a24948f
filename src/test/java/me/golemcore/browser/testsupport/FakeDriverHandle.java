package me.golemcore.browser.testsupport;

import me.golemcore.browser.domain.model.ContextOptions;
import me.golemcore.browser.port.outbound.ContextHandle;
import me.golemcore.browser.port.outbound.DriverHandle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

public class FakeDriverHandle implements DriverHandle {

    private final List<FakeContextHandle> contexts = new CopyOnWriteArrayList<>();
    private final boolean failContextClose;
    private final boolean failBrowserClose;
    private final RuntimeException pageFailure;
    private volatile boolean browserClosed;
    private volatile boolean driverClosed;
    private final AtomicInteger closeBrowserCalls = new AtomicInteger();
    private volatile Runnable disconnectCallback;
    private volatile ContextOptions lastContextOptions;

    FakeDriverHandle(boolean failContextClose, boolean failBrowserClose, RuntimeException pageFailure) {
        this.failContextClose = failContextClose;
        this.failBrowserClose = failBrowserClose;
        this.pageFailure = pageFailure;
    }

    @Override
    public ContextHandle newContext(ContextOptions options) {
        lastContextOptions = options;
        FakeContextHandle context = new FakeContextHandle(failContextClose);
        if (pageFailure != null) {
            context.failNewPageWith(pageFailure);
        }
        contexts.add(context);
        return context;
    }

    @Override
    public void closeBrowser() {
        closeBrowserCalls.incrementAndGet();
        browserClosed = true;
        if (failBrowserClose) {
            throw new IllegalStateException("browser close failed");
        }
    }

    @Override
    public void closeDriver() {
        driverClosed = true;
    }

    @Override
    public boolean isConnected() {
        return !browserClosed;
    }

    @Override
    public void onDisconnected(Runnable callback) {
        this.disconnectCallback = callback;
    }

    /**
     * Simulate the browser process dying on its own.
     */
    public void crash() {
        browserClosed = true;
        if (disconnectCallback != null) {
            disconnectCallback.run();
        }
    }

    public boolean isBrowserClosed() {
        return browserClosed;
    }

    public boolean isDriverClosed() {
        return driverClosed;
    }

    public int getCloseBrowserCalls() {
        return closeBrowserCalls.get();
    }

    public ContextOptions getLastContextOptions() {
        return lastContextOptions;
    }

    public FakeContextHandle context() {
        return contexts.get(0);
    }

    public List<FakeContextHandle> getContexts() {
        return contexts;
    }
}
