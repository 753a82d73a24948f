package me.golemcore.browser.testsupport;

import me.golemcore.browser.port.outbound.ContextHandle;
import me.golemcore.browser.port.outbound.PageHandle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class FakeContextHandle implements ContextHandle {

    private final List<FakePageHandle> pages = new CopyOnWriteArrayList<>();
    private final boolean failClose;
    private volatile boolean closed;
    private volatile RuntimeException newPageFailure;
    private volatile Runnable closeHook;

    FakeContextHandle(boolean failClose) {
        this.failClose = failClose;
    }

    @Override
    public PageHandle newPage() {
        if (newPageFailure != null) {
            throw newPageFailure;
        }
        FakePageHandle page = new FakePageHandle("https://page" + pages.size() + ".test/", "Page " + pages.size());
        pages.add(page);
        return page;
    }

    @Override
    public void close() {
        if (closeHook != null) {
            closeHook.run();
        }
        closed = true;
        if (failClose) {
            throw new IllegalStateException("context close failed");
        }
    }

    public void onClose(Runnable hook) {
        this.closeHook = hook;
    }

    public void failNewPageWith(RuntimeException failure) {
        this.newPageFailure = failure;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<FakePageHandle> getPages() {
        return pages;
    }

    public FakePageHandle page(int index) {
        return pages.get(index);
    }
}
