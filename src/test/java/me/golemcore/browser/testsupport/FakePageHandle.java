package me.golemcore.browser.testsupport;

import me.golemcore.browser.domain.model.ClickOptions;
import me.golemcore.browser.domain.model.ConsoleMessage;
import me.golemcore.browser.domain.model.ElementTarget;
import me.golemcore.browser.domain.model.NetworkRequest;
import me.golemcore.browser.domain.model.ScreenshotOptions;
import me.golemcore.browser.domain.model.Viewport;
import me.golemcore.browser.port.outbound.FileChooserHandle;
import me.golemcore.browser.port.outbound.PageHandle;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Page that records every call as {@code "action:detail"} and can be told to
 * fail a given action.
 */
public class FakePageHandle implements PageHandle {

    private final List<String> actions = new CopyOnWriteArrayList<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final Map<String, String> html = new ConcurrentHashMap<>();
    private final List<Consumer<ConsoleMessage>> consoleListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<NetworkRequest>> requestListeners = new CopyOnWriteArrayList<>();

    private volatile String url;
    private volatile String title;
    private volatile String snapshot = "- document";
    private volatile Object evaluationResult;
    private volatile byte[] screenshot = new byte[] { 1, 2, 3 };
    private volatile ScreenshotOptions lastScreenshotOptions;
    private volatile ClickOptions lastClickOptions;
    private volatile FakeFileChooser lastFileChooser;
    private volatile boolean closed;

    public FakePageHandle(String url, String title) {
        this.url = url;
        this.title = title;
        html.put("body", "<h1>" + title + "</h1>");
    }

    // ==================== Test controls ====================

    public void failOn(String action, RuntimeException failure) {
        failures.put(action, failure);
    }

    public void setHtml(String selector, String content) {
        html.put(selector, content);
    }

    public void setSnapshot(String snapshot) {
        this.snapshot = snapshot;
    }

    public void setEvaluationResult(Object evaluationResult) {
        this.evaluationResult = evaluationResult;
    }

    public void setScreenshot(byte[] screenshot) {
        this.screenshot = screenshot;
    }

    public void emitConsole(ConsoleMessage message) {
        consoleListeners.forEach(listener -> listener.accept(message));
    }

    public void emitRequest(NetworkRequest request) {
        requestListeners.forEach(listener -> listener.accept(request));
    }

    public List<String> getActions() {
        return actions;
    }

    public ScreenshotOptions getLastScreenshotOptions() {
        return lastScreenshotOptions;
    }

    public ClickOptions getLastClickOptions() {
        return lastClickOptions;
    }

    public FakeFileChooser getLastFileChooser() {
        return lastFileChooser;
    }

    // ==================== PageHandle ====================

    @Override
    public void onConsole(Consumer<ConsoleMessage> listener) {
        consoleListeners.add(listener);
    }

    @Override
    public void onRequest(Consumer<NetworkRequest> listener) {
        requestListeners.add(listener);
    }

    @Override
    public void navigate(String target) {
        record("navigate", target);
        this.url = target;
    }

    @Override
    public void goBack() {
        record("goBack", "");
    }

    @Override
    public String url() {
        check("url");
        return url;
    }

    @Override
    public String title() {
        check("title");
        return title;
    }

    @Override
    public void setViewportSize(Viewport viewport) {
        record("resize", viewport.toString());
    }

    @Override
    public void click(ElementTarget target, ClickOptions options) {
        lastClickOptions = options;
        record("click", target.describe());
    }

    @Override
    public void hover(ElementTarget target) {
        record("hover", target.describe());
    }

    @Override
    public void fill(ElementTarget target, String text) {
        record("fill", target.describe() + "=" + text);
    }

    @Override
    public void type(ElementTarget target, String text) {
        record("type", target.describe() + "=" + text);
    }

    @Override
    public void press(ElementTarget target, String key) {
        record("press", target.describe() + "=" + key);
    }

    @Override
    public void pressKey(String key) {
        record("pressKey", key);
    }

    @Override
    public List<String> selectOption(ElementTarget target, List<String> values) {
        record("selectOption", target.describe() + "=" + values);
        return values;
    }

    @Override
    public void dragTo(ElementTarget source, ElementTarget target) {
        record("drag", source.describe() + "->" + target.describe());
    }

    @Override
    public FileChooserHandle expectFileChooser(Runnable trigger, Duration timeout) {
        record("expectFileChooser", String.valueOf(timeout));
        trigger.run();
        lastFileChooser = new FakeFileChooser();
        return lastFileChooser;
    }

    @Override
    public void handleNextDialog(boolean accept, String promptText) {
        record("dialog", accept + ":" + promptText);
    }

    @Override
    public void waitForTimeout(Duration duration) {
        record("waitForTimeout", String.valueOf(duration.toMillis()));
    }

    @Override
    public void waitForText(String text) {
        record("waitForText", text);
    }

    @Override
    public void waitForTextGone(String text) {
        record("waitForTextGone", text);
    }

    @Override
    public byte[] screenshot(ScreenshotOptions options) {
        lastScreenshotOptions = options;
        record("screenshot", options.getFormat().getExtension());
        return screenshot;
    }

    @Override
    public String innerHtml(String selector) {
        record("innerHtml", String.valueOf(selector));
        return html.get(selector != null ? selector : "body");
    }

    @Override
    public String ariaSnapshot() {
        check("ariaSnapshot");
        return snapshot;
    }

    @Override
    public Object evaluate(String expression, ElementTarget target) {
        record("evaluate", expression + (target != null ? "@" + target.describe() : ""));
        return evaluationResult;
    }

    @Override
    public void close() {
        record("close", "");
        closed = true;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    private void record(String action, String detail) {
        check(action);
        actions.add(action + ":" + detail);
    }

    private void check(String action) {
        RuntimeException failure = failures.get(action);
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * File chooser that remembers how it was resolved.
     */
    public static class FakeFileChooser implements FileChooserHandle {

        private volatile List<Path> files;
        private volatile boolean cancelled;

        @Override
        public void setFiles(List<Path> selected) {
            this.files = selected;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isResolved() {
            return files != null || cancelled;
        }

        @Override
        public void close() {
            if (!isResolved()) {
                cancel();
            }
        }

        public List<Path> getFiles() {
            return files;
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }
}
