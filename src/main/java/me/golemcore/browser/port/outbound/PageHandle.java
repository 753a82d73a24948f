package me.golemcore.browser.port.outbound;

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

import me.golemcore.browser.domain.model.ClickOptions;
import me.golemcore.browser.domain.model.ConsoleMessage;
import me.golemcore.browser.domain.model.ElementTarget;
import me.golemcore.browser.domain.model.NetworkRequest;
import me.golemcore.browser.domain.model.ScreenshotOptions;
import me.golemcore.browser.domain.model.Viewport;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * A single browser page (tab). Action primitives are forwarded to the driver
 * unchanged; results are returned as-is.
 */
public interface PageHandle {

    // ==================== Event capture ====================

    void onConsole(Consumer<ConsoleMessage> listener);

    void onRequest(Consumer<NetworkRequest> listener);

    // ==================== Navigation ====================

    void navigate(String url);

    void goBack();

    String url();

    String title();

    void setViewportSize(Viewport viewport);

    // ==================== Interaction ====================

    void click(ElementTarget target, ClickOptions options);

    void hover(ElementTarget target);

    /**
     * Replace the element's value with {@code text}.
     */
    void fill(ElementTarget target, String text);

    /**
     * Type {@code text} one key at a time.
     */
    void type(ElementTarget target, String text);

    /**
     * Press a key while the element is focused.
     */
    void press(ElementTarget target, String key);

    /**
     * Press a key on the page keyboard.
     */
    void pressKey(String key);

    List<String> selectOption(ElementTarget target, List<String> values);

    void dragTo(ElementTarget source, ElementTarget target);

    /**
     * Wait for a file chooser opened by {@code trigger}. The returned handle must
     * be closed.
     */
    FileChooserHandle expectFileChooser(Runnable trigger, Duration timeout);

    /**
     * Arrange for the next dialog (alert, confirm, prompt) to be accepted or
     * dismissed.
     */
    void handleNextDialog(boolean accept, String promptText);

    // ==================== Waiting ====================

    void waitForTimeout(Duration duration);

    void waitForText(String text);

    void waitForTextGone(String text);

    // ==================== Inspection ====================

    byte[] screenshot(ScreenshotOptions options);

    /**
     * Inner HTML of the first element matching {@code selector}, or of the body
     * when the selector is null.
     */
    String innerHtml(String selector);

    /**
     * ARIA snapshot of the page body in the driver's YAML format.
     */
    String ariaSnapshot();

    Object evaluate(String expression, ElementTarget target);

    // ==================== Lifecycle ====================

    void close();

    boolean isClosed();
}
