package me.golemcore.browser.adapter.outbound.browser;

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
import me.golemcore.browser.port.outbound.FileChooserHandle;
import me.golemcore.browser.port.outbound.PageHandle;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.options.AriaRole;
import com.microsoft.playwright.options.KeyboardModifier;
import com.microsoft.playwright.options.MouseButton;
import com.microsoft.playwright.options.ScreenshotType;
import com.microsoft.playwright.options.WaitForSelectorState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * {@link PageHandle} over a Playwright {@link Page}.
 *
 * <p>
 * Elements are resolved with {@code getByRole(role, name)} when both are given,
 * otherwise with a CSS selector. {@code nth} narrows multiple matches.
 */
class PlaywrightPageHandle implements PageHandle {

    private static final String BODY = "body";

    private final Page page;

    PlaywrightPageHandle(Page page) {
        this.page = page;
    }

    @Override
    public void onConsole(Consumer<ConsoleMessage> listener) {
        page.onConsoleMessage(message -> listener.accept(ConsoleMessage.builder()
                .type(message.type())
                .text(message.text())
                .location(message.location())
                .timestamp(Instant.now())
                .build()));
    }

    @Override
    public void onRequest(Consumer<NetworkRequest> listener) {
        page.onRequest(request -> listener.accept(NetworkRequest.builder()
                .url(request.url())
                .method(request.method())
                .headers(request.headers())
                .resourceType(request.resourceType())
                .timestamp(Instant.now())
                .build()));
    }

    @Override
    public void navigate(String url) {
        page.navigate(url);
    }

    @Override
    public void goBack() {
        page.goBack();
    }

    @Override
    public String url() {
        return page.url();
    }

    @Override
    public String title() {
        return page.title();
    }

    @Override
    public void setViewportSize(Viewport viewport) {
        page.setViewportSize(viewport.getWidth(), viewport.getHeight());
    }

    @Override
    public void click(ElementTarget target, ClickOptions options) {
        MouseButton button = MouseButton.valueOf(options.getButton().toUpperCase(Locale.ROOT));
        List<KeyboardModifier> modifiers = options.getModifiers().stream()
                .map(modifier -> KeyboardModifier.valueOf(modifier.toUpperCase(Locale.ROOT)))
                .toList();
        Locator locator = locate(target);
        if (options.isDoubleClick()) {
            locator.dblclick(new Locator.DblclickOptions().setButton(button).setModifiers(modifiers));
        } else {
            locator.click(new Locator.ClickOptions().setButton(button).setModifiers(modifiers));
        }
    }

    @Override
    public void hover(ElementTarget target) {
        locate(target).hover();
    }

    @Override
    public void fill(ElementTarget target, String text) {
        locate(target).fill(text);
    }

    @Override
    public void type(ElementTarget target, String text) {
        locate(target).pressSequentially(text);
    }

    @Override
    public void press(ElementTarget target, String key) {
        locate(target).press(key);
    }

    @Override
    public void pressKey(String key) {
        page.keyboard().press(key);
    }

    @Override
    public List<String> selectOption(ElementTarget target, List<String> values) {
        return locate(target).selectOption(values.toArray(new String[0]));
    }

    @Override
    public void dragTo(ElementTarget source, ElementTarget target) {
        locate(source).dragTo(locate(target));
    }

    @Override
    public FileChooserHandle expectFileChooser(Runnable trigger, Duration timeout) {
        Page.WaitForFileChooserOptions options = new Page.WaitForFileChooserOptions();
        if (timeout != null) {
            options.setTimeout(timeout.toMillis());
        }
        return new PlaywrightFileChooserHandle(page.waitForFileChooser(options, trigger));
    }

    @Override
    public void handleNextDialog(boolean accept, String promptText) {
        page.onceDialog(dialog -> {
            if (!accept) {
                dialog.dismiss();
            } else if (promptText != null) {
                dialog.accept(promptText);
            } else {
                dialog.accept();
            }
        });
    }

    @Override
    public void waitForTimeout(Duration duration) {
        page.waitForTimeout(duration.toMillis());
    }

    @Override
    public void waitForText(String text) {
        page.getByText(text).first().waitFor(new Locator.WaitForOptions().setState(WaitForSelectorState.VISIBLE));
    }

    @Override
    public void waitForTextGone(String text) {
        page.getByText(text).first().waitFor(new Locator.WaitForOptions().setState(WaitForSelectorState.HIDDEN));
    }

    @Override
    public byte[] screenshot(ScreenshotOptions options) {
        ScreenshotType type = options.getFormat() == ScreenshotOptions.ImageFormat.JPEG
                ? ScreenshotType.JPEG
                : ScreenshotType.PNG;
        if (options.getElement() != null) {
            return locate(options.getElement()).screenshot(new Locator.ScreenshotOptions().setType(type));
        }
        return page.screenshot(new Page.ScreenshotOptions()
                .setType(type)
                .setFullPage(options.isFullPage()));
    }

    @Override
    public String innerHtml(String selector) {
        if (selector == null) {
            return page.innerHTML(BODY);
        }
        Locator locator = page.locator(selector);
        if (locator.count() == 0) {
            return null;
        }
        return locator.first().innerHTML();
    }

    @Override
    public String ariaSnapshot() {
        return page.locator(BODY).ariaSnapshot();
    }

    @Override
    public Object evaluate(String expression, ElementTarget target) {
        if (target == null) {
            return page.evaluate(expression);
        }
        return locate(target).evaluate(expression);
    }

    @Override
    public void close() {
        page.close();
    }

    @Override
    public boolean isClosed() {
        return page.isClosed();
    }

    private Locator locate(ElementTarget target) {
        Locator locator;
        if (target.hasRole()) {
            locator = page.getByRole(ariaRole(target.getRole()), new Page.GetByRoleOptions().setName(target.getName()));
        } else if (target.hasSelector()) {
            locator = page.locator(target.getSelector());
        } else {
            throw new IllegalArgumentException("Must provide either (role + name) or selector");
        }
        return target.getNth() != null ? locator.nth(target.getNth()) : locator;
    }

    private static AriaRole ariaRole(String role) {
        try {
            return AriaRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ARIA role: " + role, e);
        }
    }
}
