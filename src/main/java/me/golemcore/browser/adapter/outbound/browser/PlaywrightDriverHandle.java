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

import me.golemcore.browser.domain.model.ContextOptions;
import me.golemcore.browser.port.outbound.ContextHandle;
import me.golemcore.browser.port.outbound.DriverHandle;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Playwright;

import java.time.Duration;

/**
 * One Playwright instance with the browser it launched.
 */
class PlaywrightDriverHandle implements DriverHandle {

    private final Playwright playwright;
    private final Browser browser;
    private final Duration actionTimeout;

    PlaywrightDriverHandle(Playwright playwright, Browser browser, Duration actionTimeout) {
        this.playwright = playwright;
        this.browser = browser;
        this.actionTimeout = actionTimeout;
    }

    @Override
    public ContextHandle newContext(ContextOptions options) {
        Browser.NewContextOptions contextOptions = new Browser.NewContextOptions();
        if (options.getViewport() != null) {
            contextOptions.setViewportSize(options.getViewport().getWidth(), options.getViewport().getHeight());
        }
        if (hasText(options.getUserAgent())) {
            contextOptions.setUserAgent(options.getUserAgent());
        }
        if (hasText(options.getLocale())) {
            contextOptions.setLocale(options.getLocale());
        }
        if (hasText(options.getTimezoneId())) {
            contextOptions.setTimezoneId(options.getTimezoneId());
        }
        BrowserContext context = browser.newContext(contextOptions);
        if (actionTimeout != null) {
            context.setDefaultTimeout(actionTimeout.toMillis());
        }
        return new PlaywrightContextHandle(context);
    }

    @Override
    public void closeBrowser() {
        browser.close();
    }

    @Override
    public void closeDriver() {
        playwright.close();
    }

    @Override
    public boolean isConnected() {
        return browser.isConnected();
    }

    @Override
    public void onDisconnected(Runnable callback) {
        browser.onDisconnected(closed -> callback.run());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
