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

import me.golemcore.browser.domain.model.LaunchOptions;
import me.golemcore.browser.port.outbound.BrowserDriverPort;
import me.golemcore.browser.port.outbound.DriverHandle;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Playwright implementation of {@link BrowserDriverPort}.
 *
 * <p>
 * Playwright is not thread-safe, so every launch creates its own
 * {@link Playwright} instance. The session that owns the returned handle is
 * the only user of that instance and calls it from its executor thread.
 *
 * <p>
 * Supported browser types: chromium, firefox, webkit.
 */
@Component
@Slf4j
public class PlaywrightDriverAdapter implements BrowserDriverPort {

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public DriverHandle launch(LaunchOptions options) {
        Playwright playwright = Playwright.create();
        try {
            BrowserType browserType = browserType(playwright, options.getBrowserType());
            Browser browser = browserType.launch(new BrowserType.LaunchOptions()
                    .setHeadless(options.isHeadless()));
            log.debug("Launched {} (headless: {})", browserType.name(), options.isHeadless());
            return new PlaywrightDriverHandle(playwright, browser, options.getActionTimeout());
        } catch (RuntimeException e) {
            // Clean up the driver instance to prevent process leaks
            try {
                playwright.close();
            } catch (RuntimeException ex) {
                log.trace("Error closing Playwright after failed launch: {}", ex.getMessage());
            }
            throw e;
        }
    }

    private static BrowserType browserType(Playwright playwright, String name) {
        String type = name != null ? name.toLowerCase(Locale.ROOT) : "chromium";
        return switch (type) {
        case "chromium", "chrome" -> playwright.chromium();
        case "firefox" -> playwright.firefox();
        case "webkit" -> playwright.webkit();
        default -> throw new IllegalArgumentException("Unsupported browser type: " + name);
        };
    }
}
