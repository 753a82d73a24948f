package me.golemcore.browser.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the browser service, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code browser.*} prefix:
 * <ul>
 * <li>{@link SessionProperties} - registry capacity, idle reaping, teardown</li>
 * <li>{@link DriverProperties} - Playwright launch and context settings</li>
 * <li>{@link CaptureProperties} - console and network buffer limits</li>
 * <li>{@link ToolsProperties} - tool execution limits</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "browser")
@Data
public class BrowserProperties {

    private boolean enabled = true;
    private SessionProperties sessions = new SessionProperties();
    private DriverProperties driver = new DriverProperties();
    private CaptureProperties capture = new CaptureProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class SessionProperties {
        private int capacity = 10;
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration reapInterval = Duration.ofMinutes(5);
        private Duration teardownTimeout = Duration.ofSeconds(10);
        private boolean autoCreate = true;
        private String defaultSessionId = "default";
    }

    @Data
    public static class DriverProperties {
        private boolean headless = true;
        private String browserType = "chromium";
        private int viewportWidth = 1920;
        private int viewportHeight = 1080;
        private String userAgent;
        private String locale = "en-US";
        private String timezoneId;
        private Duration actionTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class CaptureProperties {
        private int maxConsoleMessages = 1000;
        private int maxNetworkRequests = 1000;
    }

    @Data
    public static class ToolsProperties {
        private Duration timeout = Duration.ofSeconds(60);
        private int maxHtmlLength = 50000;
    }
}
