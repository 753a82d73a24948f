package me.golemcore.browser.tools;

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

import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Navigates the active tab. Opens the browser on first use.
 *
 * <p>
 * Only http:// and https:// URLs are allowed; a bare host gets https://
 * prepended. javascript:, data: and file: URLs are rejected.
 */
@Component
public class BrowserNavigateTool extends AbstractBrowserTool {

    private static final String PARAM_URL = "url";

    public BrowserNavigateTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_navigate")
                .description("Navigate to a URL in the active tab. Opens the browser if needed.")
                .inputSchema(schema(Map.of(PARAM_URL, prop(TYPE_STRING, "The URL to navigate to")),
                        List.of(PARAM_URL)))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        String url = normalizeUrl(requiredString(params, PARAM_URL));
        return registry.executeOnActivePage(sessionId, true, page -> {
            page.navigate(url);
            return pageResult("Navigated to " + url, page);
        });
    }

    @Override
    protected String actionName() {
        return "navigate";
    }

    static String normalizeUrl(String raw) {
        String url = raw.trim();
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return url;
        }
        // Only allow http/https schemes to prevent file://, javascript:, data: attacks
        if (lower.contains("://") || lower.startsWith("javascript:") || lower.startsWith("data:")
                || lower.startsWith("file:") || lower.startsWith("about:")) {
            throw new IllegalArgumentException("Only http and https URLs are allowed");
        }
        return "https://" + url;
    }
}
