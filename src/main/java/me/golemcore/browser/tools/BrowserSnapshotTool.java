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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class BrowserSnapshotTool extends AbstractBrowserTool {

    public BrowserSnapshotTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_snapshot")
                .description("Capture an accessibility snapshot of the current page. "
                        + "Use the roles and names it shows to address elements in other tools.")
                .inputSchema(schema(Map.of(), List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        return registry.executeOnActivePage(sessionId, false, page -> {
            // the snapshot is the payload here, so its failure fails the tool
            String url = page.url();
            String title = page.title();
            String snapshot = page.ariaSnapshot();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("url", url);
            data.put("title", title);
            data.put("snapshot", snapshot);
            return ToolResult.success(String.format("URL: %s%nTitle: %s%n%n%s", url, title, snapshot), data);
        });
    }

    @Override
    protected String actionName() {
        return "capture snapshot";
    }
}
