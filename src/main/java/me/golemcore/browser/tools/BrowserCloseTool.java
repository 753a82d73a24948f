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
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Closes a session's browser and removes the session. Closing an unknown
 * session is an informational no-op.
 */
@Component
public class BrowserCloseTool extends AbstractBrowserTool {

    public BrowserCloseTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_close")
                .description("Close the browser for this session and clean up all resources.")
                .inputSchema(schema(Map.of(), List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        return CompletableFuture.supplyAsync(() -> {
            boolean closed = registry.close(sessionId);
            Map<String, Object> data = Map.of(PARAM_SESSION_ID, sessionId, "changed", closed);
            if (!closed) {
                return ToolResult.success("Session " + sessionId + " is already closed", data);
            }
            return ToolResult.success("Browser closed and resources cleaned up for session " + sessionId, data);
        });
    }

    @Override
    protected String actionName() {
        return "close browser";
    }
}
