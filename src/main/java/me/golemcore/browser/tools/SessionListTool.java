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

import me.golemcore.browser.domain.model.SessionSummary;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists every resident session. Does not mark any session as active.
 */
@Component
public class SessionListTool extends AbstractBrowserTool {

    public SessionListTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("session_list")
                .description("List all active browser sessions with their status.")
                .inputSchema(Map.of("type", TYPE_OBJECT, "properties", Map.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        List<SessionSummary> summaries = registry.list();
        List<Map<String, Object>> rows = summaries.stream().map(SessionListTool::toRow).toList();
        if (rows.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.success("No active sessions", Map.of("sessions", rows)));
        }

        StringBuilder output = new StringBuilder();
        output.append(String.format("%d of %d sessions in use:%n", rows.size(), registry.getCapacity()));
        for (SessionSummary summary : summaries) {
            output.append(String.format("- %s: %s, %d tabs, idle %ds%n",
                    summary.getId(), summary.isOpen() ? "open" : "closed", summary.getTabCount(),
                    summary.getIdleSeconds()));
        }
        return CompletableFuture.completedFuture(ToolResult.success(output.toString().trim(),
                Map.of("sessions", rows)));
    }

    @Override
    protected String actionName() {
        return "list sessions";
    }

    private static Map<String, Object> toRow(SessionSummary summary) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(PARAM_SESSION_ID, summary.getId());
        row.put("browser_open", summary.isOpen());
        row.put("num_pages", summary.getTabCount());
        row.put("created_at", summary.getCreatedAt().toString());
        row.put("last_activity", summary.getLastActivityAt().toString());
        row.put("inactive_seconds", summary.getIdleSeconds());
        return row;
    }
}
