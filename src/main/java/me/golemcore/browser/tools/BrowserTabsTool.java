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

import me.golemcore.browser.domain.model.TabInfo;
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
 * Lists, creates, closes and selects tabs of a session.
 *
 * <p>
 * Actions:
 * <ul>
 * <li>list - all tabs with title, URL and the active marker
 * <li>create - new tab, becomes active; opens the browser if needed
 * <li>close - tab at {@code index}, or the active tab
 * <li>select - make the tab at {@code index} active
 * </ul>
 */
@Component
public class BrowserTabsTool extends AbstractBrowserTool {

    private static final String PARAM_ACTION = "action";

    public BrowserTabsTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(PARAM_ACTION, Map.of(
                "type", TYPE_STRING,
                "description", "Operation to perform",
                "enum", List.of("list", "create", "close", "select")));
        props.put(PARAM_INDEX, prop(TYPE_INTEGER,
                "Tab index, used for close and select. If omitted for close, the current tab is closed."));
        return ToolDefinition.builder()
                .name("browser_tabs")
                .description("List, create, close, or select a browser tab.")
                .inputSchema(schema(props, List.of(PARAM_ACTION)))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        String action = requiredString(params, PARAM_ACTION);
        Integer index = integerParam(params, PARAM_INDEX);
        return switch (action) {
        case "list" -> registry.listTabs(sessionId).thenApply(BrowserTabsTool::formatTabs);
        case "create" -> registry.createTab(sessionId)
                .thenApply(created -> ToolResult.success("Created new tab at index " + created,
                        Map.of(PARAM_INDEX, created)));
        case "close" -> registry.closeTab(sessionId, index)
                .thenApply(closed -> ToolResult.success("Closed tab at index " + closed,
                        Map.of(PARAM_INDEX, closed)));
        case "select" -> {
            if (index == null) {
                throw new IllegalArgumentException("Index required for select action");
            }
            yield registry.selectTab(sessionId, index)
                    .thenApply(selected -> ToolResult.success("Selected tab at index " + selected,
                            Map.of(PARAM_INDEX, selected)));
        }
        default -> throw new IllegalArgumentException("Unknown action: " + action);
        };
    }

    @Override
    protected String actionName() {
        return "manage tabs";
    }

    private static ToolResult formatTabs(List<TabInfo> tabs) {
        if (tabs.isEmpty()) {
            return ToolResult.success("No tabs open", Map.of("tabs", List.of()));
        }
        StringBuilder output = new StringBuilder();
        List<Map<String, Object>> rows = tabs.stream().map(tab -> {
            output.append(String.format("%s%d: %s (%s)%n",
                    tab.isActive() ? "* " : "  ", tab.getIndex(), tab.getTitle(), tab.getUrl()));
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(PARAM_INDEX, tab.getIndex());
            row.put("title", tab.getTitle());
            row.put("url", tab.getUrl());
            row.put("active", tab.isActive());
            return row;
        }).toList();
        return ToolResult.success(output.toString().trim(), Map.of("tabs", rows));
    }
}
