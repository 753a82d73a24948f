package me.golemcore.browser.domain.service;

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

import me.golemcore.browser.domain.component.ToolComponent;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolFailureKind;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry of tool components by name and the single entry point for running
 * them.
 *
 * <p>
 * Unknown and disabled tools are denied with
 * {@link ToolFailureKind#POLICY_DENIED}. Anything escaping a tool, timeouts
 * included, becomes {@link ToolFailureKind#EXECUTION_FAILED}; callers always
 * get a {@link ToolResult}.
 */
@Service
@Slf4j
public class ToolCatalogService {

    private final Map<String, ToolComponent> toolRegistry = new LinkedHashMap<>();
    private final BrowserProperties properties;

    public ToolCatalogService(List<ToolComponent> tools, BrowserProperties properties) {
        this.properties = properties;
        tools.stream()
                .sorted(Comparator.comparing(ToolComponent::getToolName))
                .forEach(tool -> {
                    ToolComponent previous = toolRegistry.put(tool.getToolName(), tool);
                    if (previous != null) {
                        throw new IllegalStateException("Duplicate tool name: " + tool.getToolName());
                    }
                });
        log.info("[Tools] Registered {} tools", toolRegistry.size());
    }

    public List<ToolDefinition> listDefinitions() {
        return toolRegistry.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public CompletableFuture<ToolResult> execute(String name, Map<String, Object> arguments) {
        ToolComponent tool = name != null ? toolRegistry.get(name) : null;
        if (tool == null) {
            String available = String.join(", ", toolRegistry.keySet());
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Unknown tool: " + name + ". Available tools: " + available));
        }
        if (!tool.isEnabled()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Tool is disabled: " + name));
        }

        Duration timeout = properties.getTools().getTimeout();
        log.debug("[Tools] Executing '{}'", name);
        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(arguments != null ? arguments : Map.of());
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    Throwable cause = rootCause(error);
                    if (cause instanceof TimeoutException) {
                        log.error("[Tools] Tool '{}' timed out after {}", name, timeout);
                        return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                                "Tool execution timed out after " + timeout.toSeconds() + "s: " + name);
                    }
                    log.error("[Tools] Tool execution failed: {}", name, error);
                    return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                            "Tool execution failed: " + safeMessage(cause));
                })
                .thenApply(result -> result != null
                        ? result
                        : ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result: " + name));
    }

    private static Throwable rootCause(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        return cursor;
    }

    private static String safeMessage(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
