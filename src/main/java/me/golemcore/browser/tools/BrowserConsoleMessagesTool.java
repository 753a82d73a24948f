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

import me.golemcore.browser.domain.model.ConsoleMessage;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Returns console messages captured since the session's browser was opened.
 */
@Component
public class BrowserConsoleMessagesTool extends AbstractBrowserTool {

    private static final String PARAM_ONLY_ERRORS = "onlyErrors";

    public BrowserConsoleMessagesTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_console_messages")
                .description("Return console messages captured in this session.")
                .inputSchema(schema(Map.of(PARAM_ONLY_ERRORS, prop(TYPE_BOOLEAN, "Only return error messages")),
                        List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        boolean onlyErrors = booleanParam(params, PARAM_ONLY_ERRORS, false);
        return registry.execute(sessionId, session -> {
            List<ConsoleMessage> messages = onlyErrors
                    ? session.getConsoleBuffer().snapshot(ConsoleMessage::isError)
                    : session.getConsoleBuffer().snapshot();
            if (messages.isEmpty()) {
                return ToolResult.success(onlyErrors ? "No console errors" : "No console messages",
                        Map.of("messages", messages));
            }
            StringBuilder output = new StringBuilder();
            for (ConsoleMessage message : messages) {
                output.append(String.format("[%s] %s", message.getType(), message.getText()));
                if (message.getLocation() != null) {
                    output.append(" @ ").append(message.getLocation());
                }
                output.append(System.lineSeparator());
            }
            return ToolResult.success(output.toString().trim(), Map.of("messages", messages));
        });
    }

    @Override
    protected String actionName() {
        return "read console messages";
    }
}
