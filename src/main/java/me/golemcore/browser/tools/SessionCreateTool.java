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

import me.golemcore.browser.domain.model.BrowserSession;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Registers a new, unopened session under a generated id.
 */
@Component
public class SessionCreateTool extends AbstractBrowserTool {

    public SessionCreateTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("session_create")
                .description("Create a new session with a unique id. Pass the returned session_id "
                        + "to other tools to use an isolated browser.")
                .inputSchema(Map.of("type", TYPE_OBJECT, "properties", Map.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        BrowserSession session = registry.create();
        return CompletableFuture.completedFuture(ToolResult.success(
                "Created session " + session.getId(),
                Map.of(PARAM_SESSION_ID, session.getId())));
    }

    @Override
    protected String actionName() {
        return "create session";
    }
}
