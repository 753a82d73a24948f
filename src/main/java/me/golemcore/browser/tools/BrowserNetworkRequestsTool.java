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

import me.golemcore.browser.domain.model.NetworkRequest;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Returns network requests captured since the session's browser was opened.
 */
@Component
public class BrowserNetworkRequestsTool extends AbstractBrowserTool {

    public BrowserNetworkRequestsTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_network_requests")
                .description("Return network requests made by pages in this session.")
                .inputSchema(schema(Map.of(), List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        return registry.execute(sessionId, session -> {
            List<NetworkRequest> requests = session.getNetworkBuffer().snapshot();
            if (requests.isEmpty()) {
                return ToolResult.success("No network requests", Map.of("requests", requests));
            }
            StringBuilder output = new StringBuilder();
            for (NetworkRequest request : requests) {
                output.append(String.format("[%s] %s (%s)%n",
                        request.getMethod(), request.getUrl(), request.getResourceType()));
            }
            return ToolResult.success(output.toString().trim(), Map.of("requests", requests));
        });
    }

    @Override
    protected String actionName() {
        return "read network requests";
    }
}
