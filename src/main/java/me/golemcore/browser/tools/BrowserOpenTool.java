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

import me.golemcore.browser.domain.model.OpenOptions;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.model.Viewport;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Launches the browser for a session. Opening an already open session is an
 * informational no-op.
 */
@Component
public class BrowserOpenTool extends AbstractBrowserTool {

    private static final String PARAM_HEADLESS = "headless";
    private static final String PARAM_WIDTH = "width";
    private static final String PARAM_HEIGHT = "height";

    public BrowserOpenTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(PARAM_HEADLESS, prop(TYPE_BOOLEAN, "Run without a visible window (default from configuration)"));
        props.put(PARAM_WIDTH, prop(TYPE_INTEGER, "Viewport width in pixels"));
        props.put(PARAM_HEIGHT, prop(TYPE_INTEGER, "Viewport height in pixels"));
        return ToolDefinition.builder()
                .name("browser_open")
                .description("Open a browser for this session. Each session has its own isolated browser.")
                .inputSchema(schema(props, List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        BrowserProperties.DriverProperties driver = properties.getDriver();
        boolean headless = booleanParam(params, PARAM_HEADLESS, driver.isHeadless());
        Integer width = integerParam(params, PARAM_WIDTH);
        Integer height = integerParam(params, PARAM_HEIGHT);
        Viewport viewport = new Viewport(
                width != null ? width : driver.getViewportWidth(),
                height != null ? height : driver.getViewportHeight());
        if (viewport.getWidth() <= 0 || viewport.getHeight() <= 0) {
            throw new IllegalArgumentException("Viewport dimensions must be positive: " + viewport);
        }

        OpenOptions options = OpenOptions.builder()
                .headless(headless)
                .viewport(viewport)
                .build();
        return registry.open(sessionId, options).thenApply(result -> {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put(PARAM_SESSION_ID, sessionId);
            data.put("changed", result.isOpened());
            if (!result.isOpened()) {
                return ToolResult.success("Browser is already open for session " + sessionId, data);
            }
            String mode = result.isHeadless() ? "headless" : "headed";
            data.put(PARAM_HEADLESS, result.isHeadless());
            data.put("viewport", result.getViewport().toString());
            return ToolResult.success(String.format("Browser opened in %s mode for session %s with viewport %s",
                    mode, sessionId, result.getViewport()), data);
        });
    }

    @Override
    protected String actionName() {
        return "open browser";
    }
}
