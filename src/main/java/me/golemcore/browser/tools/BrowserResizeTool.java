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
import me.golemcore.browser.domain.model.Viewport;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class BrowserResizeTool extends AbstractBrowserTool {

    private static final String PARAM_WIDTH = "width";
    private static final String PARAM_HEIGHT = "height";

    public BrowserResizeTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(PARAM_WIDTH, prop(TYPE_INTEGER, "Viewport width in pixels"));
        props.put(PARAM_HEIGHT, prop(TYPE_INTEGER, "Viewport height in pixels"));
        return ToolDefinition.builder()
                .name("browser_resize")
                .description("Resize the viewport of the active tab.")
                .inputSchema(schema(props, List.of(PARAM_WIDTH, PARAM_HEIGHT)))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        Integer width = integerParam(params, PARAM_WIDTH);
        Integer height = integerParam(params, PARAM_HEIGHT);
        if (width == null || height == null) {
            throw new IllegalArgumentException("width and height are required");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Viewport dimensions must be positive: " + width + "x" + height);
        }
        Viewport viewport = new Viewport(width, height);
        return registry.executeOnActivePage(sessionId, false, page -> {
            page.setViewportSize(viewport);
            return pageResult("Resized viewport to " + viewport, page);
        });
    }

    @Override
    protected String actionName() {
        return "resize viewport";
    }
}
