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

import me.golemcore.browser.domain.model.ElementTarget;
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
 * Drags one element onto another. Each end is addressed by its own role + name
 * or selector.
 */
@Component
public class BrowserDragTool extends AbstractBrowserTool {

    private static final String START_ELEMENT = "startElement";
    private static final String START_ROLE = "startRole";
    private static final String START_NAME = "startName";
    private static final String START_SELECTOR = "startSelector";
    private static final String END_ELEMENT = "endElement";
    private static final String END_ROLE = "endRole";
    private static final String END_NAME = "endName";
    private static final String END_SELECTOR = "endSelector";

    public BrowserDragTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(START_ELEMENT, prop(TYPE_STRING, "Human-readable source element description"));
        props.put(START_ROLE, prop(TYPE_STRING, "ARIA role of the source element"));
        props.put(START_NAME, prop(TYPE_STRING, "Accessible name of the source element"));
        props.put(START_SELECTOR, prop(TYPE_STRING, "CSS selector of the source element"));
        props.put(END_ELEMENT, prop(TYPE_STRING, "Human-readable target element description"));
        props.put(END_ROLE, prop(TYPE_STRING, "ARIA role of the target element"));
        props.put(END_NAME, prop(TYPE_STRING, "Accessible name of the target element"));
        props.put(END_SELECTOR, prop(TYPE_STRING, "CSS selector of the target element"));
        return ToolDefinition.builder()
                .name("browser_drag")
                .description("Drag and drop between two elements.")
                .inputSchema(schema(props, List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        ElementTarget source = requireResolvable(
                target(params, START_ELEMENT, START_ROLE, START_NAME, START_SELECTOR),
                "(startRole + startName) or startSelector");
        ElementTarget target = requireResolvable(
                target(params, END_ELEMENT, END_ROLE, END_NAME, END_SELECTOR),
                "(endRole + endName) or endSelector");
        return registry.executeOnActivePage(sessionId, false, page -> {
            page.dragTo(source, target);
            return pageResult("Dragged " + source.describe() + " to " + target.describe(), page);
        });
    }

    @Override
    protected String actionName() {
        return "drag";
    }
}
