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

import me.golemcore.browser.domain.model.ClickOptions;
import me.golemcore.browser.domain.model.ElementTarget;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Clicks an element addressed by role + name or selector.
 */
@Component
public class BrowserClickTool extends AbstractBrowserTool {

    private static final String PARAM_DOUBLE_CLICK = "doubleClick";
    private static final String PARAM_BUTTON = "button";
    private static final String PARAM_MODIFIERS = "modifiers";

    private static final Set<String> BUTTONS = Set.of("left", "right", "middle");
    private static final Set<String> MODIFIERS = Set.of("Alt", "Control", "ControlOrMeta", "Meta", "Shift");

    public BrowserClickTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = elementProps();
        props.put(PARAM_DOUBLE_CLICK, prop(TYPE_BOOLEAN, "Whether to perform a double click"));
        props.put(PARAM_BUTTON, Map.of("type", TYPE_STRING, "description", "Button to click, defaults to left",
                "enum", List.of("left", "right", "middle")));
        props.put(PARAM_MODIFIERS, arrayProp(TYPE_STRING, "Modifier keys to press (Alt, Control, Meta, Shift)"));
        return ToolDefinition.builder()
                .name("browser_click")
                .description("Click an element on the page. Use role + name from the snapshot, or a CSS selector.")
                .inputSchema(schema(props, List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        ElementTarget target = requireResolvable(target(params), "(role + name) or selector");
        String button = optionalString(params, PARAM_BUTTON);
        if (button != null && !BUTTONS.contains(button)) {
            throw new IllegalArgumentException("Unknown mouse button: " + button);
        }
        List<String> modifiers = stringList(params, PARAM_MODIFIERS);
        for (String modifier : modifiers) {
            if (!MODIFIERS.contains(modifier)) {
                throw new IllegalArgumentException("Unknown modifier key: " + modifier);
            }
        }
        boolean doubleClick = booleanParam(params, PARAM_DOUBLE_CLICK, false);
        ClickOptions options = ClickOptions.builder()
                .doubleClick(doubleClick)
                .button(button != null ? button : "left")
                .modifiers(modifiers)
                .build();

        return registry.executeOnActivePage(sessionId, false, page -> {
            page.click(target, options);
            String verb = doubleClick ? "Double-clicked" : "Clicked";
            return pageResult(verb + " " + target.describe(), page);
        });
    }

    @Override
    protected String actionName() {
        return "click";
    }
}
