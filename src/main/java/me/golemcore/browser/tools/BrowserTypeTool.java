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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Types text into an editable element. By default the value is filled at once;
 * {@code slowly} types key by key so that key handlers fire. {@code submit}
 * presses Enter afterwards.
 */
@Component
public class BrowserTypeTool extends AbstractBrowserTool {

    private static final String PARAM_TEXT = "text";
    private static final String PARAM_SUBMIT = "submit";
    private static final String PARAM_SLOWLY = "slowly";

    public BrowserTypeTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = elementProps();
        props.put(PARAM_TEXT, prop(TYPE_STRING, "Text to type into the element"));
        props.put(PARAM_SUBMIT, prop(TYPE_BOOLEAN, "Press Enter after typing"));
        props.put(PARAM_SLOWLY, prop(TYPE_BOOLEAN,
                "Type one character at a time, triggering key handlers. By default the text is filled at once."));
        return ToolDefinition.builder()
                .name("browser_type")
                .description("Type text into an editable element.")
                .inputSchema(schema(props, List.of(PARAM_TEXT)))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        ElementTarget target = requireResolvable(target(params), "(role + name) or selector");
        Object rawText = params.get(PARAM_TEXT);
        if (rawText == null) {
            throw new IllegalArgumentException(PARAM_TEXT + " is required");
        }
        String text = rawText.toString();
        boolean submit = booleanParam(params, PARAM_SUBMIT, false);
        boolean slowly = booleanParam(params, PARAM_SLOWLY, false);

        return registry.executeOnActivePage(sessionId, false, page -> {
            if (slowly) {
                page.type(target, text);
            } else {
                page.fill(target, text);
            }
            if (submit) {
                page.press(target, "Enter");
            }
            String message = "Typed into " + target.describe() + (submit ? " and submitted" : "");
            return pageResult(message, page);
        });
    }

    @Override
    protected String actionName() {
        return "type";
    }
}
