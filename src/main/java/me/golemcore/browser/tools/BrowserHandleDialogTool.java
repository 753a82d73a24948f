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
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Arms a one-shot handler for the next dialog of the active tab. Call it
 * before the action that opens the dialog.
 */
@Component
public class BrowserHandleDialogTool extends AbstractBrowserTool {

    private static final String PARAM_ACCEPT = "accept";
    private static final String PARAM_PROMPT_TEXT = "promptText";

    public BrowserHandleDialogTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(PARAM_ACCEPT, prop(TYPE_BOOLEAN, "Whether to accept the dialog"));
        props.put(PARAM_PROMPT_TEXT, prop(TYPE_STRING, "The text to enter in case of a prompt dialog"));
        return ToolDefinition.builder()
                .name("browser_handle_dialog")
                .description("Handle the next dialog (alert, confirm, prompt).")
                .inputSchema(schema(props, List.of(PARAM_ACCEPT)))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        if (params.get(PARAM_ACCEPT) == null) {
            throw new IllegalArgumentException(PARAM_ACCEPT + " is required");
        }
        boolean accept = booleanParam(params, PARAM_ACCEPT, true);
        String promptText = optionalString(params, PARAM_PROMPT_TEXT);
        return registry.executeOnActivePage(sessionId, false, page -> {
            page.handleNextDialog(accept, promptText);
            return ToolResult.success("Dialog handler set to " + (accept ? "accept" : "dismiss"),
                    Map.of(PARAM_ACCEPT, accept));
        });
    }

    @Override
    protected String actionName() {
        return "handle dialog";
    }
}
