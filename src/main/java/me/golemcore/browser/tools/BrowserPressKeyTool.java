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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class BrowserPressKeyTool extends AbstractBrowserTool {

    private static final String PARAM_KEY = "key";

    public BrowserPressKeyTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("browser_press_key")
                .description("Press a key on the keyboard.")
                .inputSchema(schema(Map.of(PARAM_KEY, prop(TYPE_STRING,
                        "Name of the key, such as ArrowLeft or Enter, or a character such as a")),
                        List.of(PARAM_KEY)))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        String key = requiredString(params, PARAM_KEY);
        return registry.executeOnActivePage(sessionId, false, page -> {
            page.pressKey(key);
            return pageResult("Pressed key " + key, page);
        });
    }

    @Override
    protected String actionName() {
        return "press key";
    }
}
