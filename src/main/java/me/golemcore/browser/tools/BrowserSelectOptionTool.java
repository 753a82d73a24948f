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

@Component
public class BrowserSelectOptionTool extends AbstractBrowserTool {

    private static final String PARAM_VALUES = "values";

    public BrowserSelectOptionTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = elementProps();
        props.put(PARAM_VALUES, arrayProp(TYPE_STRING,
                "Values to select in the dropdown. Can be a single value or multiple values."));
        return ToolDefinition.builder()
                .name("browser_select_option")
                .description("Select one or more options in a dropdown.")
                .inputSchema(schema(props, List.of(PARAM_VALUES)))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        ElementTarget target = requireResolvable(target(params), "(role + name) or selector");
        List<String> values = stringList(params, PARAM_VALUES);
        if (values.isEmpty()) {
            throw new IllegalArgumentException(PARAM_VALUES + " must contain at least one value");
        }
        return registry.executeOnActivePage(sessionId, false, page -> {
            List<String> selected = page.selectOption(target, values);
            return pageResult("Selected " + selected + " in " + target.describe(), page);
        });
    }

    @Override
    protected String actionName() {
        return "select option";
    }
}
