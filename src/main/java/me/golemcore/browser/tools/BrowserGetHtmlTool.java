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

import me.golemcore.browser.domain.exception.ResourceNotFoundException;
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
 * Returns the inner HTML of the page body or of the first element matching a
 * selector, truncated to {@code maxLength} characters.
 */
@Component
public class BrowserGetHtmlTool extends AbstractBrowserTool {

    private static final String PARAM_MAX_LENGTH = "maxLength";

    public BrowserGetHtmlTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(PARAM_SELECTOR, prop(TYPE_STRING, "CSS selector of the element, defaults to the body"));
        props.put(PARAM_MAX_LENGTH, prop(TYPE_INTEGER,
                "Maximum number of characters to return (default " + properties.getTools().getMaxHtmlLength()
                        + ")"));
        return ToolDefinition.builder()
                .name("browser_get_html")
                .description("Get the HTML content of the page or of an element.")
                .inputSchema(schema(props, List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        String selector = optionalString(params, PARAM_SELECTOR);
        Integer requested = integerParam(params, PARAM_MAX_LENGTH);
        int maxLength = requested != null ? requested : properties.getTools().getMaxHtmlLength();
        if (maxLength <= 0) {
            throw new IllegalArgumentException(PARAM_MAX_LENGTH + " must be positive: " + maxLength);
        }

        return registry.executeOnActivePage(sessionId, false, page -> {
            String html = page.innerHtml(selector);
            if (html == null) {
                throw new ResourceNotFoundException("No element matches selector: " + selector);
            }
            int originalLength = html.length();
            String output = html;
            if (originalLength > maxLength) {
                output = html.substring(0, maxLength)
                        + String.format("%n%n... (truncated, %d of %d characters shown)", maxLength, originalLength);
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put(PARAM_SELECTOR, selector != null ? selector : "body");
            data.put("length", originalLength);
            data.put("truncated", originalLength > maxLength);
            return ToolResult.success(output, data);
        });
    }

    @Override
    protected String actionName() {
        return "get HTML";
    }
}
