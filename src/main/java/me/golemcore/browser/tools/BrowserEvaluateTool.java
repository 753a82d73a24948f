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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Evaluates a JavaScript function on the page, or on one element when an
 * element is given. The result is rendered as JSON.
 */
@Component
@Slf4j
public class BrowserEvaluateTool extends AbstractBrowserTool {

    private static final String PARAM_FUNCTION = "function";

    private final ObjectMapper objectMapper;

    public BrowserEvaluateTool(BrowserSessionRegistry registry, BrowserProperties properties,
            ObjectMapper objectMapper) {
        super(registry, properties);
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = elementProps();
        props.put(PARAM_FUNCTION, prop(TYPE_STRING,
                "() => { /* code */ } or (element) => { /* code */ } when an element is given"));
        return ToolDefinition.builder()
                .name("browser_evaluate")
                .description("Evaluate a JavaScript expression on the page or an element.")
                .inputSchema(schema(props, List.of(PARAM_FUNCTION)))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        String function = requiredString(params, PARAM_FUNCTION);
        ElementTarget element = target(params);
        ElementTarget scope = element.isResolvable() ? element : null;
        return registry.executeOnActivePage(sessionId, false, page -> {
            Object result = page.evaluate(function, scope);
            Map<String, Object> data = new HashMap<>();
            data.put("result", result);
            return ToolResult.success(render(result), data);
        });
    }

    @Override
    protected String actionName() {
        return "evaluate script";
    }

    private String render(Object result) {
        if (result == null) {
            return "undefined";
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.debug("[Tools] Evaluation result is not JSON serializable: {}", e.getMessage());
            return String.valueOf(result);
        }
    }
}
