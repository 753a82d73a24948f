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
import me.golemcore.browser.port.outbound.PageHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fills several form fields in one call. Fields without a value are skipped; a
 * field that fails does not stop the others, its error is reported with the
 * result.
 */
@Component
@Slf4j
public class BrowserFillFormTool extends AbstractBrowserTool {

    private static final String PARAM_FIELDS = "fields";
    private static final String PARAM_VALUE = "value";

    public BrowserFillFormTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> fieldProps = elementProps();
        fieldProps.put(PARAM_VALUE, prop(TYPE_STRING, "Value to fill in"));
        Map<String, Object> fields = Map.of(
                "type", TYPE_ARRAY,
                "description", "Fields to fill in",
                "items", Map.of("type", TYPE_OBJECT, "properties", fieldProps));
        return ToolDefinition.builder()
                .name("browser_fill_form")
                .description("Fill multiple form fields. Each field uses role + name or a CSS selector.")
                .inputSchema(schema(Map.of(PARAM_FIELDS, fields), List.of(PARAM_FIELDS)))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        List<Map<String, Object>> fields = fields(params);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException(PARAM_FIELDS + " must contain at least one field");
        }
        return registry.executeOnActivePage(sessionId, false, page -> fill(page, fields));
    }

    @Override
    protected String actionName() {
        return "fill form";
    }

    private ToolResult fill(PageHandle page, List<Map<String, Object>> fields) {
        List<String> filled = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Map<String, Object> field : fields) {
            Object value = field.get(PARAM_VALUE);
            if (value == null || value.toString().isEmpty()) {
                continue;
            }
            ElementTarget target = target(field);
            if (!target.isResolvable()) {
                errors.add(target.describe() + ": Must provide either (role + name) or selector");
                continue;
            }
            try {
                page.fill(target, value.toString());
                filled.add(target.describe());
            } catch (RuntimeException e) {
                log.debug("[Tools] Failed to fill {}: {}", target.describe(), e.getMessage());
                errors.add(target.describe() + ": " + e.getMessage());
            }
        }

        StringBuilder message = new StringBuilder("Filled " + filled.size() + " field(s)");
        if (!filled.isEmpty()) {
            message.append(": ").append(String.join(", ", filled));
        }
        if (!errors.isEmpty()) {
            message.append(String.format("%nErrors:%n- ")).append(String.join(String.format("%n- "), errors));
        }
        ToolResult result = pageResult(message.toString(), page);
        if (result.getData() instanceof Map<?, ?> data) {
            Map<String, Object> enriched = new LinkedHashMap<>();
            data.forEach((key, val) -> enriched.put(key.toString(), val));
            enriched.put("filled", filled);
            enriched.put("errors", errors);
            result.setData(enriched);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> fields(Map<String, Object> params) {
        Object raw = params.get(PARAM_FIELDS);
        if (raw == null) {
            throw new IllegalArgumentException(PARAM_FIELDS + " is required");
        }
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException(PARAM_FIELDS + " must be an array");
        }
        List<Map<String, Object>> fields = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?>)) {
                throw new IllegalArgumentException("Each entry of " + PARAM_FIELDS + " must be an object");
            }
            fields.add((Map<String, Object>) item);
        }
        return fields;
    }
}
