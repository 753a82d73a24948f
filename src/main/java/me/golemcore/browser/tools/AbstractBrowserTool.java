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

import me.golemcore.browser.domain.component.ToolComponent;
import me.golemcore.browser.domain.exception.BrowserActionException;
import me.golemcore.browser.domain.exception.ResourceNotFoundException;
import me.golemcore.browser.domain.model.ElementTarget;
import me.golemcore.browser.domain.model.ToolFailureKind;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.port.outbound.PageHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base class for browser tools. Resolves the {@code session_id} parameter,
 * turns every failure into a {@link ToolResult} and builds the page-state
 * result returned after an action.
 *
 * <p>
 * Subclasses implement {@link #run(String, Map)}; anything it throws or
 * completes exceptionally with is classified here:
 * <ul>
 * <li>{@link ResourceNotFoundException} - {@link ToolFailureKind#NOT_FOUND}
 * <li>{@link IllegalArgumentException} -
 * {@link ToolFailureKind#INVALID_ARGUMENT}
 * <li>anything else - {@link ToolFailureKind#DRIVER_FAILURE}, naming the action
 * and the session
 * </ul>
 */
@Slf4j
public abstract class AbstractBrowserTool implements ToolComponent {

    protected static final String PARAM_SESSION_ID = "session_id";
    protected static final String PARAM_ELEMENT = "element";
    protected static final String PARAM_ROLE = "role";
    protected static final String PARAM_NAME = "name";
    protected static final String PARAM_SELECTOR = "selector";
    protected static final String PARAM_NTH = "nth";
    protected static final String PARAM_INDEX = "index";

    protected static final String TYPE_STRING = "string";
    protected static final String TYPE_OBJECT = "object";
    protected static final String TYPE_BOOLEAN = "boolean";
    protected static final String TYPE_INTEGER = "integer";
    protected static final String TYPE_NUMBER = "number";
    protected static final String TYPE_ARRAY = "array";

    private static final String KEY_TYPE = "type";
    private static final String KEY_DESCRIPTION = "description";

    protected final BrowserSessionRegistry registry;
    protected final BrowserProperties properties;

    protected AbstractBrowserTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        String sessionId = sessionId(params);
        CompletableFuture<ToolResult> future;
        try {
            future = run(sessionId, params);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(error -> toFailure(sessionId, error));
    }

    /**
     * Performs the tool's work.
     *
     * @param sessionId
     *            the resolved session id
     * @param params
     *            tool parameters, never null
     */
    protected abstract CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params);

    /**
     * Short verb phrase used in failure messages, e.g. "click".
     */
    protected abstract String actionName();

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    // ==================== Results ====================

    /**
     * Result of a page action: the message plus URL, title and accessibility
     * snapshot of the page afterwards. A failed snapshot does not fail the
     * action.
     */
    protected ToolResult pageResult(String message, PageHandle page) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        StringBuilder output = new StringBuilder(message);
        try {
            String url = page.url();
            String title = page.title();
            String snapshot = page.ariaSnapshot();
            data.put("url", url);
            data.put("title", title);
            data.put("snapshot", snapshot);
            output.append(String.format("%n%nURL: %s%nTitle: %s%n%n%s", url, title, snapshot));
        } catch (RuntimeException e) {
            log.debug("[Tools] Snapshot after '{}' failed: {}", actionName(), e.getMessage());
            data.put("snapshot_error", "Failed to capture snapshot: " + e.getMessage());
        }
        return ToolResult.success(output.toString(), data);
    }

    protected ToolResult toFailure(String sessionId, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof ResourceNotFoundException) {
            return ToolResult.failure(ToolFailureKind.NOT_FOUND, cause.getMessage());
        }
        if (cause instanceof IllegalArgumentException) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENT, cause.getMessage());
        }
        if (cause instanceof BrowserActionException) {
            log.warn("[Tools] {}", cause.getMessage());
            return ToolResult.failure(ToolFailureKind.DRIVER_FAILURE, cause.getMessage());
        }
        BrowserActionException wrapped = new BrowserActionException(actionName(), sessionId, cause);
        log.warn("[Tools] {}", wrapped.getMessage());
        return ToolResult.failure(ToolFailureKind.DRIVER_FAILURE, wrapped.getMessage());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    // ==================== Parameters ====================

    protected String sessionId(Map<String, Object> params) {
        String sessionId = optionalString(params, PARAM_SESSION_ID);
        return sessionId != null ? sessionId : properties.getSessions().getDefaultSessionId();
    }

    protected static String requiredString(Map<String, Object> params, String name) {
        String value = optionalString(params, name);
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    protected static String optionalString(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    protected static boolean booleanParam(Map<String, Object> params, String name, boolean defaultValue) {
        Object value = params.get(name);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text && !text.isBlank()) {
            return Boolean.parseBoolean(text.trim());
        }
        return defaultValue;
    }

    protected static Integer integerParam(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if ((value instanceof Double || value instanceof Float) && asDouble != Math.rint(asDouble)) {
                throw new IllegalArgumentException(name + " must be an integer: " + value);
            }
            if (asDouble < Integer.MIN_VALUE || asDouble > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(name + " is out of range: " + value);
            }
            try {
                return Math.toIntExact(number.longValue());
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException(name + " is out of range: " + value, e);
            }
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    protected static Double numberParam(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + value, e);
        }
    }

    protected static List<String> stringList(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        return List.of(value.toString());
    }

    /**
     * Element addressed by the standard {@code element}, {@code role},
     * {@code name}, {@code selector} and {@code nth} parameters.
     */
    protected static ElementTarget target(Map<String, Object> params) {
        return target(params, PARAM_ELEMENT, PARAM_ROLE, PARAM_NAME, PARAM_SELECTOR);
    }

    protected static ElementTarget target(Map<String, Object> params, String elementKey, String roleKey,
            String nameKey, String selectorKey) {
        return ElementTarget.builder()
                .description(optionalString(params, elementKey))
                .role(optionalString(params, roleKey))
                .name(optionalString(params, nameKey))
                .selector(optionalString(params, selectorKey))
                .nth(integerParam(params, PARAM_NTH))
                .build();
    }

    protected static ElementTarget requireResolvable(ElementTarget target, String hint) {
        if (!target.isResolvable()) {
            throw new IllegalArgumentException("Must provide either " + hint);
        }
        return target;
    }

    // ==================== Schema ====================

    /**
     * JSON Schema for the tool parameters. Adds the optional
     * {@code session_id} parameter.
     */
    protected static Map<String, Object> schema(Map<String, Object> props, List<String> required) {
        Map<String, Object> allProps = new LinkedHashMap<>(props);
        allProps.put(PARAM_SESSION_ID, prop(TYPE_STRING,
                "Unique identifier for this client session (default: \"default\")"));
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(KEY_TYPE, TYPE_OBJECT);
        schema.put("properties", allProps);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    protected static Map<String, Object> prop(String type, String description) {
        return Map.of(KEY_TYPE, type, KEY_DESCRIPTION, description);
    }

    protected static Map<String, Object> arrayProp(String itemType, String description) {
        return Map.of(KEY_TYPE, TYPE_ARRAY, "items", Map.of(KEY_TYPE, itemType), KEY_DESCRIPTION, description);
    }

    /**
     * Properties addressing an element: description, role + name, selector and
     * nth.
     */
    protected static Map<String, Object> elementProps() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(PARAM_ELEMENT, prop(TYPE_STRING, "Human-readable element description"));
        props.put(PARAM_ROLE, prop(TYPE_STRING, "ARIA role of the element (e.g., 'button', 'link', 'textbox')"));
        props.put(PARAM_NAME, prop(TYPE_STRING, "Accessible name of the element (from snapshot)"));
        props.put(PARAM_SELECTOR, prop(TYPE_STRING, "CSS selector (fallback if role/name not available)"));
        props.put(PARAM_NTH, prop(TYPE_INTEGER, "Zero-based index when multiple elements match"));
        return props;
    }
}
