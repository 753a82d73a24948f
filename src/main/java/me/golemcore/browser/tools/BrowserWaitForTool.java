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

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Waits for a fixed time, for text to appear or for text to disappear. The
 * conditions given are applied in that order.
 */
@Component
public class BrowserWaitForTool extends AbstractBrowserTool {

    private static final String PARAM_TIME = "time";
    private static final String PARAM_TEXT = "text";
    private static final String PARAM_TEXT_GONE = "textGone";

    public BrowserWaitForTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(PARAM_TIME, prop(TYPE_NUMBER, "The time to wait in seconds"));
        props.put(PARAM_TEXT, prop(TYPE_STRING, "The text to wait for"));
        props.put(PARAM_TEXT_GONE, prop(TYPE_STRING, "The text to wait for to disappear"));
        return ToolDefinition.builder()
                .name("browser_wait_for")
                .description("Wait for text to appear or disappear or a specified time to pass.")
                .inputSchema(schema(props, List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        Double seconds = numberParam(params, PARAM_TIME);
        String text = optionalString(params, PARAM_TEXT);
        String textGone = optionalString(params, PARAM_TEXT_GONE);
        if (seconds == null && text == null && textGone == null) {
            throw new IllegalArgumentException("Provide at least one of time, text or textGone");
        }
        if (seconds != null && seconds < 0) {
            throw new IllegalArgumentException("time must not be negative: " + seconds);
        }

        return registry.executeOnActivePage(sessionId, false, page -> {
            List<String> waited = new ArrayList<>();
            if (seconds != null) {
                page.waitForTimeout(Duration.ofMillis(Math.round(seconds * 1000)));
                waited.add("waited " + seconds + "s");
            }
            if (text != null) {
                page.waitForText(text);
                waited.add("text \"" + text + "\" appeared");
            }
            if (textGone != null) {
                page.waitForTextGone(textGone);
                waited.add("text \"" + textGone + "\" disappeared");
            }
            return pageResult("Wait complete: " + String.join(", ", waited), page);
        });
    }

    @Override
    protected String actionName() {
        return "wait";
    }
}
