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
import me.golemcore.browser.domain.model.ScreenshotOptions;
import me.golemcore.browser.domain.model.ScreenshotOptions.ImageFormat;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Captures the viewport, the full page or a single element. The image is
 * returned base64 encoded.
 */
@Component
public class BrowserScreenshotTool extends AbstractBrowserTool {

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_FULL_PAGE = "fullPage";

    public BrowserScreenshotTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = elementProps();
        props.put(PARAM_TYPE, Map.of("type", TYPE_STRING, "description", "Image format, defaults to png",
                "enum", List.of("png", "jpeg")));
        props.put(PARAM_FULL_PAGE, prop(TYPE_BOOLEAN,
                "Capture the full scrollable page instead of the viewport. Cannot be combined with an element."));
        return ToolDefinition.builder()
                .name("browser_take_screenshot")
                .description("Take a screenshot of the current page or of one element.")
                .inputSchema(schema(props, List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        ImageFormat format = format(optionalString(params, PARAM_TYPE));
        boolean fullPage = booleanParam(params, PARAM_FULL_PAGE, false);
        ElementTarget element = target(params);
        boolean hasElement = element.isResolvable();
        if (fullPage && hasElement) {
            throw new IllegalArgumentException("fullPage cannot be combined with an element");
        }
        ScreenshotOptions options = ScreenshotOptions.builder()
                .format(format)
                .fullPage(fullPage)
                .element(hasElement ? element : null)
                .build();

        return registry.executeOnActivePage(sessionId, false, page -> {
            byte[] image = page.screenshot(options);
            String subject = hasElement ? element.describe() : fullPage ? "full page" : "viewport";
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("screenshot_base64", Base64.getEncoder().encodeToString(image));
            data.put("format", format.getExtension());
            data.put("mimeType", format.getMimeType());
            data.put("size", image.length);
            return ToolResult.success(
                    "Screenshot of " + subject + " captured (" + image.length + " bytes, " + format.getExtension()
                            + ")",
                    data);
        });
    }

    @Override
    protected String actionName() {
        return "take screenshot";
    }

    private static ImageFormat format(String type) {
        if (type == null) {
            return ImageFormat.PNG;
        }
        return switch (type.toLowerCase(Locale.ROOT)) {
        case "png" -> ImageFormat.PNG;
        case "jpeg", "jpg" -> ImageFormat.JPEG;
        default -> throw new IllegalArgumentException("Unsupported image type: " + type);
        };
    }
}
