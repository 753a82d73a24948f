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

import me.golemcore.browser.domain.model.ClickOptions;
import me.golemcore.browser.domain.model.ElementTarget;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.port.outbound.FileChooserHandle;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Answers a file chooser. When an element is given it is clicked to open the
 * chooser; otherwise the chooser is expected to open on its own. Without paths
 * the chooser is cancelled.
 */
@Component
public class BrowserFileUploadTool extends AbstractBrowserTool {

    private static final String PARAM_PATHS = "paths";

    public BrowserFileUploadTool(BrowserSessionRegistry registry, BrowserProperties properties) {
        super(registry, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = elementProps();
        props.put(PARAM_PATHS, arrayProp(TYPE_STRING,
                "Absolute paths to the files to upload. If omitted, the file chooser is cancelled."));
        return ToolDefinition.builder()
                .name("browser_file_upload")
                .description("Upload one or multiple files through a file chooser. "
                        + "Give the element that opens the chooser (role + name or selector).")
                .inputSchema(schema(props, List.of()))
                .build();
    }

    @Override
    protected CompletableFuture<ToolResult> run(String sessionId, Map<String, Object> params) {
        ElementTarget trigger = target(params);
        List<Path> paths = stringList(params, PARAM_PATHS).stream().map(Path::of).toList();
        for (Path path : paths) {
            if (!path.isAbsolute()) {
                throw new IllegalArgumentException("File paths must be absolute: " + path);
            }
        }

        return registry.executeOnActivePage(sessionId, false, page -> {
            Runnable openChooser = trigger.isResolvable()
                    ? () -> page.click(trigger, ClickOptions.builder().build())
                    : () -> {
                    };
            try (FileChooserHandle chooser = page.expectFileChooser(openChooser,
                    properties.getDriver().getActionTimeout())) {
                if (paths.isEmpty()) {
                    chooser.cancel();
                    return pageResult("File chooser cancelled", page);
                }
                chooser.setFiles(paths);
            }
            return pageResult("Uploaded " + paths.size() + " file(s)", page);
        });
    }

    @Override
    protected String actionName() {
        return "upload files";
    }
}
