package me.golemcore.browser.adapter.outbound.browser;

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

import me.golemcore.browser.port.outbound.FileChooserHandle;
import com.microsoft.playwright.FileChooser;

import java.nio.file.Path;
import java.util.List;

/**
 * Wraps a Playwright {@link FileChooser}. Playwright has no explicit cancel;
 * setting an empty file list resolves the chooser without a selection.
 */
class PlaywrightFileChooserHandle implements FileChooserHandle {

    private final FileChooser chooser;
    private boolean resolved;

    PlaywrightFileChooserHandle(FileChooser chooser) {
        this.chooser = chooser;
    }

    @Override
    public void setFiles(List<Path> files) {
        chooser.setFiles(files.toArray(new Path[0]));
        resolved = true;
    }

    @Override
    public void cancel() {
        chooser.setFiles(new Path[0]);
        resolved = true;
    }

    @Override
    public boolean isResolved() {
        return resolved;
    }

    @Override
    public void close() {
        if (!resolved) {
            cancel();
        }
    }
}
