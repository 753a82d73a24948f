package me.golemcore.browser.domain.model;

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

import lombok.Builder;
import lombok.Data;

/**
 * Screenshot options. When {@code element} is set only that element is
 * captured and {@code fullPage} is ignored.
 */
@Data
@Builder
public class ScreenshotOptions {

    @Builder.Default
    private ImageFormat format = ImageFormat.PNG;
    private boolean fullPage;
    private ElementTarget element;

    public enum ImageFormat {
        PNG("image/png"), JPEG("image/jpeg");

        private final String mimeType;

        ImageFormat(String mimeType) {
            this.mimeType = mimeType;
        }

        public String getMimeType() {
            return mimeType;
        }

        public String getExtension() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }
}
