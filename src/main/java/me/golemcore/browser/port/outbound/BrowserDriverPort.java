package me.golemcore.browser.port.outbound;

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

import me.golemcore.browser.domain.model.LaunchOptions;

/**
 * Port for the browser automation driver. Each launch yields an independent
 * driver instance and browser process owned by exactly one session.
 *
 * <p>
 * Every call on the returned handles may block for an unbounded time (network,
 * page load) and may fail with an unchecked driver exception.
 */
public interface BrowserDriverPort {

    /**
     * Start a driver instance and launch a browser process.
     */
    DriverHandle launch(LaunchOptions options);
}
