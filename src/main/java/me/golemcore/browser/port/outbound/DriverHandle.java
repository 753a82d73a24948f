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

import me.golemcore.browser.domain.model.ContextOptions;

/**
 * Ownership of a launched browser process and the driver instance that
 * controls it.
 */
public interface DriverHandle {

    /**
     * Create an isolated browsing context (separate cookies, storage, cache).
     */
    ContextHandle newContext(ContextOptions options);

    /**
     * Close the browser process.
     */
    void closeBrowser();

    /**
     * Release the driver instance itself. Called after {@link #closeBrowser()}.
     */
    void closeDriver();

    boolean isConnected();

    /**
     * Register a callback fired when the browser goes away on its own (crash,
     * killed process) or after {@link #closeBrowser()}.
     */
    void onDisconnected(Runnable callback);
}
