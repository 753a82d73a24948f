package me.golemcore.browser;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Multi-tenant browser automation server.
 *
 * <p>
 * Clients address isolated browser sessions by id and drive them through
 * tools exposed over HTTP:
 *
 * <pre>
 * Inbound            → ToolsController, SessionsController
 * Domain             → BrowserSessionRegistry, IdleSessionReaper, tools
 * Outbound           → Playwright driver adapter
 * </pre>
 *
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code browser.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BrowserApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrowserApplication.class, args);
    }

}
