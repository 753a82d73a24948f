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

/**
 * Classification of tool failures.
 */
public enum ToolFailureKind {

    /**
     * Referenced session, tab or page does not exist. Session state is unchanged.
     */
    NOT_FOUND,

    /**
     * Missing or malformed tool parameters.
     */
    INVALID_ARGUMENT,

    /**
     * The automation driver raised an error (navigation failure, element not
     * found, timeout).
     */
    DRIVER_FAILURE,

    /**
     * Tool execution was refused (unknown tool, tool disabled).
     */
    POLICY_DENIED,

    /**
     * Tool execution failed outside the driver (timeouts, unexpected errors).
     */
    EXECUTION_FAILED
}
