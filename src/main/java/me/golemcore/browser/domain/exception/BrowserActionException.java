package me.golemcore.browser.domain.exception;

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
 * A call into the automation driver failed. Carries the action and session so
 * the caller can decide whether to retry.
 */
public class BrowserActionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String action;
    private final String sessionId;

    public BrowserActionException(String action, String sessionId, Throwable cause) {
        super("Failed to " + action + " in session " + sessionId + ": " + describe(cause), cause);
        this.action = action;
        this.sessionId = sessionId;
    }

    public String getAction() {
        return action;
    }

    public String getSessionId() {
        return sessionId;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
