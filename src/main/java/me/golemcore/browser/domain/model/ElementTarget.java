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
 * Addresses an element on a page. An ARIA role plus accessible name (as shown
 * in the accessibility snapshot) is preferred; a raw selector is the fallback.
 * {@code nth} picks one of several matches, zero-based.
 */
@Data
@Builder
public class ElementTarget {

    private String description;
    private String role;
    private String name;
    private String selector;
    private Integer nth;

    public boolean hasRole() {
        return role != null && !role.isBlank() && name != null && !name.isBlank();
    }

    public boolean hasSelector() {
        return selector != null && !selector.isBlank();
    }

    public boolean isResolvable() {
        return hasRole() || hasSelector();
    }

    /**
     * Human-readable label used in tool output, e.g.
     * {@code Submit (role=button, name=Submit)}.
     */
    public String describe() {
        String label = description != null && !description.isBlank() ? description : "element";
        if (hasRole()) {
            return label + " (role=" + role + ", name=" + name + ")";
        }
        if (hasSelector()) {
            return label + " (selector=" + selector + ")";
        }
        return label;
    }
}
