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

import me.golemcore.browser.domain.exception.TabIndexOutOfRangeException;
import me.golemcore.browser.port.outbound.PageHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered pages of one session plus the cursor marking the active one.
 *
 * <p>
 * Invariant: {@code 0 <= activeIndex < size()} whenever the list is non-empty;
 * {@code activeIndex == 0} when empty. Edits happen on the owning session's
 * executor; methods are synchronized so that summaries can read the size from
 * other threads.
 */
public class TabList {

    private final List<PageHandle> pages = new ArrayList<>();
    private int activeIndex;

    /**
     * Appends a page and makes it active.
     *
     * @return the index of the new tab
     */
    public synchronized int add(PageHandle page) {
        pages.add(page);
        activeIndex = pages.size() - 1;
        return activeIndex;
    }

    /**
     * Removes the tab at {@code index}. The cursor keeps pointing at the same
     * page when an earlier tab is removed and is clamped into range otherwise.
     */
    public synchronized PageHandle remove(int index) {
        checkIndex(index);
        PageHandle removed = pages.remove(index);
        if (index < activeIndex) {
            activeIndex--;
        }
        if (activeIndex >= pages.size()) {
            activeIndex = Math.max(0, pages.size() - 1);
        }
        return removed;
    }

    public synchronized void select(int index) {
        checkIndex(index);
        activeIndex = index;
    }

    public synchronized PageHandle get(int index) {
        checkIndex(index);
        return pages.get(index);
    }

    public synchronized Optional<PageHandle> active() {
        if (pages.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(pages.get(activeIndex));
    }

    public synchronized int getActiveIndex() {
        return activeIndex;
    }

    public synchronized int size() {
        return pages.size();
    }

    public synchronized boolean isEmpty() {
        return pages.isEmpty();
    }

    public synchronized List<PageHandle> snapshot() {
        return List.copyOf(pages);
    }

    /**
     * Removes every tab and resets the cursor.
     *
     * @return the pages that were removed, in tab order
     */
    public synchronized List<PageHandle> clear() {
        List<PageHandle> removed = new ArrayList<>(pages);
        pages.clear();
        activeIndex = 0;
        return removed;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= pages.size()) {
            throw new TabIndexOutOfRangeException(index, pages.size());
        }
    }
}
