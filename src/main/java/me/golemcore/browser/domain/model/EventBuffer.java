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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Append-only, bounded buffer of events captured from browser pages. When the
 * buffer is full the oldest entry is dropped. Appends arrive on driver event
 * callbacks while reads come from tool calls, so every access is synchronized.
 *
 * @param <T>
 *            the event type
 */
public class EventBuffer<T> {

    private final int maxSize;
    private final Deque<T> events = new ArrayDeque<>();

    public EventBuffer(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    public synchronized void append(T event) {
        if (event == null) {
            return;
        }
        if (events.size() >= maxSize) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    public synchronized List<T> snapshot() {
        return List.copyOf(events);
    }

    public synchronized List<T> snapshot(Predicate<T> filter) {
        return events.stream().filter(filter).toList();
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized void clear() {
        events.clear();
    }
}
