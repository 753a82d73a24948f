package me.golemcore.browser.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventBufferTest {

    @Test
    void shouldDropOldestWhenFull() {
        EventBuffer<String> buffer = new EventBuffer<>(3);

        buffer.append("a");
        buffer.append("b");
        buffer.append("c");
        buffer.append("d");

        assertEquals(List.of("b", "c", "d"), buffer.snapshot());
    }

    @Test
    void shouldIgnoreNullEvents() {
        EventBuffer<String> buffer = new EventBuffer<>(3);

        buffer.append(null);

        assertEquals(0, buffer.size());
    }

    @Test
    void shouldFilterSnapshot() {
        EventBuffer<ConsoleMessage> buffer = new EventBuffer<>(10);
        buffer.append(ConsoleMessage.builder().type("log").text("hello").build());
        buffer.append(ConsoleMessage.builder().type("error").text("boom").build());

        List<ConsoleMessage> errors = buffer.snapshot(ConsoleMessage::isError);

        assertEquals(1, errors.size());
        assertEquals("boom", errors.get(0).getText());
    }

    @Test
    void shouldClear() {
        EventBuffer<String> buffer = new EventBuffer<>(3);
        buffer.append("a");

        buffer.clear();

        assertTrue(buffer.snapshot().isEmpty());
    }

    @Test
    void shouldRejectNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new EventBuffer<String>(0));
    }
}
