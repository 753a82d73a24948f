package me.golemcore.browser.tools;

import me.golemcore.browser.domain.model.OpenOptions;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.testsupport.FakeBrowserDriver;
import me.golemcore.browser.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionListToolTest {

    private MutableClock clock;
    private BrowserSessionRegistry registry;
    private SessionListTool listTool;
    private SessionCreateTool createTool;

    @BeforeEach
    void setUp() {
        BrowserProperties properties = new BrowserProperties();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = new BrowserSessionRegistry(new FakeBrowserDriver(), properties, clock);
        listTool = new SessionListTool(registry, properties);
        createTool = new SessionCreateTool(registry, properties);
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> rows(ToolResult result) {
        return (List<Map<String, Object>>) ((Map<String, Object>) result.getData()).get("sessions");
    }

    @Test
    void shouldReportNoSessions() {
        ToolResult result = listTool.execute(Map.of()).join();

        assertTrue(result.isSuccess());
        assertEquals("No active sessions", result.getOutput());
    }

    @Test
    void shouldListSessionState() {
        registry.open("alice", OpenOptions.defaults()).join();
        registry.resolve("bob");
        clock.advance(Duration.ofSeconds(90));

        ToolResult result = listTool.execute(Map.of()).join();

        List<Map<String, Object>> rows = rows(result);
        assertEquals(2, rows.size());
        assertEquals("alice", rows.get(0).get("session_id"));
        assertEquals(true, rows.get(0).get("browser_open"));
        assertEquals(1, rows.get(0).get("num_pages"));
        assertEquals(false, rows.get(1).get("browser_open"));
        assertEquals(90L, rows.get(1).get("inactive_seconds"));
        assertTrue(result.getOutput().contains("2 of 10 sessions"));
    }

    @Test
    void shouldNotRecordActivityWhenListing() {
        registry.resolve("alice");
        clock.advance(Duration.ofMinutes(5));

        listTool.execute(Map.of("session_id", "alice")).join();

        assertEquals(Instant.parse("2026-03-01T10:00:00Z"),
                registry.find("alice").orElseThrow().getLastActivityAt());
    }

    @Test
    void shouldCreateSessionWithFreshId() {
        ToolResult result = createTool.execute(Map.of()).join();

        String id = (String) ((Map<?, ?>) result.getData()).get("session_id");
        assertNotNull(id);
        assertTrue(registry.find(id).isPresent());
        assertFalse(registry.find(id).orElseThrow().isOpen());
    }
}
