package me.golemcore.browser.tools;

import me.golemcore.browser.domain.model.ToolFailureKind;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.testsupport.FakeBrowserDriver;
import me.golemcore.browser.testsupport.FakePageHandle;
import me.golemcore.browser.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrowserNavigateToolTest {

    private FakeBrowserDriver driver;
    private BrowserSessionRegistry registry;
    private BrowserNavigateTool tool;

    @BeforeEach
    void setUp() {
        BrowserProperties properties = new BrowserProperties();
        driver = new FakeBrowserDriver();
        registry = new BrowserSessionRegistry(driver, properties, new MutableClock(Instant.EPOCH));
        tool = new BrowserNavigateTool(registry, properties);
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ToolResult result) {
        return (Map<String, Object>) result.getData();
    }

    @Test
    void shouldReturnValidDefinition() {
        var def = tool.getDefinition();
        assertEquals("browser_navigate", def.getName());
        assertNotNull(def.getDescription());
        assertNotNull(def.getInputSchema());
    }

    @Test
    void shouldOpenBrowserOnFirstNavigation() {
        ToolResult result = tool.execute(Map.of("url", "https://example.com")).join();

        assertTrue(result.isSuccess());
        assertEquals(1, driver.getLaunches().size());
        FakePageHandle page = driver.lastDriver().context().page(0);
        assertTrue(page.getActions().contains("navigate:https://example.com"));
        assertEquals("https://example.com", data(result).get("url"));
        assertEquals("- document", data(result).get("snapshot"));
    }

    @Test
    void shouldNavigateWithinGivenSession() {
        tool.execute(Map.of("url", "https://a.test", "session_id", "alice")).join();
        tool.execute(Map.of("url", "https://b.test", "session_id", "bob")).join();

        assertEquals(2, driver.getLaunches().size());
        assertTrue(registry.find("alice").orElseThrow().isOpen());
        assertTrue(registry.find("bob").orElseThrow().isOpen());
    }

    @Test
    void shouldPrependHttpsWhenNoScheme() {
        ToolResult result = tool.execute(Map.of("url", "example.com")).join();

        assertTrue(result.isSuccess());
        assertTrue(driver.lastDriver().context().page(0).getActions().contains("navigate:https://example.com"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "javascript:alert(1)", "data:text/html,<h1>test</h1>", "file:///etc/passwd",
            "ftp://example.com" })
    void shouldRejectDangerousUrlSchemes(String url) {
        ToolResult result = tool.execute(Map.of("url", url)).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
        assertTrue(result.getError().contains("Only http and https URLs are allowed"));
        assertTrue(driver.getLaunches().isEmpty());
    }

    @Test
    void shouldFailWhenUrlMissing() {
        ToolResult result = tool.execute(Map.of()).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
    }

    @Test
    void shouldReportDriverFailureWithActionAndSession() {
        tool.execute(Map.of("url", "https://example.com", "session_id", "s1")).join();
        driver.lastDriver().context().page(0).failOn("navigate", new IllegalStateException("net::ERR_NAME"));

        ToolResult result = tool.execute(Map.of("url", "https://broken.test", "session_id", "s1")).join();

        assertEquals(ToolFailureKind.DRIVER_FAILURE, result.getFailureKind());
        assertEquals("Failed to navigate in session s1: net::ERR_NAME", result.getError());
        assertTrue(registry.find("s1").orElseThrow().isOpen());
    }
}
