package me.golemcore.browser.tools;

import me.golemcore.browser.domain.model.ToolFailureKind;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.model.Viewport;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import me.golemcore.browser.infrastructure.config.BrowserProperties;
import me.golemcore.browser.testsupport.FakeBrowserDriver;
import me.golemcore.browser.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrowserOpenToolTest {

    private FakeBrowserDriver driver;
    private BrowserSessionRegistry registry;
    private BrowserOpenTool openTool;
    private BrowserCloseTool closeTool;

    @BeforeEach
    void setUp() {
        BrowserProperties properties = new BrowserProperties();
        driver = new FakeBrowserDriver();
        registry = new BrowserSessionRegistry(driver, properties, new MutableClock(Instant.EPOCH));
        openTool = new BrowserOpenTool(registry, properties);
        closeTool = new BrowserCloseTool(registry, properties);
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    // ===== open =====

    @Test
    void shouldOpenWithRequestedViewport() {
        ToolResult result = openTool.execute(Map.of("session_id", "s", "headless", false,
                "width", 1280, "height", 720)).join();

        assertTrue(result.isSuccess());
        assertEquals("Browser opened in headed mode for session s with viewport 1280x720", result.getOutput());
        assertEquals(new Viewport(1280, 720), driver.lastDriver().getLastContextOptions().getViewport());
    }

    @Test
    void shouldReportAlreadyOpenWithoutRelaunching() {
        openTool.execute(Map.of("session_id", "s")).join();

        ToolResult again = openTool.execute(Map.of("session_id", "s")).join();

        assertTrue(again.isSuccess());
        assertEquals("Browser is already open for session s", again.getOutput());
        assertEquals(Boolean.FALSE, ((Map<?, ?>) again.getData()).get("changed"));
        assertEquals(1, driver.getLaunches().size());
    }

    @Test
    void shouldRejectNonPositiveViewport() {
        ToolResult result = openTool.execute(Map.of("width", 0)).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
        assertTrue(driver.getLaunches().isEmpty());
    }

    @Test
    void shouldReportLaunchFailure() {
        driver.failLaunchWith(new IllegalStateException("Executable doesn't exist"));

        ToolResult result = openTool.execute(Map.of("session_id", "s")).join();

        assertEquals(ToolFailureKind.DRIVER_FAILURE, result.getFailureKind());
        assertTrue(result.getError().contains("open browser"));
        assertTrue(result.getError().contains("session s"));
    }

    // ===== close =====

    @Test
    void shouldCloseThenReportAlreadyClosed() {
        openTool.execute(Map.of("session_id", "s")).join();

        ToolResult first = closeTool.execute(Map.of("session_id", "s")).join();
        ToolResult second = closeTool.execute(Map.of("session_id", "s")).join();

        assertTrue(first.isSuccess());
        assertEquals("Browser closed and resources cleaned up for session s", first.getOutput());
        assertTrue(second.isSuccess());
        assertTrue(second.getOutput().contains("already closed"));
        assertEquals(Boolean.FALSE, ((Map<?, ?>) second.getData()).get("changed"));
        assertTrue(driver.lastDriver().isBrowserClosed());
    }
}
