package me.golemcore.browser.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.browser.domain.model.OpenOptions;
import me.golemcore.browser.domain.model.ScreenshotOptions;
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

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrowserInspectionToolsTest {

    private BrowserProperties properties;
    private BrowserSessionRegistry registry;
    private FakePageHandle page;

    @BeforeEach
    void setUp() {
        properties = new BrowserProperties();
        FakeBrowserDriver driver = new FakeBrowserDriver();
        registry = new BrowserSessionRegistry(driver, properties, new MutableClock(Instant.EPOCH));
        registry.open("default", OpenOptions.defaults()).join();
        page = driver.lastDriver().context().page(0);
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ToolResult result) {
        return (Map<String, Object>) result.getData();
    }

    // ===== screenshot =====

    @Test
    void shouldReturnBase64Screenshot() {
        BrowserScreenshotTool tool = new BrowserScreenshotTool(registry, properties);

        ToolResult result = tool.execute(Map.of()).join();

        assertTrue(result.isSuccess());
        assertEquals("AQID", data(result).get("screenshot_base64"));
        assertEquals("png", data(result).get("format"));
        assertEquals("image/png", data(result).get("mimeType"));
        assertEquals(3, data(result).get("size"));
    }

    @Test
    void shouldTakeFullPageJpeg() {
        BrowserScreenshotTool tool = new BrowserScreenshotTool(registry, properties);

        ToolResult result = tool.execute(Map.of("type", "jpg", "fullPage", true)).join();

        assertTrue(result.isSuccess());
        assertEquals(ScreenshotOptions.ImageFormat.JPEG, page.getLastScreenshotOptions().getFormat());
        assertTrue(page.getLastScreenshotOptions().isFullPage());
        assertTrue(result.getOutput().startsWith("Screenshot of full page"));
    }

    @Test
    void shouldRejectFullPageElementScreenshot() {
        BrowserScreenshotTool tool = new BrowserScreenshotTool(registry, properties);

        ToolResult result = tool.execute(Map.of("fullPage", true, "selector", "#chart")).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
        assertNull(page.getLastScreenshotOptions());
    }

    // ===== html =====

    @Test
    void shouldReturnBodyHtmlByDefault() {
        BrowserGetHtmlTool tool = new BrowserGetHtmlTool(registry, properties);

        ToolResult result = tool.execute(Map.of()).join();

        assertEquals("<h1>Page 0</h1>", result.getOutput());
        assertEquals("body", data(result).get("selector"));
        assertEquals(false, data(result).get("truncated"));
    }

    @Test
    void shouldTruncateLongHtml() {
        page.setHtml("#big", "x".repeat(100));
        BrowserGetHtmlTool tool = new BrowserGetHtmlTool(registry, properties);

        ToolResult result = tool.execute(Map.of("selector", "#big", "maxLength", 10)).join();

        assertTrue(result.getOutput().startsWith("xxxxxxxxxx"));
        assertFalse(result.getOutput().startsWith("xxxxxxxxxxx"));
        assertTrue(result.getOutput().contains("truncated, 10 of 100 characters shown"));
        assertEquals(100, data(result).get("length"));
        assertEquals(true, data(result).get("truncated"));
    }

    @Test
    void shouldUseConfiguredHtmlLimit() {
        properties.getTools().setMaxHtmlLength(5);
        page.setHtml("#big", "y".repeat(8));
        BrowserGetHtmlTool tool = new BrowserGetHtmlTool(registry, properties);

        ToolResult result = tool.execute(Map.of("selector", "#big")).join();

        assertEquals(true, data(result).get("truncated"));
    }

    @Test
    void shouldReportMissingElement() {
        BrowserGetHtmlTool tool = new BrowserGetHtmlTool(registry, properties);

        ToolResult result = tool.execute(Map.of("selector", "#missing")).join();

        assertEquals(ToolFailureKind.NOT_FOUND, result.getFailureKind());
        assertEquals("No element matches selector: #missing", result.getError());
    }

    // ===== snapshot =====

    @Test
    void shouldReturnSnapshot() {
        page.setSnapshot("- button \"Go\"");
        BrowserSnapshotTool tool = new BrowserSnapshotTool(registry, properties);

        ToolResult result = tool.execute(Map.of()).join();

        assertEquals("- button \"Go\"", data(result).get("snapshot"));
        assertEquals("Page 0", data(result).get("title"));
    }

    @Test
    void shouldFailWhenSnapshotFails() {
        page.failOn("ariaSnapshot", new IllegalStateException("Target closed"));
        BrowserSnapshotTool tool = new BrowserSnapshotTool(registry, properties);

        ToolResult result = tool.execute(Map.of()).join();

        assertEquals(ToolFailureKind.DRIVER_FAILURE, result.getFailureKind());
    }

    // ===== evaluate =====

    @Test
    void shouldRenderEvaluationAsJson() {
        page.setEvaluationResult(Map.of("count", 3));
        BrowserEvaluateTool tool = new BrowserEvaluateTool(registry, properties, new ObjectMapper());

        ToolResult result = tool.execute(Map.of("function", "() => ({count: 3})")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("\"count\" : 3"));
        assertTrue(page.getActions().contains("evaluate:() => ({count: 3})"));
    }

    @Test
    void shouldEvaluateAgainstElement() {
        page.setEvaluationResult("Hello");
        BrowserEvaluateTool tool = new BrowserEvaluateTool(registry, properties, new ObjectMapper());

        tool.execute(Map.of("function", "el => el.textContent", "selector", "h1")).join();

        assertTrue(page.getActions().contains("evaluate:el => el.textContent@element (selector=h1)"));
    }

    @Test
    void shouldRenderUndefinedForNull() {
        BrowserEvaluateTool tool = new BrowserEvaluateTool(registry, properties, new ObjectMapper());

        ToolResult result = tool.execute(Map.of("function", "() => undefined")).join();

        assertEquals("undefined", result.getOutput());
    }
}
