package me.golemcore.browser.tools;

import me.golemcore.browser.domain.model.OpenOptions;
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
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrowserTypeToolTest {

    private FakeBrowserDriver driver;
    private BrowserSessionRegistry registry;
    private BrowserTypeTool typeTool;
    private BrowserFillFormTool fillFormTool;
    private FakePageHandle page;

    @BeforeEach
    void setUp() {
        BrowserProperties properties = new BrowserProperties();
        driver = new FakeBrowserDriver();
        registry = new BrowserSessionRegistry(driver, properties, new MutableClock(Instant.EPOCH));
        typeTool = new BrowserTypeTool(registry, properties);
        fillFormTool = new BrowserFillFormTool(registry, properties);
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

    // ===== type =====

    @Test
    void shouldFillByDefault() {
        ToolResult result = typeTool.execute(Map.of("selector", "#q", "text", "hello")).join();

        assertTrue(result.isSuccess());
        assertEquals(List.of("fill:element (selector=#q)=hello"), page.getActions());
    }

    @Test
    void shouldTypeSlowlyAndSubmit() {
        ToolResult result = typeTool.execute(Map.of("selector", "#q", "text", "hello",
                "slowly", true, "submit", true)).join();

        assertTrue(result.getOutput().startsWith("Typed into element (selector=#q) and submitted"));
        assertEquals(List.of("type:element (selector=#q)=hello", "press:element (selector=#q)=Enter"),
                page.getActions());
    }

    @Test
    void shouldAllowEmptyText() {
        ToolResult result = typeTool.execute(Map.of("selector", "#q", "text", "")).join();

        assertTrue(result.isSuccess());
        assertEquals(List.of("fill:element (selector=#q)="), page.getActions());
    }

    @Test
    void shouldRequireText() {
        ToolResult result = typeTool.execute(Map.of("selector", "#q")).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
        assertEquals("text is required", result.getError());
    }

    // ===== fill form =====

    @Test
    void shouldFillFieldsAndSkipEmptyValues() {
        ToolResult result = fillFormTool.execute(Map.of("fields", List.of(
                Map.of("selector", "#name", "value", "Ada"),
                Map.of("role", "textbox", "name", "Email", "value", "ada@example.com"),
                Map.of("selector", "#notes", "value", "")))).join();

        assertTrue(result.isSuccess());
        assertEquals(2, page.getActions().size());
        assertEquals(List.of("element (selector=#name)", "element (role=textbox, name=Email)"),
                data(result).get("filled"));
        assertEquals(List.of(), data(result).get("errors"));
        assertTrue(result.getOutput().startsWith("Filled 2 field(s)"));
    }

    @Test
    void shouldCollectPerFieldErrors() {
        ToolResult result = fillFormTool.execute(Map.of("fields", List.of(
                Map.of("selector", "#ok", "value", "1"),
                Map.of("element", "mystery", "value", "2")))).join();

        assertTrue(result.isSuccess());
        List<?> errors = (List<?>) data(result).get("errors");
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).toString().startsWith("mystery: Must provide either"));
        assertTrue(result.getOutput().contains("Errors:"));
    }

    @Test
    void shouldRejectEmptyFieldList() {
        ToolResult result = fillFormTool.execute(Map.of("fields", List.of())).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
    }
}
