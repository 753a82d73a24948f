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

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrowserFileUploadToolTest {

    private BrowserSessionRegistry registry;
    private BrowserFileUploadTool tool;
    private FakePageHandle page;

    @BeforeEach
    void setUp() {
        BrowserProperties properties = new BrowserProperties();
        FakeBrowserDriver driver = new FakeBrowserDriver();
        registry = new BrowserSessionRegistry(driver, properties, new MutableClock(Instant.EPOCH));
        tool = new BrowserFileUploadTool(registry, properties);
        registry.open("default", OpenOptions.defaults()).join();
        page = driver.lastDriver().context().page(0);
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    @Test
    void shouldClickTriggerAndSetFiles() {
        ToolResult result = tool.execute(Map.of("selector", "#upload",
                "paths", List.of("/tmp/report.pdf", "/tmp/photo.png"))).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Uploaded 2 file(s)"));
        assertEquals(List.of(Path.of("/tmp/report.pdf"), Path.of("/tmp/photo.png")),
                page.getLastFileChooser().getFiles());
        assertTrue(page.getActions().indexOf("click:element (selector=#upload)")
                > page.getActions().indexOf("expectFileChooser:PT30S"));
    }

    @Test
    void shouldCancelChooserWhenNoPathsGiven() {
        ToolResult result = tool.execute(Map.of()).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("File chooser cancelled"));
        assertTrue(page.getLastFileChooser().isCancelled());
        assertNull(page.getLastFileChooser().getFiles());
    }

    @Test
    void shouldRejectRelativePaths() {
        ToolResult result = tool.execute(Map.of("paths", List.of("report.pdf"))).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
        assertTrue(result.getError().startsWith("File paths must be absolute"));
        assertNull(page.getLastFileChooser());
    }
}
