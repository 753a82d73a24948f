package me.golemcore.browser.adapter.inbound.web.controller;

import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolFailureKind;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.ToolCatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class ToolsControllerTest {

    private ToolCatalogService toolCatalogService;
    private ToolsController controller;

    @BeforeEach
    void setUp() {
        toolCatalogService = mock(ToolCatalogService.class);
        controller = new ToolsController(toolCatalogService);
    }

    @Test
    void shouldListToolDefinitions() {
        when(toolCatalogService.listDefinitions()).thenReturn(List.of(
                ToolDefinition.builder().name("browser_navigate").build()));

        StepVerifier.create(controller.listTools())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("browser_navigate", response.getBody().get(0).getName());
                })
                .verifyComplete();
    }

    @Test
    void shouldInvokeTool() {
        Map<String, Object> args = Map.of("url", "https://example.com");
        when(toolCatalogService.execute("browser_navigate", args))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("Navigated")));

        StepVerifier.create(controller.callTool("browser_navigate", args))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertTrue(response.getBody().isSuccess());
                    assertEquals("Navigated", response.getBody().getOutput());
                })
                .verifyComplete();
    }

    @Test
    void shouldTreatMissingBodyAsEmptyArguments() {
        when(toolCatalogService.execute("session_list", Map.of()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("No active sessions")));

        StepVerifier.create(controller.callTool("session_list", null))
                .assertNext(response -> assertEquals("No active sessions", response.getBody().getOutput()))
                .verifyComplete();
        verify(toolCatalogService).execute("session_list", Map.of());
    }

    @Test
    void shouldReturnToolFailuresInBody() {
        when(toolCatalogService.execute("nope", Map.of()))
                .thenReturn(CompletableFuture.completedFuture(
                        ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Unknown tool: nope")));

        StepVerifier.create(controller.callTool("nope", Map.of()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertFalse(response.getBody().isSuccess());
                    assertEquals(ToolFailureKind.POLICY_DENIED, response.getBody().getFailureKind());
                })
                .verifyComplete();
    }
}
