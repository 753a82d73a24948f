package me.golemcore.browser.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;
import me.golemcore.browser.domain.service.ToolCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Tool discovery and invocation. Tool failures are part of the
 * {@link ToolResult} body, so invocation always answers 200.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolsController {

    private final ToolCatalogService toolCatalogService;

    @GetMapping
    public Mono<ResponseEntity<List<ToolDefinition>>> listTools() {
        return Mono.just(ResponseEntity.ok(toolCatalogService.listDefinitions()));
    }

    @PostMapping("/{name}")
    public Mono<ResponseEntity<ToolResult>> callTool(@PathVariable String name,
            @RequestBody(required = false) Map<String, Object> arguments) {
        log.debug("[API] Tool call: {}", name);
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        return Mono.fromFuture(() -> toolCatalogService.execute(name, args))
                .map(ResponseEntity::ok);
    }
}
