package me.golemcore.browser.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.browser.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.browser.domain.model.SessionSummary;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Browser session inspection and shutdown.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionsController {

    private final BrowserSessionRegistry registry;

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions() {
        List<SessionSummaryDto> dtos = registry.list().stream()
                .map(SessionsController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> closeSession(@PathVariable String id) {
        // teardown blocks up to the teardown timeout
        return Mono.fromCallable(() -> registry.close(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(closed -> {
                    if (!closed) {
                        throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id);
                    }
                    return ResponseEntity.noContent().<Void>build();
                });
    }

    private static SessionSummaryDto toDto(SessionSummary summary) {
        return SessionSummaryDto.builder()
                .id(summary.getId())
                .browserOpen(summary.isOpen())
                .tabCount(summary.getTabCount())
                .createdAt(summary.getCreatedAt())
                .lastActivityAt(summary.getLastActivityAt())
                .idleSeconds(summary.getIdleSeconds())
                .build();
    }
}
