package me.golemcore.browser.adapter.inbound.web.controller;

import me.golemcore.browser.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.browser.domain.model.SessionSummary;
import me.golemcore.browser.domain.service.BrowserSessionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class SessionsControllerTest {

    private BrowserSessionRegistry registry;
    private SessionsController controller;

    @BeforeEach
    void setUp() {
        registry = mock(BrowserSessionRegistry.class);
        controller = new SessionsController(registry);
    }

    @Test
    void shouldListSessions() {
        Instant created = Instant.parse("2026-03-01T10:00:00Z");
        when(registry.list()).thenReturn(List.of(SessionSummary.builder()
                .id("s1")
                .open(true)
                .tabCount(2)
                .createdAt(created)
                .lastActivityAt(created.plusSeconds(30))
                .idleSeconds(12)
                .build()));

        StepVerifier.create(controller.listSessions())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    List<SessionSummaryDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(1, body.size());
                    SessionSummaryDto dto = body.get(0);
                    assertEquals("s1", dto.getId());
                    assertTrue(dto.isBrowserOpen());
                    assertEquals(2, dto.getTabCount());
                    assertEquals(12, dto.getIdleSeconds());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnEmptyListWhenNoSessions() {
        when(registry.list()).thenReturn(List.of());

        StepVerifier.create(controller.listSessions())
                .assertNext(response -> assertTrue(response.getBody().isEmpty()))
                .verifyComplete();
    }

    @Test
    void shouldCloseSession() {
        when(registry.close("s1")).thenReturn(true);

        StepVerifier.create(controller.closeSession("s1"))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
        verify(registry).close("s1");
    }

    @Test
    void shouldReturnNotFoundForUnknownSession() {
        when(registry.close("ghost")).thenReturn(false);

        StepVerifier.create(controller.closeSession("ghost"))
                .expectErrorSatisfies(error -> {
                    ResponseStatusException ex = (ResponseStatusException) error;
                    assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
                    assertEquals("Session not found: ghost", ex.getReason());
                })
                .verify();
    }
}
