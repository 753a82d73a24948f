package me.golemcore.browser.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDto {
    private String id;
    private boolean browserOpen;
    private int tabCount;
    private Instant createdAt;
    private Instant lastActivityAt;
    private long idleSeconds;
}
