package com.wtbmonitor.market.model;

import java.time.Instant;

public record ScrapeSession(
    String sessionId,
    ScrapeKind kind,
    String originLabel,
    SessionStatus status,
    Instant startedAt,
    Instant completedAt,
    int itemCount,
    String notes
) {
    public boolean isCompleted() {
        return completedAt != null;
    }
}
