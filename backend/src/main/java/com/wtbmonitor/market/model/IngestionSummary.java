package com.wtbmonitor.market.model;

import java.util.List;

public record IngestionSummary(
    String sessionId,
    ScrapeKind kind,
    int acceptedCount,
    int rejectedCount,
    List<String> sampleErrors
) {
}
