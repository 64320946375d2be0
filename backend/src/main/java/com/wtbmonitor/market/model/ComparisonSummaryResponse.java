package com.wtbmonitor.market.model;

import java.time.Instant;

public record ComparisonSummaryResponse(ClassificationSummary summary, Instant lastUpdated) {}
