package com.wtbmonitor.market.model;

import java.time.Instant;

public record ScrapeStatusView(boolean running, String progress, Instant lastRun, int count) {}
