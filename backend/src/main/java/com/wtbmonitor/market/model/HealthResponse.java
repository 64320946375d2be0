package com.wtbmonitor.market.model;

import java.time.Instant;
import java.util.Map;

public record HealthResponse(String status, Instant timestamp, boolean dbConnectivity, Map<String, Long> counts) {}
