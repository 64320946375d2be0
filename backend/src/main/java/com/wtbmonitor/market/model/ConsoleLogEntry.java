package com.wtbmonitor.market.model;

import java.time.Instant;

public record ConsoleLogEntry(long index, Instant timestamp, String message) {}
