package com.wtbmonitor.market.model;

import java.util.List;

public record ConsoleLogPage(List<ConsoleLogEntry> logs, long lastIndex) {}
