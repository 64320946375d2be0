package com.wtbmonitor.market.model;

import java.util.Map;

public record StatusResponse(
    Map<ScrapeKind, ScrapeStatusView> scrapeStatus,
    long wtbObservationCount,
    long inventoryObservationCount
) {}
