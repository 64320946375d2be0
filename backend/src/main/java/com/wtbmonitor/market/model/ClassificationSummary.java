package com.wtbmonitor.market.model;

public record ClassificationSummary(
    String wtbSessionId,
    String inventorySessionId,
    int totalWtbItems,
    int totalWtbObservations,
    int totalMyProducts,
    int missingCount,
    int inStockCount,
    int noDemandCount,
    int matchedInventoryCount
) {
    public static ClassificationSummary empty() {
        return new ClassificationSummary(null, null, 0, 0, 0, 0, 0, 0, 0);
    }
}
