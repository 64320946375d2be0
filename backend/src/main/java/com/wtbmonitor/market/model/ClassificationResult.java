package com.wtbmonitor.market.model;

import java.time.Instant;
import java.util.List;

public record ClassificationResult(
    List<MissingItem> missing,
    List<InStockItem> inStock,
    List<NoDemandItem> noDemand,
    ClassificationSummary summary,
    Instant computedAt
) {
    public ClassificationResult {
        missing = List.copyOf(missing);
        inStock = List.copyOf(inStock);
        noDemand = List.copyOf(noDemand);
    }

    public static ClassificationResult empty(Instant computedAt) {
        return new ClassificationResult(List.of(), List.of(), List.of(), ClassificationSummary.empty(), computedAt);
    }

    public List<MissingItem> missingWithDemandAtLeast(int minDemand) {
        return missing.stream()
            .filter(item -> item.demandCount() >= minDemand)
            .toList();
    }

    /**
     * Highest-demand missing items; {@code missing} is already ordered by demand.
     */
    public List<MissingItem> topOpportunities(int limit) {
        return missing.subList(0, Math.min(Math.max(0, limit), missing.size()));
    }
}
