package com.wtbmonitor.market.model;

/**
 * Outcome of resolving one demand record against an inventory snapshot. {@code inventoryIndex} is the
 * position of the bound item in the snapshot, or -1 when nothing matched.
 */
public record MatchVerdict(InventoryObservation item, int inventoryIndex, double confidence, MatchLayer layer) {
    private static final MatchVerdict NO_MATCH = new MatchVerdict(null, -1, 0.0, MatchLayer.NONE);

    public static MatchVerdict noMatch() {
        return NO_MATCH;
    }

    public static MatchVerdict matched(InventoryObservation item, int inventoryIndex, double confidence, MatchLayer layer) {
        return new MatchVerdict(item, inventoryIndex, Math.max(0.0, confidence), layer);
    }

    public boolean isMatch() {
        return item != null;
    }
}
