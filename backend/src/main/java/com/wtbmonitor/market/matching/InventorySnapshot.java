package com.wtbmonitor.market.matching;

import com.wtbmonitor.market.model.InventoryObservation;

import java.util.BitSet;
import java.util.List;
import java.util.Map;

/**
 * Inventory of one session indexed for matching. Positions are stable and follow insertion order;
 * when several items share a SKU or normalized name the earliest available one is returned.
 */
public final class InventorySnapshot {
    private final List<InventoryObservation> items;
    private final List<String> normalizedNames;
    private final Map<String, List<Integer>> bySku;
    private final Map<String, List<Integer>> byName;

    InventorySnapshot(
        List<InventoryObservation> items,
        List<String> normalizedNames,
        Map<String, List<Integer>> bySku,
        Map<String, List<Integer>> byName
    ) {
        this.items = List.copyOf(items);
        this.normalizedNames = List.copyOf(normalizedNames);
        this.bySku = Map.copyOf(bySku);
        this.byName = Map.copyOf(byName);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public InventoryObservation item(int index) {
        return items.get(index);
    }

    public List<InventoryObservation> items() {
        return items;
    }

    String normalizedName(int index) {
        return normalizedNames.get(index);
    }

    int indexOfSku(String normalizedSku, BitSet claimed) {
        if (normalizedSku == null) {
            return -1;
        }
        return firstUnclaimed(bySku.get(normalizedSku), claimed);
    }

    int indexOfName(String normalizedName, BitSet claimed) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            return -1;
        }
        return firstUnclaimed(byName.get(normalizedName), claimed);
    }

    private static int firstUnclaimed(List<Integer> positions, BitSet claimed) {
        if (positions == null) {
            return -1;
        }
        for (int position : positions) {
            if (!claimed.get(position)) {
                return position;
            }
        }
        return -1;
    }
}
