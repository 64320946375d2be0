package com.wtbmonitor.market.matching;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.DemandRecord;
import com.wtbmonitor.market.model.InventoryObservation;
import com.wtbmonitor.market.model.MatchLayer;
import com.wtbmonitor.market.model.MatchVerdict;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds demand records to inventory items. Layers are tried in order and the first hit wins:
 * exact SKU, exact normalized name, then fuzzy name similarity with a same-brand bonus.
 */
@Component
public class IdentityResolver {
    private final NameNormalizer normalizer;
    private final double threshold;
    private final double brandBonus;

    public IdentityResolver(NameNormalizer normalizer, MonitorProperties properties) {
        this.normalizer = normalizer;
        this.threshold = properties.getMatching().getSimilarityThreshold();
        this.brandBonus = properties.getMatching().getBrandBonus();
    }

    public InventorySnapshot snapshot(List<InventoryObservation> inventory) {
        List<InventoryObservation> items = inventory == null ? List.of() : inventory;
        List<String> names = new ArrayList<>(items.size());
        Map<String, List<Integer>> bySku = new HashMap<>();
        Map<String, List<Integer>> byName = new HashMap<>();
        for (int i = 0; i < items.size(); i++) {
            InventoryObservation item = items.get(i);
            String name = normalizer.normalize(item.productName());
            names.add(name);
            String sku = NameNormalizer.normalizeSku(item.sku());
            if (sku != null) {
                bySku.computeIfAbsent(sku, key -> new ArrayList<>()).add(i);
            }
            if (!name.isEmpty()) {
                byName.computeIfAbsent(name, key -> new ArrayList<>()).add(i);
            }
        }
        return new InventorySnapshot(items, names, bySku, byName);
    }

    public MatchVerdict resolve(DemandRecord demand, InventorySnapshot snapshot) {
        return resolve(demand, snapshot, new BitSet());
    }

    /**
     * Resolves against the items whose positions are not set in {@code claimed}. The set is only read.
     */
    public MatchVerdict resolve(DemandRecord demand, InventorySnapshot snapshot, BitSet claimed) {
        if (demand == null || snapshot == null || snapshot.isEmpty()) {
            return MatchVerdict.noMatch();
        }

        int skuIndex = snapshot.indexOfSku(NameNormalizer.normalizeSku(demand.sku()), claimed);
        if (skuIndex >= 0) {
            return MatchVerdict.matched(snapshot.item(skuIndex), skuIndex, 1.0, MatchLayer.SKU);
        }

        String name = normalizer.normalize(demand.name());
        if (name.isEmpty()) {
            return MatchVerdict.noMatch();
        }
        int nameIndex = snapshot.indexOfName(name, claimed);
        if (nameIndex >= 0) {
            return MatchVerdict.matched(snapshot.item(nameIndex), nameIndex, 1.0, MatchLayer.NAME);
        }

        int bestIndex = -1;
        double bestScore = 0.0;
        for (int i = 0; i < snapshot.size(); i++) {
            String candidate = snapshot.normalizedName(i);
            if (candidate.isEmpty() || claimed.get(i)) {
                continue;
            }
            double score = SimilarityScorer.ratio(name, candidate);
            if (sameBrand(demand.brand(), snapshot.item(i).brand())) {
                score += brandBonus;
            }
            // strict comparison keeps the earliest candidate on ties
            if (score > bestScore) {
                bestScore = score;
                bestIndex = i;
            }
        }
        if (bestIndex >= 0 && bestScore >= threshold) {
            return MatchVerdict.matched(snapshot.item(bestIndex), bestIndex, Math.min(1.0, bestScore), MatchLayer.FUZZY);
        }
        return MatchVerdict.noMatch();
    }

    private static boolean sameBrand(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        String a = left.trim();
        String b = right.trim();
        return !a.isEmpty() && a.equalsIgnoreCase(b);
    }
}
