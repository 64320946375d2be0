package com.wtbmonitor.market.demand;

import com.wtbmonitor.market.matching.NameNormalizer;
import com.wtbmonitor.market.model.DemandRecord;
import com.wtbmonitor.market.model.WtbObservation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Folds the raw WTB observations of one session into one demand record per product identity.
 *
 * <p>The identity key is the upper-cased SKU when an observation carries one, otherwise its normalized
 * name. A SKU-less observation joins a SKU group when the group was first seen under the same
 * normalized name. Records come out in first-seen order.
 */
@Component
public class DemandAggregator {
    private final NameNormalizer normalizer;

    public DemandAggregator(NameNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public List<DemandRecord> aggregate(List<WtbObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }
        Map<String, String> skuKeyByName = new HashMap<>();
        for (WtbObservation observation : observations) {
            String sku = NameNormalizer.normalizeSku(observation.sku());
            if (sku != null) {
                skuKeyByName.putIfAbsent(nameKey(observation.productName()), "sku:" + sku);
            }
        }

        Map<String, Group> groups = new LinkedHashMap<>();
        for (WtbObservation observation : observations) {
            String key = identityKey(observation, skuKeyByName);
            groups.computeIfAbsent(key, Group::new).add(observation);
        }

        List<DemandRecord> records = new ArrayList<>(groups.size());
        for (Group group : groups.values()) {
            records.add(group.toRecord());
        }
        return records;
    }

    private String identityKey(WtbObservation observation, Map<String, String> skuKeyByName) {
        String sku = NameNormalizer.normalizeSku(observation.sku());
        if (sku != null) {
            return "sku:" + sku;
        }
        String name = nameKey(observation.productName());
        String skuKey = skuKeyByName.get(name);
        return skuKey != null ? skuKey : "name:" + name;
    }

    private String nameKey(String productName) {
        String normalized = normalizer.normalize(productName);
        if (!normalized.isEmpty() || productName == null) {
            return normalized;
        }
        return productName.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Group {
        private final String key;
        private String name;
        private String brand;
        private String sku;
        private int count;
        private final Set<String> stores = new LinkedHashSet<>();
        private final Set<String> sizes = new LinkedHashSet<>();
        private Double priceMin;
        private Double priceMax;
        private String imageUrl;

        private Group(String key) {
            this.key = key;
        }

        private void add(WtbObservation observation) {
            if (count == 0) {
                name = observation.productName();
                brand = observation.brand();
            }
            count++;
            if (sku == null) {
                sku = blankToNull(observation.sku());
            }
            String store = blankToNull(observation.originStore());
            if (store != null) {
                stores.add(store);
            }
            String size = blankToNull(observation.size());
            if (size != null) {
                sizes.add(size);
            }
            priceMin = min(priceMin, observation.priceMin());
            priceMax = max(priceMax, observation.priceMax());
            if (observation.imageUrl() != null) {
                imageUrl = observation.imageUrl();
            }
        }

        private DemandRecord toRecord() {
            return new DemandRecord(
                key,
                name,
                brand,
                sku,
                count,
                new ArrayList<>(stores),
                priceMin,
                priceMax,
                new ArrayList<>(sizes),
                imageUrl
            );
        }
    }

    private static Double min(Double current, Double candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null ? candidate : Math.min(current, candidate);
    }

    private static Double max(Double current, Double candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null ? candidate : Math.max(current, candidate);
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
