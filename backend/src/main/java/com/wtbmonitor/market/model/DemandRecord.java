package com.wtbmonitor.market.model;

import java.util.List;

public record DemandRecord(
    String identityKey,
    String name,
    String brand,
    String sku,
    int demandCount,
    List<String> stores,
    Double priceMin,
    Double priceMax,
    List<String> sizesWanted,
    String imageUrl
) {
    public DemandRecord {
        stores = stores == null ? List.of() : List.copyOf(stores);
        sizesWanted = sizesWanted == null ? List.of() : List.copyOf(sizesWanted);
    }
}
