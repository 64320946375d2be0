package com.wtbmonitor.market.model;

import java.util.List;

public record MissingItem(
    String wtbName,
    String wtbSku,
    String brand,
    int demandCount,
    List<String> storesWanting,
    Double wtbPriceMin,
    Double wtbPriceMax,
    List<String> sizesWanted,
    String imageUrl
) {
    public static MissingItem from(DemandRecord demand) {
        return new MissingItem(
            demand.name(),
            demand.sku(),
            demand.brand(),
            demand.demandCount(),
            demand.stores(),
            demand.priceMin(),
            demand.priceMax(),
            demand.sizesWanted(),
            demand.imageUrl()
        );
    }
}
