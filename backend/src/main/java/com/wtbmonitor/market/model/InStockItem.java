package com.wtbmonitor.market.model;

import java.util.List;

public record InStockItem(
    String wtbName,
    String wtbSku,
    String brand,
    int demandCount,
    List<String> storesWanting,
    Double wtbPriceMin,
    Double wtbPriceMax,
    List<String> sizesWanted,
    String imageUrl,
    String myProductName,
    String myProductSku,
    Double myProductPrice,
    String myProductUrl,
    List<String> mySizesAvailable,
    String myProductImageUrl,
    double matchConfidence,
    MatchLayer matchLayer
) {
    public static InStockItem from(DemandRecord demand, MatchVerdict verdict) {
        InventoryObservation product = verdict.item();
        String image = product.imageUrl() != null ? product.imageUrl() : demand.imageUrl();
        return new InStockItem(
            demand.name(),
            demand.sku(),
            demand.brand(),
            demand.demandCount(),
            demand.stores(),
            demand.priceMin(),
            demand.priceMax(),
            demand.sizesWanted(),
            image,
            product.productName(),
            product.sku(),
            product.price(),
            product.url(),
            product.sizes(),
            product.imageUrl(),
            verdict.confidence(),
            verdict.layer()
        );
    }
}
