package com.wtbmonitor.market.model;

import java.util.List;

public record NoDemandItem(
    String myProductName,
    String myProductSku,
    String brand,
    Double myProductPrice,
    String myProductUrl,
    List<String> mySizesAvailable,
    String imageUrl
) {
    public static NoDemandItem from(InventoryObservation product) {
        return new NoDemandItem(
            product.productName(),
            product.sku(),
            product.brand(),
            product.price(),
            product.url(),
            product.sizes(),
            product.imageUrl()
        );
    }
}
