package com.wtbmonitor.market.model;

import java.util.List;

/**
 * One raw "have" sighting from the seller's own store. Sizes are distinct and keep their scraped order.
 */
public record InventoryObservation(
    Long id,
    String sessionId,
    String productName,
    String sku,
    String brand,
    List<String> sizes,
    Double price,
    String url,
    String imageUrl
) {
    public InventoryObservation {
        sizes = sizes == null ? List.of() : List.copyOf(sizes);
    }
}
