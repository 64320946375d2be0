package com.wtbmonitor.market.model;

/**
 * One raw "wanted" sighting as scraped. The id is assigned by storage and is null before insert.
 */
public record WtbObservation(
    Long id,
    String sessionId,
    String productName,
    String sku,
    String brand,
    String size,
    Double priceMin,
    Double priceMax,
    String originStore,
    String imageUrl
) {
}
