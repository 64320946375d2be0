package com.wtbmonitor.market.model;

public record StoreTarget(
    Long id,
    String name,
    String url,
    boolean enabled
) {
}
