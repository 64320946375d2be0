package com.wtbmonitor.market.model;

public record StoreToggleResponse(
    String message,
    boolean enabled
) {
}
