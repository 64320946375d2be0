package com.wtbmonitor.market.api;

public record StoreTargetRequest(
    String name,
    String url
) {
}
