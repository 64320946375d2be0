package com.wtbmonitor.market.model;

import java.util.List;

public record StoreTargetsResponse(
    String message,
    List<StoreTarget> stores
) {
}
