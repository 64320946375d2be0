package com.wtbmonitor.market.model;

public enum MatchLayer {
    SKU,
    NAME,
    FUZZY,
    NONE
}
