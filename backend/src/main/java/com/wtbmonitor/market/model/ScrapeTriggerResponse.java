package com.wtbmonitor.market.model;

public record ScrapeTriggerResponse(ScrapeKind kind, String message) {}
