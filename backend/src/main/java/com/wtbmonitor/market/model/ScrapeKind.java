package com.wtbmonitor.market.model;

import java.util.Locale;

public enum ScrapeKind {
    WTB("WTB"),
    INVENTORY("Inventory");

    private final String label;

    ScrapeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts the enum name in any case plus the legacy {@code store} alias for the inventory side.
     */
    public static ScrapeKind fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("scrape kind is required");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "wtb":
                return WTB;
            case "inventory":
            case "store":
                return INVENTORY;
            default:
                throw new IllegalArgumentException("Unknown scrape kind: " + raw);
        }
    }
}
