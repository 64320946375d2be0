package com.wtbmonitor.market.matching;

import com.wtbmonitor.config.MonitorProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Canonical form of product names used for grouping and matching: lowercase, single spaces,
 * filler tokens removed.
 */
@Component
public class NameNormalizer {
    private final Set<String> fillerWords;

    public NameNormalizer(MonitorProperties properties) {
        Set<String> words = new LinkedHashSet<>();
        for (String word : properties.getMatching().getFillerWords()) {
            if (word != null && !word.isBlank()) {
                words.add(word.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.fillerWords = Set.copyOf(words);
    }

    public String normalize(String name) {
        if (name == null) {
            return "";
        }
        String lowered = name.toLowerCase(Locale.ROOT).trim();
        if (lowered.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(lowered.length());
        for (String token : lowered.split("\\s+")) {
            if (token.isEmpty() || fillerWords.contains(token)) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(token);
        }
        return out.toString();
    }

    public static String normalizeSku(String sku) {
        if (sku == null) {
            return null;
        }
        String trimmed = sku.trim();
        return trimmed.isEmpty() ? null : trimmed.toUpperCase(Locale.ROOT);
    }
}
