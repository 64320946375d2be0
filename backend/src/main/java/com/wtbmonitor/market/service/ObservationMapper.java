package com.wtbmonitor.market.service;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.InventoryObservation;
import com.wtbmonitor.market.model.WtbObservation;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts untyped scraper or API payload items into typed observations. Items that cannot be used
 * are rejected one by one and never stop the batch.
 */
@Component
public class ObservationMapper {
    private static final Pattern NUMBER = Pattern.compile("-?\\d[\\d.,\\s]*");

    private final int maxErrorSamples;

    public ObservationMapper(MonitorProperties properties) {
        this.maxErrorSamples = properties.getIngestion().getMaxErrorSamples();
    }

    public MappingResult<WtbObservation> mapWtb(String sessionId, List<?> rawItems) {
        MappingResult<WtbObservation> result = new MappingResult<>(maxErrorSamples);
        if (rawItems == null) {
            return result;
        }
        for (int i = 0; i < rawItems.size(); i++) {
            Map<?, ?> item = asMap(rawItems.get(i));
            if (item == null) {
                result.reject("item " + i + " is not an object");
                continue;
            }
            String name = cleanName(text(item, "name", "product_name", "productName"));
            if (name == null) {
                result.reject("item " + i + " has no product name");
                continue;
            }
            Double priceMin = price(value(item, "price_min", "priceMin"));
            Double priceMax = price(value(item, "price_max", "priceMax"));
            if (priceMin == null && priceMax == null) {
                Double single = price(value(item, "price"));
                priceMin = single;
                priceMax = single;
            }
            if (priceMin != null && priceMax != null && priceMin > priceMax) {
                Double swap = priceMin;
                priceMin = priceMax;
                priceMax = swap;
            }
            result.accept(new WtbObservation(
                null,
                sessionId,
                name,
                text(item, "sku"),
                text(item, "brand"),
                text(item, "size"),
                priceMin,
                priceMax,
                text(item, "store_name", "origin_store", "originStore", "store"),
                text(item, "image_url", "imageUrl", "image")
            ));
        }
        return result;
    }

    public MappingResult<InventoryObservation> mapInventory(String sessionId, List<?> rawItems) {
        MappingResult<InventoryObservation> result = new MappingResult<>(maxErrorSamples);
        if (rawItems == null) {
            return result;
        }
        for (int i = 0; i < rawItems.size(); i++) {
            Map<?, ?> item = asMap(rawItems.get(i));
            if (item == null) {
                result.reject("item " + i + " is not an object");
                continue;
            }
            String name = cleanName(text(item, "name", "product_name", "productName"));
            if (name == null) {
                result.reject("item " + i + " has no product name");
                continue;
            }
            result.accept(new InventoryObservation(
                null,
                sessionId,
                name,
                text(item, "sku"),
                text(item, "brand"),
                sizes(value(item, "sizes", "size")),
                price(value(item, "price")),
                text(item, "url", "product_url"),
                text(item, "image_url", "imageUrl", "image")
            ));
        }
        return result;
    }

    static Double price(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        Matcher matcher = NUMBER.matcher(raw.toString());
        if (!matcher.find()) {
            return null;
        }
        String digits = matcher.group().replaceAll("\\s", "");
        int lastComma = digits.lastIndexOf(',');
        int lastDot = digits.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            if (lastComma > lastDot) {
                digits = digits.replace(".", "").replace(',', '.');
            } else {
                digits = digits.replace(",", "");
            }
        } else if (lastComma >= 0) {
            String tail = digits.substring(lastComma + 1);
            if (digits.indexOf(',') == lastComma && tail.length() != 3) {
                digits = digits.replace(',', '.');
            } else {
                digits = digits.replace(",", "");
            }
        } else if (lastDot >= 0 && digits.indexOf('.') != lastDot) {
            digits = digits.replace(".", "");
        }
        try {
            return Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static List<String> sizes(Object raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                addSize(out, value == null ? null : value.toString());
            }
        } else {
            for (String part : raw.toString().split(",")) {
                addSize(out, part);
            }
        }
        return new ArrayList<>(out);
    }

    private static void addSize(Set<String> out, String value) {
        String trimmed = blankToNull(value);
        if (trimmed != null) {
            out.add(trimmed);
        }
    }

    static String cleanName(String raw) {
        if (raw == null) {
            return null;
        }
        return blankToNull(Jsoup.parse(raw).text());
    }

    private static Map<?, ?> asMap(Object raw) {
        return raw instanceof Map<?, ?> map ? map : null;
    }

    private static Object value(Map<?, ?> item, String... keys) {
        for (String key : keys) {
            Object value = item.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(Map<?, ?> item, String... keys) {
        for (String key : keys) {
            Object value = item.get(key);
            if (value == null || value instanceof Map || value instanceof Collection) {
                continue;
            }
            String trimmed = blankToNull(value.toString());
            if (trimmed != null) {
                return trimmed;
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class MappingResult<T> {
        private final List<T> accepted = new ArrayList<>();
        private final List<String> sampleErrors = new ArrayList<>();
        private final int maxSamples;
        private int rejected;

        MappingResult(int maxSamples) {
            this.maxSamples = maxSamples;
        }

        void accept(T item) {
            accepted.add(item);
        }

        void reject(String reason) {
            rejected++;
            if (sampleErrors.size() < maxSamples) {
                sampleErrors.add(reason);
            }
        }

        public List<T> accepted() {
            return accepted;
        }

        public int rejectedCount() {
            return rejected;
        }

        public List<String> sampleErrors() {
            return sampleErrors;
        }
    }
}
