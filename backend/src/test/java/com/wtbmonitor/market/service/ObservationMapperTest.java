package com.wtbmonitor.market.service;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.InventoryObservation;
import com.wtbmonitor.market.model.WtbObservation;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ObservationMapperTest {

    private final ObservationMapper mapper = new ObservationMapper(new MonitorProperties());

    @Test
    void wtbItemsAreTypedWithAliasesAndCleanNames() {
        Map<String, Object> item = new HashMap<>();
        item.put("name", "  Air Max 90 &amp; <b>Infrared</b> ");
        item.put("sku", "CT1685-100");
        item.put("store_name", "Sneaker Shop");
        item.put("price_min", "1.299,00");
        item.put("price_max", 1500);
        item.put("imageUrl", "https://img/1.png");
        item.put("brand", " ");

        ObservationMapper.MappingResult<WtbObservation> result = mapper.mapWtb("s1", List.of(item));

        assertThat(result.rejectedCount()).isZero();
        WtbObservation observation = result.accepted().get(0);
        assertThat(observation.productName()).isEqualTo("Air Max 90 & Infrared");
        assertThat(observation.sessionId()).isEqualTo("s1");
        assertThat(observation.originStore()).isEqualTo("Sneaker Shop");
        assertThat(observation.priceMin()).isEqualTo(1299.0);
        assertThat(observation.priceMax()).isEqualTo(1500.0);
        assertThat(observation.imageUrl()).isEqualTo("https://img/1.png");
        assertThat(observation.brand()).isNull();
    }

    @Test
    void invalidItemsAreRejectedAndCounted() {
        Map<String, Object> blankName = Map.of("name", "   ", "sku", "X");
        Map<String, Object> markupOnly = Map.of("name", "<br/>");
        Map<String, Object> valid = Map.of("product_name", "Samba OG");

        ObservationMapper.MappingResult<WtbObservation> result =
            mapper.mapWtb("s1", Arrays.asList(blankName, "not an object", null, markupOnly, valid));

        assertThat(result.accepted()).extracting(WtbObservation::productName).containsExactly("Samba OG");
        assertThat(result.rejectedCount()).isEqualTo(4);
        assertThat(result.sampleErrors()).hasSize(4);
    }

    @Test
    void errorSamplesAreCapped() {
        MonitorProperties properties = new MonitorProperties();
        properties.getIngestion().setMaxErrorSamples(2);
        ObservationMapper capped = new ObservationMapper(properties);

        ObservationMapper.MappingResult<InventoryObservation> result =
            capped.mapInventory("s1", List.of(Map.of(), Map.of(), Map.of()));

        assertThat(result.rejectedCount()).isEqualTo(3);
        assertThat(result.sampleErrors()).hasSize(2);
    }

    @Test
    void inventorySizesAcceptArraysAndCommaSeparatedStrings() {
        Map<String, Object> fromArray = Map.of("name", "Samba", "sizes", List.of("42", " 43 ", "42", ""));
        Map<String, Object> fromString = Map.of("name", "Gazelle", "sizes", "40, 41,,41", "price", "kr 1299");

        List<InventoryObservation> items = mapper.mapInventory("s2", List.of(fromArray, fromString)).accepted();

        assertThat(items.get(0).sizes()).containsExactly("42", "43");
        assertThat(items.get(1).sizes()).containsExactly("40", "41");
        assertThat(items.get(1).price()).isEqualTo(1299.0);
    }

    @Test
    void swappedWtbPriceBoundsAreReordered() {
        Map<String, Object> item = Map.of("name", "Samba", "price_min", 900, "price_max", 700);

        WtbObservation observation = mapper.mapWtb("s1", List.of(item)).accepted().get(0);

        assertThat(observation.priceMin()).isEqualTo(700.0);
        assertThat(observation.priceMax()).isEqualTo(900.0);
    }

    @Test
    void priceParsingToleratesCommonFormats() {
        assertThat(ObservationMapper.price("1,299.50")).isEqualTo(1299.5);
        assertThat(ObservationMapper.price("12,5")).isEqualTo(12.5);
        assertThat(ObservationMapper.price("1 299 kr")).isEqualTo(1299.0);
        assertThat(ObservationMapper.price("€ 89.95")).isEqualTo(89.95);
        assertThat(ObservationMapper.price(250)).isEqualTo(250.0);
        assertThat(ObservationMapper.price("n/a")).isNull();
        assertThat(ObservationMapper.price(null)).isNull();
    }
}
