package com.wtbmonitor.market.demand;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.matching.NameNormalizer;
import com.wtbmonitor.market.model.DemandRecord;
import com.wtbmonitor.market.model.WtbObservation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DemandAggregatorTest {

    private final DemandAggregator aggregator = new DemandAggregator(new NameNormalizer(new MonitorProperties()));

    @Test
    void skuLessObservationFoldsIntoSkuGroupWithSameName() {
        List<DemandRecord> records = aggregator.aggregate(List.of(
            wtb("Air Zoom 1", "ABC-100", "X", null, null, null, null),
            wtb("Air Zoom 1", null, "Y", null, null, null, null)
        ));

        assertThat(records).hasSize(1);
        DemandRecord record = records.get(0);
        assertThat(record.demandCount()).isEqualTo(2);
        assertThat(record.stores()).containsExactly("X", "Y");
        assertThat(record.sku()).isEqualTo("ABC-100");
    }

    @Test
    void skuGroupingIgnoresCaseAndWhitespace() {
        List<DemandRecord> records = aggregator.aggregate(List.of(
            wtb("Dunk Low", "dd1391-100", "X", null, null, null, null),
            wtb("Nike Dunk Low Panda", " DD1391-100 ", "X", null, null, null, null)
        ));

        assertThat(records).hasSize(1);
        assertThat(records.get(0).demandCount()).isEqualTo(2);
        assertThat(records.get(0).stores()).containsExactly("X");
        assertThat(records.get(0).name()).isEqualTo("Dunk Low");
        assertThat(records.get(0).identityKey()).isEqualTo("sku:DD1391-100");
    }

    @Test
    void nameGroupingUsesNormalizedNames() {
        List<DemandRecord> records = aggregator.aggregate(List.of(
            wtb("The New Air Max", null, "A", "42", null, null, null),
            wtb("air  max", null, "B", "43", null, null, null),
            wtb("Samba OG", null, "A", "42", null, null, null)
        ));

        assertThat(records).extracting(DemandRecord::name).containsExactly("The New Air Max", "Samba OG");
        assertThat(records.get(0).demandCount()).isEqualTo(2);
        assertThat(records.get(0).sizesWanted()).containsExactly("42", "43");
    }

    @Test
    void priceBoundsAreMinAndMaxOfPresentValues() {
        List<DemandRecord> records = aggregator.aggregate(List.of(
            wtb("Samba", null, "A", null, 900.0, 1100.0, null),
            wtb("Samba", null, "B", null, null, null, null),
            wtb("Samba", null, "C", null, 800.0, 1000.0, null)
        ));

        assertThat(records.get(0).priceMin()).isEqualTo(800.0);
        assertThat(records.get(0).priceMax()).isEqualTo(1100.0);
    }

    @Test
    void priceBoundsAreAbsentWhenNoObservationHasThem() {
        List<DemandRecord> records = aggregator.aggregate(List.of(wtb("Samba", null, "A", null, null, null, null)));

        assertThat(records.get(0).priceMin()).isNull();
        assertThat(records.get(0).priceMax()).isNull();
    }

    @Test
    void imageIsLastNonNullInInsertionOrder() {
        List<DemandRecord> records = aggregator.aggregate(List.of(
            wtb("Samba", null, "A", null, null, null, "first.png"),
            wtb("Samba", null, "B", null, null, null, "second.png"),
            wtb("Samba", null, "C", null, null, null, null)
        ));

        assertThat(records.get(0).imageUrl()).isEqualTo("second.png");
    }

    @Test
    void demandCountsSumToObservationCount() {
        List<WtbObservation> observations = List.of(
            wtb("Samba", null, "A", null, null, null, null),
            wtb("Gazelle", "G-1", "A", null, null, null, null),
            wtb("Samba", null, "B", null, null, null, null),
            wtb("Campus", null, "C", null, null, null, null),
            wtb("Gazelle Indoor", "g-1", "D", null, null, null, null)
        );

        List<DemandRecord> records = aggregator.aggregate(observations);

        assertThat(records).hasSize(3);
        assertThat(records.stream().mapToInt(DemandRecord::demandCount).sum()).isEqualTo(observations.size());
    }

    @Test
    void emptyInputYieldsNoRecords() {
        assertThat(aggregator.aggregate(List.of())).isEmpty();
        assertThat(aggregator.aggregate(null)).isEmpty();
    }

    private static WtbObservation wtb(
        String name,
        String sku,
        String store,
        String size,
        Double priceMin,
        Double priceMax,
        String imageUrl
    ) {
        return new WtbObservation(null, "wtb", name, sku, null, size, priceMin, priceMax, store, imageUrl);
    }
}
