package com.wtbmonitor.market.matching;

import com.wtbmonitor.config.MonitorProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NameNormalizerTest {

    private final NameNormalizer normalizer = new NameNormalizer(new MonitorProperties());

    @Test
    void fillerWordsAndCaseAreDropped() {
        assertThat(normalizer.normalize("The New Air Max")).isEqualTo("air max");
        assertThat(normalizer.normalize("air max")).isEqualTo("air max");
        assertThat(normalizer.normalize("Men's  Dunk\tLow")).isEqualTo("dunk low");
    }

    @Test
    void fillerWordsInsideOtherTokensAreKept() {
        assertThat(normalizer.normalize("Newton Theory Runner")).isEqualTo("newton theory runner");
    }

    @Test
    void blankAndNullNormalizeToEmpty() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("   ")).isEmpty();
        assertThat(normalizer.normalize("The New")).isEmpty();
    }

    @Test
    void fillerWordsAreConfigurable() {
        MonitorProperties properties = new MonitorProperties();
        properties.getMatching().setFillerWords(List.of("Retro"));
        NameNormalizer custom = new NameNormalizer(properties);

        assertThat(custom.normalize("The Jordan 1 Retro")).isEqualTo("the jordan 1");
    }

    @Test
    void skuIsTrimmedAndUpperCased() {
        assertThat(NameNormalizer.normalizeSku("  abc-100 ")).isEqualTo("ABC-100");
        assertThat(NameNormalizer.normalizeSku("  ")).isNull();
        assertThat(NameNormalizer.normalizeSku(null)).isNull();
    }
}
