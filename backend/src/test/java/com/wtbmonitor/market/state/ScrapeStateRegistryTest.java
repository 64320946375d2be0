package com.wtbmonitor.market.state;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.ConsoleLogEntry;
import com.wtbmonitor.market.model.ConsoleLogPage;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.model.ScrapeStatusView;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ScrapeStateRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private ScrapeStateRegistry registry(int capacity) {
        MonitorProperties properties = new MonitorProperties();
        properties.getConsole().setCapacity(capacity);
        return new ScrapeStateRegistry(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void secondStartIsRejectedUntilReleased() {
        ScrapeStateRegistry registry = registry(200);

        assertThat(registry.tryStart(ScrapeKind.WTB)).isTrue();
        assertThat(registry.tryStart(ScrapeKind.WTB)).isFalse();
        assertThat(registry.tryStart(ScrapeKind.INVENTORY)).isTrue();

        registry.release(ScrapeKind.WTB);

        assertThat(registry.isRunning(ScrapeKind.WTB)).isFalse();
        assertThat(registry.tryStart(ScrapeKind.WTB)).isTrue();
    }

    @Test
    void onlyOneConcurrentStartWins() throws Exception {
        ScrapeStateRegistry registry = registry(200);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                attempts.add(pool.submit(() -> {
                    go.await();
                    return registry.tryStart(ScrapeKind.WTB);
                }));
            }
            go.countDown();
            int wins = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(5, TimeUnit.SECONDS)) {
                    wins++;
                }
            }
            assertThat(wins).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void completeRecordsCountAndLastRun() {
        ScrapeStateRegistry registry = registry(200);
        registry.tryStart(ScrapeKind.INVENTORY);
        registry.progress(ScrapeKind.INVENTORY, "page 1");
        registry.complete(ScrapeKind.INVENTORY, 42);

        ScrapeStatusView status = registry.status(ScrapeKind.INVENTORY);

        assertThat(status.running()).isTrue();
        assertThat(status.count()).isEqualTo(42);
        assertThat(status.lastRun()).isEqualTo(NOW);
        assertThat(status.progress()).contains("42");
    }

    @Test
    void failRecordsErrorProgress() {
        ScrapeStateRegistry registry = registry(200);
        registry.tryStart(ScrapeKind.WTB);
        registry.fail(ScrapeKind.WTB, "boom");

        assertThat(registry.status(ScrapeKind.WTB).progress()).isEqualTo("Error: boom");
        assertThat(registry.statuses()).containsKeys(ScrapeKind.WTB, ScrapeKind.INVENTORY);
    }

    @Test
    void consoleKeepsNewestEntriesWithMonotonicIndexes() {
        ScrapeStateRegistry registry = registry(3);
        for (int i = 1; i <= 5; i++) {
            registry.appendLog("line " + i);
        }

        ConsoleLogPage page = registry.logsSince(0);

        assertThat(page.logs()).extracting(ConsoleLogEntry::message).containsExactly("line 3", "line 4", "line 5");
        assertThat(page.logs()).extracting(ConsoleLogEntry::index).containsExactly(3L, 4L, 5L);
        assertThat(page.lastIndex()).isEqualTo(5L);
        assertThat(registry.logsSince(4).logs()).extracting(ConsoleLogEntry::message).containsExactly("line 5");
        assertThat(registry.logsSince(5).logs()).isEmpty();
    }

    @Test
    void progressLinesArePrefixedWithKindLabel() {
        ScrapeStateRegistry registry = registry(200);
        registry.progress(ScrapeKind.WTB, "Scraping store 1/3");

        assertThat(registry.logsSince(0).logs())
            .extracting(ConsoleLogEntry::message)
            .containsExactly("[WTB] Scraping store 1/3");
    }
}
