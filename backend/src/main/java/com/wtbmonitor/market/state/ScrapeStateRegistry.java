package com.wtbmonitor.market.state;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.ConsoleLogEntry;
import com.wtbmonitor.market.model.ConsoleLogPage;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.model.ScrapeStatusView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Process-wide scrape status and console buffer. All mutation happens under {@code lifecycleLock};
 * callers never hold it across I/O.
 */
@Component
public class ScrapeStateRegistry {
    private static final Logger log = LoggerFactory.getLogger(ScrapeStateRegistry.class);

    private final Object lifecycleLock = new Object();
    private final Map<ScrapeKind, MutableStatus> statuses = new EnumMap<>(ScrapeKind.class);
    private final Deque<ConsoleLogEntry> console = new ArrayDeque<>();
    private final int capacity;
    private final Clock clock;
    private long nextIndex = 1;

    public ScrapeStateRegistry(MonitorProperties properties, Clock clock) {
        this.capacity = properties.getConsole().getCapacity();
        this.clock = clock;
        for (ScrapeKind kind : ScrapeKind.values()) {
            statuses.put(kind, new MutableStatus());
        }
    }

    /**
     * Marks the kind as running. Returns false without side effects when a run is already in flight.
     */
    public boolean tryStart(ScrapeKind kind) {
        synchronized (lifecycleLock) {
            MutableStatus status = statuses.get(kind);
            if (status.running) {
                return false;
            }
            status.running = true;
            status.progress = "Starting...";
            appendLogLocked("[" + kind.label() + "] Starting scrape");
            return true;
        }
    }

    public void progress(ScrapeKind kind, String message) {
        if (message == null || message.isBlank()) {
            return;
        }
        synchronized (lifecycleLock) {
            statuses.get(kind).progress = message;
            appendLogLocked("[" + kind.label() + "] " + message);
        }
    }

    public void complete(ScrapeKind kind, int count) {
        synchronized (lifecycleLock) {
            MutableStatus status = statuses.get(kind);
            status.count = count;
            status.lastRun = clock.instant();
            status.progress = "Complete! Found " + count + " items";
            appendLogLocked("[" + kind.label() + "] " + status.progress);
        }
    }

    public void fail(ScrapeKind kind, String message) {
        synchronized (lifecycleLock) {
            MutableStatus status = statuses.get(kind);
            status.progress = "Error: " + message;
            appendLogLocked("[" + kind.label() + "] " + status.progress);
        }
    }

    public void release(ScrapeKind kind) {
        synchronized (lifecycleLock) {
            statuses.get(kind).running = false;
        }
    }

    public boolean isRunning(ScrapeKind kind) {
        synchronized (lifecycleLock) {
            return statuses.get(kind).running;
        }
    }

    public ScrapeStatusView status(ScrapeKind kind) {
        synchronized (lifecycleLock) {
            return statuses.get(kind).view();
        }
    }

    public Map<ScrapeKind, ScrapeStatusView> statuses() {
        synchronized (lifecycleLock) {
            Map<ScrapeKind, ScrapeStatusView> views = new EnumMap<>(ScrapeKind.class);
            for (Map.Entry<ScrapeKind, MutableStatus> entry : statuses.entrySet()) {
                views.put(entry.getKey(), entry.getValue().view());
            }
            return views;
        }
    }

    public void appendLog(String message) {
        if (message == null) {
            return;
        }
        synchronized (lifecycleLock) {
            appendLogLocked(message);
        }
    }

    /**
     * Entries with an index greater than {@code sinceIndex}. Entries evicted from the buffer are gone.
     */
    public ConsoleLogPage logsSince(long sinceIndex) {
        synchronized (lifecycleLock) {
            List<ConsoleLogEntry> entries = new ArrayList<>();
            for (ConsoleLogEntry entry : console) {
                if (entry.index() > sinceIndex) {
                    entries.add(entry);
                }
            }
            return new ConsoleLogPage(entries, nextIndex - 1);
        }
    }

    private void appendLogLocked(String message) {
        ConsoleLogEntry entry = new ConsoleLogEntry(nextIndex++, clock.instant(), message);
        console.addLast(entry);
        while (console.size() > capacity) {
            console.removeFirst();
        }
        log.info(message);
    }

    private static final class MutableStatus {
        private boolean running;
        private String progress = "";
        private Instant lastRun;
        private int count;

        private ScrapeStatusView view() {
            return new ScrapeStatusView(running, progress, lastRun, count);
        }
    }
}
