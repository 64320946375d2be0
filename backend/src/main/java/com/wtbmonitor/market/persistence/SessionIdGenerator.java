package com.wtbmonitor.market.persistence;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Produces ids such as {@code 20261016T101530123Z-9f3a01c2}. The millisecond part never repeats or goes
 * backwards within a process, so lexical order equals creation order even for sessions started in the
 * same millisecond. The random suffix keeps ids from separate processes apart.
 */
@Component
public class SessionIdGenerator {
    private static final DateTimeFormatter FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    private final AtomicLong lastMillis = new AtomicLong();
    private final LongSupplier clock;

    public SessionIdGenerator() {
        this(System::currentTimeMillis);
    }

    SessionIdGenerator(LongSupplier clock) {
        this.clock = clock;
    }

    public String nextId() {
        long now = clock.getAsLong();
        long millis = lastMillis.updateAndGet(previous -> Math.max(previous + 1, now));
        String suffix = String.format("%08x", ThreadLocalRandom.current().nextInt());
        return FORMAT.format(Instant.ofEpochMilli(millis)) + "-" + suffix;
    }
}
