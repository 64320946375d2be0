package com.wtbmonitor.market.service;

import com.wtbmonitor.market.model.ClassificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Holds the latest default classification. The lock guards only the in-memory fields; classification
 * runs outside it, and a result computed while an invalidation happened is returned but not kept.
 */
@Component
public class ComparisonCache {
    private static final Logger log = LoggerFactory.getLogger(ComparisonCache.class);

    private final ClassificationService classificationService;
    private final Object lock = new Object();
    private ClassificationResult cached;
    private long generation;

    public ComparisonCache(ClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    public ClassificationResult get() {
        long startGeneration;
        synchronized (lock) {
            if (cached != null) {
                return cached;
            }
            startGeneration = generation;
        }
        ClassificationResult computed = classificationService.classify();
        synchronized (lock) {
            if (generation == startGeneration && cached == null) {
                cached = computed;
            } else if (generation != startGeneration) {
                log.debug("Discarding classification computed across an invalidation");
            }
            return computed;
        }
    }

    public void invalidate() {
        synchronized (lock) {
            cached = null;
            generation++;
        }
    }

    public Optional<Instant> lastUpdated() {
        synchronized (lock) {
            return cached == null ? Optional.empty() : Optional.of(cached.computedAt());
        }
    }
}
