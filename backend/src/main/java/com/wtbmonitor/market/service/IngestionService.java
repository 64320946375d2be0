package com.wtbmonitor.market.service;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.IngestionSummary;
import com.wtbmonitor.market.model.InventoryObservation;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.model.WtbObservation;
import com.wtbmonitor.market.persistence.ObservationRepository;
import com.wtbmonitor.market.persistence.ScrapeSessionRepository;
import com.wtbmonitor.market.source.ScrapeSource;
import com.wtbmonitor.market.state.ProgressChannel;
import com.wtbmonitor.market.state.ScrapeStateRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Writes new sessions: validates raw items, appends them, completes the session and only then
 * invalidates the comparison cache.
 */
@Service
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final ScrapeSessionRepository sessionRepository;
    private final ObservationRepository observationRepository;
    private final ObservationMapper mapper;
    private final ComparisonCache comparisonCache;
    private final ScrapeStateRegistry state;
    private final Map<ScrapeKind, ScrapeSource> sources = new EnumMap<>(ScrapeKind.class);
    private final MonitorProperties properties;
    private final ExecutorService scrapeExecutor;
    private final ExecutorService progressExecutor;

    public IngestionService(
        ScrapeSessionRepository sessionRepository,
        ObservationRepository observationRepository,
        ObservationMapper mapper,
        ComparisonCache comparisonCache,
        ScrapeStateRegistry state,
        List<ScrapeSource> scrapeSources,
        MonitorProperties properties,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor,
        @Qualifier("progressExecutor") ExecutorService progressExecutor
    ) {
        this.sessionRepository = sessionRepository;
        this.observationRepository = observationRepository;
        this.mapper = mapper;
        this.comparisonCache = comparisonCache;
        this.state = state;
        for (ScrapeSource source : scrapeSources) {
            sources.putIfAbsent(source.kind(), source);
        }
        this.properties = properties;
        this.scrapeExecutor = scrapeExecutor;
        this.progressExecutor = progressExecutor;
    }

    /**
     * Stores {@code rawItems} as a new completed session of {@code kind}. Invalid items are rejected and
     * counted; a storage fault leaves the session incomplete and surfaces as {@link IngestionFailureException}.
     */
    public IngestionSummary ingest(ScrapeKind kind, String originLabel, List<?> rawItems) {
        String sessionId;
        try {
            sessionId = sessionRepository.createSession(kind, originLabel);
        } catch (DataAccessException e) {
            throw new IngestionFailureException(null, "Unable to create " + kind.label() + " session", e);
        }
        return ingestInto(kind, sessionId, rawItems);
    }

    public void startScrape(ScrapeKind kind) {
        ScrapeSource source = sources.get(kind);
        if (source == null || !source.isAvailable()) {
            throw new ScrapeSourceUnavailableException("No " + kind.label() + " scraper is configured");
        }
        if (!state.tryStart(kind)) {
            throw new ActiveScrapeException("A " + kind.label() + " scrape is already running");
        }
        try {
            scrapeExecutor.submit(() -> runScrape(source));
        } catch (RejectedExecutionException e) {
            state.fail(kind, "scrape executor is not accepting work");
            state.release(kind);
            throw new ScrapeSourceUnavailableException("Scrape executor rejected the " + kind.label() + " run");
        }
    }

    void runScrape(ScrapeSource source) {
        ScrapeKind kind = source.kind();
        ProgressChannel channel = new ProgressChannel();
        Future<?> consumer = progressExecutor.submit(() -> {
            try {
                channel.drain(message -> state.progress(kind, message));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        String sessionId = null;
        try {
            sessionId = sessionRepository.createSession(kind, source.originLabel());
            List<Map<String, Object>> rawItems = source.fetch(channel);
            channel.publish("Saving " + rawItems.size() + " items...");
            closeAndAwait(channel, consumer);
            IngestionSummary summary = ingestInto(kind, sessionId, rawItems);
            state.complete(kind, summary.acceptedCount());
        } catch (IngestionFailureException e) {
            closeAndAwait(channel, consumer);
            log.warn("{} scrape could not be stored", kind.label(), e);
            state.fail(kind, e.getMessage());
        } catch (RuntimeException e) {
            closeAndAwait(channel, consumer);
            if (sessionId != null) {
                markFailed(sessionId, e.getMessage());
            }
            log.warn("{} scrape failed", kind.label(), e);
            state.fail(kind, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            state.release(kind);
        }
    }

    private IngestionSummary ingestInto(ScrapeKind kind, String sessionId, List<?> rawItems) {
        int accepted;
        int rejected;
        List<String> sampleErrors;
        try {
            if (kind == ScrapeKind.WTB) {
                ObservationMapper.MappingResult<WtbObservation> mapped = mapper.mapWtb(sessionId, rawItems);
                observationRepository.appendWtbObservations(sessionId, mapped.accepted());
                accepted = mapped.accepted().size();
                rejected = mapped.rejectedCount();
                sampleErrors = mapped.sampleErrors();
            } else {
                ObservationMapper.MappingResult<InventoryObservation> mapped = mapper.mapInventory(sessionId, rawItems);
                observationRepository.appendInventoryObservations(sessionId, mapped.accepted());
                accepted = mapped.accepted().size();
                rejected = mapped.rejectedCount();
                sampleErrors = mapped.sampleErrors();
            }
            if (!sessionRepository.completeSession(sessionId, accepted)) {
                throw new IngestionFailureException(
                    sessionId,
                    kind.label() + " session " + sessionId + " was closed before it could be completed"
                );
            }
        } catch (IngestionFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            markFailed(sessionId, e.getMessage());
            throw new IngestionFailureException(
                sessionId,
                "Failed to store " + kind.label() + " session " + sessionId + ": " + e.getMessage(),
                e
            );
        }
        comparisonCache.invalidate();
        if (rejected > 0) {
            log.info("{} session {} stored {} items, rejected {}", kind.label(), sessionId, accepted, rejected);
        } else {
            log.info("{} session {} stored {} items", kind.label(), sessionId, accepted);
        }
        return new IngestionSummary(sessionId, kind, accepted, rejected, List.copyOf(sampleErrors));
    }

    private void markFailed(String sessionId, String reason) {
        try {
            sessionRepository.markSessionFailed(sessionId, reason);
        } catch (DataAccessException e) {
            log.warn("Unable to mark session {} failed", sessionId, e);
        }
    }

    private void closeAndAwait(ProgressChannel channel, Future<?> consumer) {
        if (channel.isClosed()) {
            return;
        }
        channel.close();
        try {
            consumer.get(properties.getScraper().getProgressDrainSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Progress consumer did not drain in time; cancelling");
            consumer.cancel(true);
        } catch (ExecutionException e) {
            log.warn("Progress consumer failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
