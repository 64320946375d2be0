package com.wtbmonitor.market.service;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.HealthResponse;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.model.ScrapeSession;
import com.wtbmonitor.market.model.StatusResponse;
import com.wtbmonitor.market.persistence.ObservationRepository;
import com.wtbmonitor.market.persistence.ScrapeSessionRepository;
import com.wtbmonitor.market.state.ScrapeStateRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class MonitorStatusService {
    private static final Logger log = LoggerFactory.getLogger(MonitorStatusService.class);

    private final ScrapeSessionRepository sessionRepository;
    private final ObservationRepository observationRepository;
    private final ScrapeStateRegistry state;
    private final MonitorProperties properties;
    private final Clock clock;

    public MonitorStatusService(
        ScrapeSessionRepository sessionRepository,
        ObservationRepository observationRepository,
        ScrapeStateRegistry state,
        MonitorProperties properties,
        Clock clock
    ) {
        this.sessionRepository = sessionRepository;
        this.observationRepository = observationRepository;
        this.state = state;
        this.properties = properties;
        this.clock = clock;
    }

    public HealthResponse getHealth() {
        boolean dbConnected;
        try {
            dbConnected = sessionRepository.isDbReachable();
        } catch (Exception ignored) {
            dbConnected = false;
        }
        if (!dbConnected) {
            return new HealthResponse("degraded", clock.instant(), false, new LinkedHashMap<>());
        }
        Map<String, Long> counts = sessionRepository.tableCounts();
        return new HealthResponse("healthy", clock.instant(), true, counts);
    }

    public StatusResponse getStatus() {
        long wtbCount = 0L;
        long inventoryCount = 0L;
        try {
            wtbCount = observationRepository.countAll(ScrapeKind.WTB);
            inventoryCount = observationRepository.countAll(ScrapeKind.INVENTORY);
        } catch (DataAccessException e) {
            log.warn("Failed to load observation counts", e);
        }
        return new StatusResponse(state.statuses(), wtbCount, inventoryCount);
    }

    public List<ScrapeSession> listSessions(ScrapeKind kind, Integer limit) {
        int maxLimit = properties.getApi().getMaxSessionLimit();
        int safeLimit = limit == null
            ? properties.getApi().getDefaultSessionLimit()
            : Math.max(1, Math.min(limit, maxLimit));
        return sessionRepository.listSessions(kind, safeLimit);
    }
}
