package com.wtbmonitor.market.service;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.ScrapeSession;
import com.wtbmonitor.market.persistence.ScrapeSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Closes out sessions left running by a previous process. They keep a null completion time.
 */
@Component
public class SessionLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleRunner.class);

    private final ScrapeSessionRepository repository;
    private final MonitorProperties properties;
    private final Clock clock;

    public SessionLifecycleRunner(ScrapeSessionRepository repository, MonitorProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        abandonStaleSessions(clock.instant());
    }

    int abandonStaleSessions(Instant now) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping scrape session cleanup because database is unreachable");
            return 0;
        }

        int staleMinutes = properties.getIngestion().getStaleSessionMinutes();
        Instant cutoff = now.minus(Duration.ofMinutes(staleMinutes));
        List<ScrapeSession> running = repository.findRunningSessions();
        int abandoned = 0;
        for (ScrapeSession session : running) {
            if (session.startedAt().isAfter(cutoff)) {
                continue;
            }
            if (repository.markSessionAbandoned(session.sessionId(), "abandoned_on_startup")) {
                abandoned++;
                log.info(
                    "Abandoned stale {} session {} startedAt={}",
                    session.kind(),
                    session.sessionId(),
                    session.startedAt()
                );
            }
        }
        return abandoned;
    }
}
