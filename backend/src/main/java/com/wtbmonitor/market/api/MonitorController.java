package com.wtbmonitor.market.api;

import com.wtbmonitor.market.model.ConsoleLogPage;
import com.wtbmonitor.market.model.HealthResponse;
import com.wtbmonitor.market.model.IngestionSummary;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.model.ScrapeSession;
import com.wtbmonitor.market.model.ScrapeTriggerResponse;
import com.wtbmonitor.market.model.StatusResponse;
import com.wtbmonitor.market.service.IngestionService;
import com.wtbmonitor.market.service.MonitorStatusService;
import com.wtbmonitor.market.state.ScrapeStateRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class MonitorController {
    private final IngestionService ingestionService;
    private final MonitorStatusService statusService;
    private final ScrapeStateRegistry state;

    public MonitorController(
        IngestionService ingestionService,
        MonitorStatusService statusService,
        ScrapeStateRegistry state
    ) {
        this.ingestionService = ingestionService;
        this.statusService = statusService;
        this.state = state;
    }

    @PostMapping("/scrape/{kind}")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ScrapeTriggerResponse triggerScrape(@PathVariable("kind") String kind) {
        ScrapeKind scrapeKind = parseKind(kind);
        ingestionService.startScrape(scrapeKind);
        return new ScrapeTriggerResponse(scrapeKind, scrapeKind.label() + " scrape started");
    }

    @PostMapping("/ingest/{kind}")
    public IngestionSummary ingest(
        @PathVariable("kind") String kind,
        @RequestParam(name = "origin", required = false, defaultValue = "api") String origin,
        @RequestBody List<Object> items
    ) {
        return ingestionService.ingest(parseKind(kind), origin, items);
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/logs")
    public ConsoleLogPage logs(@RequestParam(name = "since", required = false, defaultValue = "0") long since) {
        return state.logsSince(since);
    }

    @GetMapping("/sessions")
    public List<ScrapeSession> sessions(
        @RequestParam(name = "kind", required = false) String kind,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        ScrapeKind scrapeKind = kind == null || kind.isBlank() ? null : parseKind(kind);
        return statusService.listSessions(scrapeKind, limit);
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return statusService.getHealth();
    }

    static ScrapeKind parseKind(String kind) {
        try {
            return ScrapeKind.fromRaw(kind);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Unsupported scrape kind: " + kind);
        }
    }
}
