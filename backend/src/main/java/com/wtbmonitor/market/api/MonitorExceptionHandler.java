package com.wtbmonitor.market.api;

import com.wtbmonitor.market.service.ActiveScrapeException;
import com.wtbmonitor.market.service.IngestionFailureException;
import com.wtbmonitor.market.service.ScrapeSourceUnavailableException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class MonitorExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(MonitorExceptionHandler.class);

  @ExceptionHandler(ActiveScrapeException.class)
  public ResponseEntity<Map<String, String>> handleActiveScrape(ActiveScrapeException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_scrape", "message", ex.getMessage()));
  }

  @ExceptionHandler(ScrapeSourceUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleUnavailable(ScrapeSourceUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "scrape_source_unavailable", "message", ex.getMessage()));
  }

  @ExceptionHandler(IngestionFailureException.class)
  public ResponseEntity<Map<String, String>> handleIngestionFailure(IngestionFailureException ex) {
    log.warn("Ingestion failed for session {}", ex.getSessionId(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "ingestion_failed", "message", ex.getMessage()));
  }
}
