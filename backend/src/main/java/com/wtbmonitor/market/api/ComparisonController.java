package com.wtbmonitor.market.api;

import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.ClassificationResult;
import com.wtbmonitor.market.model.ComparisonSummaryResponse;
import com.wtbmonitor.market.model.IngestionSummary;
import com.wtbmonitor.market.model.MissingItem;
import com.wtbmonitor.market.service.ClassificationService;
import com.wtbmonitor.market.service.ComparisonCache;
import com.wtbmonitor.market.service.CsvTransferService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class ComparisonController {
    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ComparisonCache comparisonCache;
    private final ClassificationService classificationService;
    private final CsvTransferService csvTransferService;
    private final MonitorProperties properties;

    public ComparisonController(
        ComparisonCache comparisonCache,
        ClassificationService classificationService,
        CsvTransferService csvTransferService,
        MonitorProperties properties
    ) {
        this.comparisonCache = comparisonCache;
        this.classificationService = classificationService;
        this.csvTransferService = csvTransferService;
        this.properties = properties;
    }

    /**
     * The cached default comparison, or a fresh one when either session is pinned.
     */
    @GetMapping("/comparison")
    public ClassificationResult comparison(
        @RequestParam(name = "wtbSession", required = false) String wtbSession,
        @RequestParam(name = "inventorySession", required = false) String inventorySession
    ) {
        if (isBlank(wtbSession) && isBlank(inventorySession)) {
            return comparisonCache.get();
        }
        return classificationService.classify(wtbSession, inventorySession);
    }

    @GetMapping("/comparison/summary")
    public ComparisonSummaryResponse summary() {
        ClassificationResult result = comparisonCache.get();
        return new ComparisonSummaryResponse(result.summary(), result.computedAt());
    }

    @GetMapping("/comparison/missing")
    public List<MissingItem> missing(
        @RequestParam(name = "minDemand", required = false, defaultValue = "1") int minDemand
    ) {
        return comparisonCache.get().missingWithDemandAtLeast(minDemand);
    }

    @GetMapping("/comparison/opportunities")
    public List<MissingItem> opportunities(@RequestParam(name = "limit", required = false) Integer limit) {
        int safeLimit = limit == null
            ? properties.getApi().getDefaultOpportunityLimit()
            : Math.max(1, limit);
        return comparisonCache.get().topOpportunities(safeLimit);
    }

    @PostMapping(path = "/import/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public IngestionSummary importCsv(@RequestPart("file") MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "CSV file is required");
        }
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return csvTransferService.importInventory(reader);
        } catch (IOException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Unable to read uploaded CSV", e);
        }
    }

    @GetMapping("/export/missing")
    public ResponseEntity<String> exportMissing() throws IOException {
        StringWriter writer = new StringWriter();
        csvTransferService.writeMissing(comparisonCache.get(), writer);
        return csvAttachment("missing_items.csv", writer.toString());
    }

    @GetMapping("/export/all")
    public ResponseEntity<String> exportAll() throws IOException {
        StringWriter writer = new StringWriter();
        csvTransferService.writeAll(comparisonCache.get(), writer);
        return csvAttachment("comparison_results.csv", writer.toString());
    }

    private static ResponseEntity<String> csvAttachment(String filename, String body) {
        return ResponseEntity.ok()
            .contentType(TEXT_CSV)
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + filename)
            .body(body);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
