package com.wtbmonitor.market.service;

import com.wtbmonitor.market.model.ClassificationResult;
import com.wtbmonitor.market.model.InStockItem;
import com.wtbmonitor.market.model.IngestionSummary;
import com.wtbmonitor.market.model.MissingItem;
import com.wtbmonitor.market.model.NoDemandItem;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.state.ScrapeStateRegistry;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

/**
 * Inventory import from CSV and CSV export of classification results.
 */
@Service
public class CsvTransferService {
    private static final Logger log = LoggerFactory.getLogger(CsvTransferService.class);
    static final String IMPORT_ORIGIN = "csv-import";
    static final String[] MISSING_HEADERS = {"Name", "SKU", "Brand", "Demand", "Sizes Wanted", "Stores"};
    static final String[] ALL_HEADERS = {"Status", "Name", "SKU", "Brand", "Demand", "Price", "URL"};

    private final IngestionService ingestionService;
    private final ScrapeStateRegistry state;

    public CsvTransferService(IngestionService ingestionService, ScrapeStateRegistry state) {
        this.ingestionService = ingestionService;
        this.state = state;
    }

    public IngestionSummary importInventory(Reader reader) {
        List<Map<String, Object>> items = new ArrayList<>();
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("name", getColumn(record, "name", "product_name"));
                item.put("sku", getColumn(record, "sku"));
                item.put("brand", getColumn(record, "brand"));
                item.put("sizes", getColumn(record, "sizes"));
                item.put("price", getColumn(record, "price"));
                item.put("url", getColumn(record, "url"));
                item.put("image_url", getColumn(record, "image_url"));
                items.add(item);
            }
        } catch (IOException | IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Unreadable CSV: " + e.getMessage(), e);
        }
        IngestionSummary summary = ingestionService.ingest(ScrapeKind.INVENTORY, IMPORT_ORIGIN, items);
        state.complete(ScrapeKind.INVENTORY, summary.acceptedCount());
        log.info("CSV import stored {} products in session {}", summary.acceptedCount(), summary.sessionId());
        return summary;
    }

    public void writeMissing(ClassificationResult result, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(MISSING_HEADERS).build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (MissingItem item : result.missing()) {
                printer.printRecord(
                    item.wtbName(),
                    item.wtbSku(),
                    item.brand(),
                    item.demandCount(),
                    String.join(",", item.sizesWanted()),
                    String.join(", ", item.storesWanting())
                );
            }
        }
    }

    public void writeAll(ClassificationResult result, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(ALL_HEADERS).build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (MissingItem item : result.missing()) {
                printer.printRecord("Missing", item.wtbName(), item.wtbSku(), item.brand(), item.demandCount(), null, null);
            }
            for (InStockItem item : result.inStock()) {
                printer.printRecord(
                    "In stock",
                    item.myProductName(),
                    item.myProductSku(),
                    item.brand(),
                    item.demandCount(),
                    item.myProductPrice(),
                    item.myProductUrl()
                );
            }
            for (NoDemandItem item : result.noDemand()) {
                printer.printRecord(
                    "No demand",
                    item.myProductName(),
                    item.myProductSku(),
                    item.brand(),
                    0,
                    item.myProductPrice(),
                    item.myProductUrl()
                );
            }
        }
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null || !record.isSet(header)) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }
}
