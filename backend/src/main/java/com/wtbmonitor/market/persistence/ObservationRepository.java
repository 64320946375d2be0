package com.wtbmonitor.market.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.InventoryObservation;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.model.WtbObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only store of raw observations. Rows are returned in insertion order.
 */
@Repository
public class ObservationRepository {
    private static final Logger log = LoggerFactory.getLogger(ObservationRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final MonitorProperties properties;
    private final Clock clock;

    public ObservationRepository(
        NamedParameterJdbcTemplate jdbc,
        TransactionTemplate transactionTemplate,
        ObjectMapper objectMapper,
        MonitorProperties properties,
        Clock clock
    ) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Inserts every item or none: batches share one transaction.
     */
    public int appendWtbObservations(String sessionId, List<WtbObservation> items) {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        Instant observedAt = clock.instant();
        List<MapSqlParameterSource> paramsList = new ArrayList<>(items.size());
        for (WtbObservation item : items) {
            paramsList.add(new MapSqlParameterSource()
                .addValue("sessionId", sessionId)
                .addValue("productName", item.productName())
                .addValue("sku", item.sku())
                .addValue("brand", item.brand())
                .addValue("size", item.size())
                .addValue("priceMin", item.priceMin())
                .addValue("priceMax", item.priceMax())
                .addValue("originStore", item.originStore())
                .addValue("imageUrl", item.imageUrl())
                .addValue("observedAt", Timestamp.from(observedAt)));
        }
        batchInsert(
            """
                INSERT INTO wtb_observations (
                    session_id, product_name, sku, brand, size, price_min, price_max,
                    origin_store, image_url, observed_at
                )
                VALUES (
                    :sessionId, :productName, :sku, :brand, :size, :priceMin, :priceMax,
                    :originStore, :imageUrl, :observedAt
                )
                """,
            paramsList
        );
        log.debug("Appended {} WTB observations to session {}", items.size(), sessionId);
        return items.size();
    }

    public int appendInventoryObservations(String sessionId, List<InventoryObservation> items) {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        Instant observedAt = clock.instant();
        List<MapSqlParameterSource> paramsList = new ArrayList<>(items.size());
        for (InventoryObservation item : items) {
            paramsList.add(new MapSqlParameterSource()
                .addValue("sessionId", sessionId)
                .addValue("productName", item.productName())
                .addValue("sku", item.sku())
                .addValue("brand", item.brand())
                .addValue("sizes", writeSizes(item.sizes()))
                .addValue("price", item.price())
                .addValue("url", item.url())
                .addValue("imageUrl", item.imageUrl())
                .addValue("observedAt", Timestamp.from(observedAt)));
        }
        batchInsert(
            """
                INSERT INTO inventory_observations (
                    session_id, product_name, sku, brand, sizes, price, url, image_url, observed_at
                )
                VALUES (
                    :sessionId, :productName, :sku, :brand, :sizes, :price, :url, :imageUrl, :observedAt
                )
                """,
            paramsList
        );
        log.debug("Appended {} inventory observations to session {}", items.size(), sessionId);
        return items.size();
    }

    private void batchInsert(String sql, List<MapSqlParameterSource> paramsList) {
        int batchSize = properties.getIngestion().getBatchSize();
        transactionTemplate.executeWithoutResult(status -> {
            for (int i = 0; i < paramsList.size(); i += batchSize) {
                int end = Math.min(paramsList.size(), i + batchSize);
                List<MapSqlParameterSource> chunk = paramsList.subList(i, end);
                jdbc.batchUpdate(sql, chunk.toArray(new MapSqlParameterSource[0]));
            }
        });
    }

    public List<WtbObservation> wtbObservationsForSession(String sessionId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", sessionId);
        return jdbc.query(
            """
                SELECT id, session_id, product_name, sku, brand, size, price_min, price_max,
                       origin_store, image_url
                FROM wtb_observations
                WHERE session_id = :sessionId
                ORDER BY id ASC
                """,
            params,
            (rs, rowNum) -> new WtbObservation(
                rs.getLong("id"),
                rs.getString("session_id"),
                rs.getString("product_name"),
                rs.getString("sku"),
                rs.getString("brand"),
                rs.getString("size"),
                getDouble(rs, "price_min"),
                getDouble(rs, "price_max"),
                rs.getString("origin_store"),
                rs.getString("image_url")
            )
        );
    }

    public List<InventoryObservation> inventoryObservationsForSession(String sessionId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", sessionId);
        return jdbc.query(
            """
                SELECT id, session_id, product_name, sku, brand, sizes, price, url, image_url
                FROM inventory_observations
                WHERE session_id = :sessionId
                ORDER BY id ASC
                """,
            params,
            (rs, rowNum) -> new InventoryObservation(
                rs.getLong("id"),
                rs.getString("session_id"),
                rs.getString("product_name"),
                rs.getString("sku"),
                rs.getString("brand"),
                readSizes(rs.getString("sizes")),
                getDouble(rs, "price"),
                rs.getString("url"),
                rs.getString("image_url")
            )
        );
    }

    public long countObservations(String sessionId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", sessionId);
        Long count = jdbc.queryForObject(
            """
                SELECT
                    (SELECT COUNT(*) FROM wtb_observations WHERE session_id = :sessionId)
                    + (SELECT COUNT(*) FROM inventory_observations WHERE session_id = :sessionId)
                """,
            params,
            Long.class
        );
        return count == null ? 0L : count;
    }

    public long countAll(ScrapeKind kind) {
        String table = kind == ScrapeKind.WTB ? "wtb_observations" : "inventory_observations";
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0L : count;
    }

    private String writeSizes(List<String> sizes) {
        if (sizes == null || sizes.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(sizes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize sizes " + sizes, e);
        }
    }

    private List<String> readSizes(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<String> parsed = objectMapper.readValue(json, STRING_LIST);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable sizes column value {}", json);
            return List.of();
        }
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
