package com.wtbmonitor.market.persistence;

import com.wtbmonitor.market.model.StoreTarget;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;

/**
 * WTB stores the scraper visits. Targets are listed in insertion order.
 */
@Repository
public class StoreTargetRepository {
    private static final RowMapper<StoreTarget> TARGET_ROW_MAPPER = (rs, rowNum) -> new StoreTarget(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("url"),
        rs.getBoolean("enabled")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public StoreTargetRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    public List<StoreTarget> listTargets() {
        return jdbc.query(
            """
                SELECT id, name, url, enabled
                FROM store_targets
                ORDER BY id
                """,
            TARGET_ROW_MAPPER
        );
    }

    public void insertTarget(String name, String url) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("url", url)
            .addValue("createdAt", Timestamp.from(clock.instant()));
        jdbc.update(
            """
                INSERT INTO store_targets (name, url, enabled, created_at)
                VALUES (:name, :url, TRUE, :createdAt)
                """,
            params
        );
    }

    public boolean deleteTarget(long id) {
        return jdbc.update("DELETE FROM store_targets WHERE id = :id", new MapSqlParameterSource("id", id)) > 0;
    }

    public boolean setEnabled(long id, boolean enabled) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("enabled", enabled);
        return jdbc.update("UPDATE store_targets SET enabled = :enabled WHERE id = :id", params) > 0;
    }
}
