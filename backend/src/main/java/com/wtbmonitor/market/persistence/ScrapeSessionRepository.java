package com.wtbmonitor.market.persistence;

import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.model.ScrapeSession;
import com.wtbmonitor.market.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class ScrapeSessionRepository {
    private static final Logger log = LoggerFactory.getLogger(ScrapeSessionRepository.class);
    private static final Set<String> COUNTABLE_TABLES = Set.of("scrape_sessions", "wtb_observations", "inventory_observations");
    private static final int MAX_NOTES_LENGTH = 1000;

    private static final RowMapper<ScrapeSession> SESSION_ROW_MAPPER = (rs, rowNum) -> new ScrapeSession(
        rs.getString("session_id"),
        ScrapeKind.valueOf(rs.getString("kind")),
        rs.getString("origin_label"),
        SessionStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("completed_at")),
        rs.getInt("item_count"),
        rs.getString("notes")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final SessionIdGenerator idGenerator;
    private final Clock clock;

    public ScrapeSessionRepository(NamedParameterJdbcTemplate jdbc, SessionIdGenerator idGenerator, Clock clock) {
        this.jdbc = jdbc;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("scrape_sessions", countTable("scrape_sessions"));
        counts.put("wtb_observations", countTable("wtb_observations"));
        counts.put("inventory_observations", countTable("inventory_observations"));
        return counts;
    }

    public long countTable(String tableName) {
        if (!COUNTABLE_TABLES.contains(tableName)) {
            throw new IllegalArgumentException("Unknown table: " + tableName);
        }
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    public String createSession(ScrapeKind kind, String originLabel) {
        String sessionId = idGenerator.nextId();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", sessionId)
            .addValue("kind", kind.name())
            .addValue("originLabel", originLabel)
            .addValue("status", SessionStatus.RUNNING.name())
            .addValue("startedAt", toTimestamp(clock.instant()));
        jdbc.update(
            """
                INSERT INTO scrape_sessions (session_id, kind, origin_label, status, started_at, item_count)
                VALUES (:sessionId, :kind, :originLabel, :status, :startedAt, 0)
                """,
            params
        );
        log.debug("Created {} session {} origin={}", kind, sessionId, originLabel);
        return sessionId;
    }

    /**
     * Sets {@code completed_at} and the final item count. Returns false when the session was already
     * complete or does not exist; the stored row is left untouched in that case.
     */
    public boolean completeSession(String sessionId, int itemCount) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", sessionId)
            .addValue("itemCount", Math.max(0, itemCount))
            .addValue("status", SessionStatus.COMPLETED.name())
            .addValue("completedAt", toTimestamp(clock.instant()));
        int updated = jdbc.update(
            """
                UPDATE scrape_sessions
                SET completed_at = :completedAt,
                    item_count = :itemCount,
                    status = :status
                WHERE session_id = :sessionId
                  AND completed_at IS NULL
                  AND status = 'RUNNING'
                """,
            params
        );
        if (updated == 0) {
            log.debug("completeSession no-op for session {}", sessionId);
        }
        return updated > 0;
    }

    public boolean markSessionFailed(String sessionId, String reason) {
        return closeIncomplete(sessionId, SessionStatus.FAILED, reason);
    }

    public boolean markSessionAbandoned(String sessionId, String reason) {
        return closeIncomplete(sessionId, SessionStatus.ABANDONED, reason);
    }

    private boolean closeIncomplete(String sessionId, SessionStatus status, String reason) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", sessionId)
            .addValue("status", status.name())
            .addValue("notes", truncate(reason));
        int updated = jdbc.update(
            """
                UPDATE scrape_sessions
                SET status = :status,
                    notes = :notes
                WHERE session_id = :sessionId
                  AND completed_at IS NULL
                  AND status = 'RUNNING'
                """,
            params
        );
        return updated > 0;
    }

    public Optional<String> latestCompletedSession(ScrapeKind kind) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("kind", kind.name());
        List<String> ids = jdbc.queryForList(
            """
                SELECT session_id
                FROM scrape_sessions
                WHERE kind = :kind
                  AND completed_at IS NOT NULL
                ORDER BY session_id DESC
                LIMIT 1
                """,
            params,
            String.class
        );
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    public Optional<ScrapeSession> findSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", sessionId.trim());
        List<ScrapeSession> sessions = jdbc.query(
            """
                SELECT session_id, kind, origin_label, status, started_at, completed_at, item_count, notes
                FROM scrape_sessions
                WHERE session_id = :sessionId
                """,
            params,
            SESSION_ROW_MAPPER
        );
        return sessions.isEmpty() ? Optional.empty() : Optional.of(sessions.get(0));
    }

    /**
     * Most recent first. A null kind lists both kinds.
     */
    public List<ScrapeSession> listSessions(ScrapeKind kind, int limit) {
        int safeLimit = limit <= 0 ? 50 : limit;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", safeLimit);
        String kindFilter = "";
        if (kind != null) {
            params.addValue("kind", kind.name());
            kindFilter = "WHERE kind = :kind";
        }
        return jdbc.query(
            """
                SELECT session_id, kind, origin_label, status, started_at, completed_at, item_count, notes
                FROM scrape_sessions
                %s
                ORDER BY session_id DESC
                LIMIT :limit
                """.formatted(kindFilter),
            params,
            SESSION_ROW_MAPPER
        );
    }

    public List<ScrapeSession> findRunningSessions() {
        return jdbc.query(
            """
                SELECT session_id, kind, origin_label, status, started_at, completed_at, item_count, notes
                FROM scrape_sessions
                WHERE status = 'RUNNING'
                  AND completed_at IS NULL
                ORDER BY session_id ASC
                """,
            new MapSqlParameterSource(),
            SESSION_ROW_MAPPER
        );
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_NOTES_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_NOTES_LENGTH);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
