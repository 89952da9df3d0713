package com.valan.harvester.crawl.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.valan.harvester.config.HarvesterProperties;
import com.valan.harvester.crawl.model.HarvestMode;
import com.valan.harvester.crawl.model.HarvestRunMeta;
import com.valan.harvester.crawl.model.HarvestStats;
import com.valan.harvester.crawl.model.TerminationReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bookkeeping for harvest runs ({@code harvest_runs}) and the table counts shown on
 * the status endpoint.
 */
@Repository
public class HarvestRunRepository {
    private static final Logger log = LoggerFactory.getLogger(HarvestRunRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final HarvesterProperties properties;

    public HarvestRunRepository(
        NamedParameterJdbcTemplate jdbc,
        ObjectMapper objectMapper,
        HarvesterProperties properties
    ) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public long insertHarvestRun(Instant startedAt, String status, HarvestMode mode, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", properties.getSource())
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status)
            .addValue("mode", mode.name())
            .addValue("notes", notes);

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO harvest_runs (source, started_at, status, mode, notes)
                VALUES (:source, :startedAt, :status, :mode, :notes)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key != null) {
            return key.longValue();
        }
        Long id = jdbc.queryForObject(
            """
                SELECT id
                FROM harvest_runs
                WHERE started_at = :startedAt
                  AND status = :status
                ORDER BY id DESC
                LIMIT 1
                """,
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Failed to insert harvest run");
        }
        return id;
    }

    public void completeHarvestRun(
        long harvestRunId,
        Instant finishedAt,
        String status,
        Long startId,
        Long lowerBound,
        Long lastVisitedId,
        TerminationReason reason,
        HarvestStats stats,
        String notes
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("harvestRunId", harvestRunId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("startId", startId)
            .addValue("lowerBound", lowerBound)
            .addValue("lastVisitedId", lastVisitedId)
            .addValue("terminationReason", reason == null ? null : reason.name())
            .addValue("stats", toJson(stats))
            .addValue("notes", notes);
        jdbc.update(
            """
                UPDATE harvest_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    start_id = :startId,
                    lower_bound = :lowerBound,
                    last_visited_id = :lastVisitedId,
                    termination_reason = :terminationReason,
                    stats = :stats,
                    notes = :notes
                WHERE id = :harvestRunId
                """,
            params
        );
    }

    public HarvestRunMeta findMostRecentRun() {
        List<HarvestRunMeta> runs = jdbc.query(
            """
                SELECT id, started_at, finished_at, status, mode, start_id, lower_bound,
                       termination_reason, notes
                FROM harvest_runs
                WHERE source = :source
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource("source", properties.getSource()),
            (rs, rowNum) -> new HarvestRunMeta(
                rs.getLong("id"),
                rs.getTimestamp("started_at").toInstant(),
                rs.getTimestamp("finished_at") == null ? null : rs.getTimestamp("finished_at").toInstant(),
                rs.getString("status"),
                rs.getString("mode"),
                rs.getObject("start_id", Long.class),
                rs.getObject("lower_bound", Long.class),
                rs.getString("termination_reason"),
                rs.getString("notes")
            )
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("registry_tenders", countTable("registry_tenders"));
        counts.put("registry_awards", countTable("registry_awards"));
        counts.put("registry_awards_enriched", countEnrichedAwards());
        counts.put("harvest_runs", countTable("harvest_runs"));
        return counts;
    }

    private long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    private long countEnrichedAwards() {
        Long count = jdbc.getJdbcTemplate().queryForObject(
            "SELECT COUNT(*) FROM registry_awards WHERE supplier_name IS NOT NULL",
            Long.class
        );
        return count == null ? 0L : count;
    }

    private String toJson(HarvestStats stats) {
        if (stats == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(stats);
        } catch (Exception e) {
            log.warn("Run stats not serializable: {}", e.getMessage());
            return null;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }
}
