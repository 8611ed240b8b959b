package com.jobtrail.dedup.tracking.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobtrail.dedup.tracking.model.BatchSummary;
import com.jobtrail.dedup.tracking.model.IngestionRunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ledger of scrape runs handed to the batch controller, one row per scrape run id.
 */
@Repository
public class IngestionRunRepository {
    public static final String STATUS_RUNNING = "RUNNING";
    public static final String STATUS_ABORTED = "ABORTED";

    private static final Logger log = LoggerFactory.getLogger(IngestionRunRepository.class);
    private static final TypeReference<Map<String, Integer>> MAP_INT = new TypeReference<>() {};
    private static final int MAX_ERROR_LENGTH = 2000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<IngestionRunStatus> runMapper;

    public IngestionRunRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.runMapper = (rs, rowNum) -> new IngestionRunStatus(
            rs.getString("scrape_run_id"),
            rs.getString("source_platform"),
            rs.getString("status"),
            rs.getInt("total_records"),
            rs.getInt("created_count"),
            rs.getInt("merged_count"),
            rs.getInt("rejected_count"),
            readJsonMap(rs.getString("rejection_reasons_json")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            rs.getString("last_error")
        );
    }

    /**
     * Marks the run RUNNING, resetting any counts left by an earlier submission of the same id.
     */
    public void startRun(String scrapeRunId, String sourcePlatform, int totalRecords, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", scrapeRunId)
            .addValue("platform", sourcePlatform)
            .addValue("status", STATUS_RUNNING)
            .addValue("total", totalRecords)
            .addValue("startedAt", toTimestamp(startedAt));
        String update = """
            UPDATE ingestion_runs
            SET source_platform = :platform,
                status = :status,
                total_records = :total,
                created_count = 0,
                merged_count = 0,
                rejected_count = 0,
                rejection_reasons_json = NULL,
                started_at = :startedAt,
                finished_at = NULL,
                last_error = NULL
            WHERE scrape_run_id = :runId
            """;
        int updated = jdbc.update(update, params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO ingestion_runs (scrape_run_id, source_platform, status, total_records, started_at)
                        VALUES (:runId, :platform, :status, :total, :startedAt)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                jdbc.update(update, params);
            }
        }
    }

    public void finishRun(BatchSummary summary, String lastError) {
        jdbc.update(
            """
                UPDATE ingestion_runs
                SET status = :status,
                    total_records = :total,
                    created_count = :created,
                    merged_count = :merged,
                    rejected_count = :rejected,
                    rejection_reasons_json = :reasonsJson,
                    finished_at = :finishedAt,
                    last_error = :lastError
                WHERE scrape_run_id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", summary.scrapeRunId())
                .addValue("status", summary.status())
                .addValue("total", summary.total())
                .addValue("created", summary.created())
                .addValue("merged", summary.merged())
                .addValue("rejected", summary.rejected())
                .addValue("reasonsJson", writeJson(summary.rejectionReasons()))
                .addValue("finishedAt", toTimestamp(summary.finishedAt()))
                .addValue("lastError", truncate(lastError))
        );
    }

    public IngestionRunStatus findRun(String scrapeRunId) {
        List<IngestionRunStatus> rows = jdbc.query(
            """
                SELECT scrape_run_id, source_platform, status, total_records, created_count, merged_count,
                       rejected_count, rejection_reasons_json, started_at, finished_at, last_error
                FROM ingestion_runs
                WHERE scrape_run_id = :runId
                """,
            new MapSqlParameterSource("runId", scrapeRunId),
            runMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public IngestionRunStatus findLatestRun() {
        List<IngestionRunStatus> rows = jdbc.query(
            """
                SELECT scrape_run_id, source_platform, status, total_records, created_count, merged_count,
                       rejected_count, rejection_reasons_json, started_at, finished_at, last_error
                FROM ingestion_runs
                ORDER BY started_at DESC, scrape_run_id
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            runMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * @return number of RUNNING runs started before {@code cutoff} that were marked ABORTED
     */
    public int abortRunsStartedBefore(Instant cutoff, Instant now, String reason) {
        return jdbc.update(
            """
                UPDATE ingestion_runs
                SET status = :aborted,
                    finished_at = :now,
                    last_error = :reason
                WHERE status = :running
                  AND started_at < :cutoff
                """,
            new MapSqlParameterSource()
                .addValue("aborted", STATUS_ABORTED)
                .addValue("running", STATUS_RUNNING)
                .addValue("now", toTimestamp(now))
                .addValue("cutoff", toTimestamp(cutoff))
                .addValue("reason", truncate(reason))
        );
    }

    private Map<String, Integer> readJsonMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Integer> parsed = objectMapper.readValue(json, MAP_INT);
            return parsed == null ? Map.of() : parsed;
        } catch (Exception e) {
            log.warn("Unreadable rejection reasons JSON in ingestion_runs: {}", json);
            return Map.of();
        }
    }

    private String writeJson(Map<String, Integer> map) {
        if (map == null || map.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(map);
        } catch (Exception e) {
            log.warn("Failed to serialize rejection reasons {}", map, e);
            return null;
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
