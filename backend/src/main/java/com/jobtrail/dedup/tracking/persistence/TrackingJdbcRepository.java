package com.jobtrail.dedup.tracking.persistence;

import com.jobtrail.dedup.tracking.model.CompanyJobCount;
import com.jobtrail.dedup.tracking.model.CompensationSummary;
import com.jobtrail.dedup.tracking.model.JobAnalytics;
import com.jobtrail.dedup.tracking.model.JobSource;
import com.jobtrail.dedup.tracking.model.PageCursor;
import com.jobtrail.dedup.tracking.model.TitleKey;
import com.jobtrail.dedup.tracking.model.TrackedJob;
import com.jobtrail.dedup.tracking.model.TrackedJobFilter;
import com.jobtrail.dedup.tracking.model.TrackedJobView;
import com.jobtrail.dedup.tracking.normalize.TitleNormalizer;
import com.jobtrail.dedup.tracking.service.ResolutionConflictException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class TrackingJdbcRepository {
    private static final String JOB_COLUMNS = """
        tj.id,
        tj.job_fingerprint,
        tj.canonical_company_id,
        tj.canonical_location_id,
        tj.normalized_title,
        tj.display_title,
        tj.experience_level,
        tj.job_category,
        tj.job_type,
        tj.is_remote,
        tj.description_fingerprint,
        tj.compensation_bucket,
        tj.compensation_min,
        tj.compensation_max,
        tj.first_seen_at,
        tj.last_seen_at,
        tj.repost_count,
        tj.is_evergreen,
        tj.evergreen_score,
        tj.total_seen_count,
        tj.row_version
        """;

    private static final RowMapper<TrackedJob> JOB_MAPPER = (rs, rowNum) -> new TrackedJob(
        rs.getLong("id"),
        rs.getString("job_fingerprint"),
        rs.getLong("canonical_company_id"),
        rs.getLong("canonical_location_id"),
        rs.getString("normalized_title"),
        rs.getString("display_title"),
        rs.getString("experience_level"),
        rs.getString("job_category"),
        rs.getString("job_type"),
        rs.getBoolean("is_remote"),
        rs.getString("description_fingerprint"),
        rs.getString("compensation_bucket"),
        (Long) rs.getObject("compensation_min"),
        (Long) rs.getObject("compensation_max"),
        toInstant(rs.getTimestamp("first_seen_at")),
        toInstant(rs.getTimestamp("last_seen_at")),
        rs.getInt("repost_count"),
        rs.getBoolean("is_evergreen"),
        rs.getInt("evergreen_score"),
        rs.getInt("total_seen_count"),
        rs.getLong("row_version"),
        List.of()
    );

    private static final RowMapper<JobSource> SOURCE_MAPPER = (rs, rowNum) -> new JobSource(
        rs.getString("platform"),
        rs.getString("external_id"),
        rs.getString("posting_url"),
        toInstant(rs.getTimestamp("first_seen_at")),
        toInstant(rs.getTimestamp("last_seen_at"))
    );

    private static final String FILTERED_JOBS = """
        FROM tracked_jobs tj
        JOIN canonical_companies c ON c.id = tj.canonical_company_id
        JOIN canonical_locations l ON l.id = tj.canonical_location_id
        """;

    private static final String VIEW_SELECT = """
        SELECT tj.job_fingerprint,
               tj.normalized_title,
               tj.display_title,
               tj.canonical_company_id,
               c.display_name AS company_name,
               c.domain AS company_domain,
               tj.canonical_location_id,
               l.city,
               l.region,
               l.country,
               tj.is_remote,
               tj.experience_level,
               tj.job_category,
               tj.job_type,
               tj.compensation_bucket,
               tj.first_seen_at,
               tj.last_seen_at,
               tj.repost_count,
               tj.is_evergreen,
               tj.evergreen_score,
               tj.total_seen_count,
               (SELECT COUNT(*) FROM tracked_job_sources s WHERE s.tracked_job_id = tj.id) AS sites_posted_count
        """ + FILTERED_JOBS;

    private static final RowMapper<TrackedJobView> VIEW_MAPPER = (rs, rowNum) -> {
        Instant firstSeenAt = toInstant(rs.getTimestamp("first_seen_at"));
        Instant lastSeenAt = toInstant(rs.getTimestamp("last_seen_at"));
        return new TrackedJobView(
            rs.getString("job_fingerprint"),
            rs.getString("normalized_title"),
            rs.getString("display_title"),
            rs.getLong("canonical_company_id"),
            rs.getString("company_name"),
            emptyToNull(rs.getString("company_domain")),
            rs.getLong("canonical_location_id"),
            emptyToNull(rs.getString("city")),
            emptyToNull(rs.getString("region")),
            rs.getString("country"),
            rs.getBoolean("is_remote"),
            rs.getString("experience_level"),
            rs.getString("job_category"),
            rs.getString("job_type"),
            rs.getString("compensation_bucket"),
            firstSeenAt,
            lastSeenAt,
            Duration.between(firstSeenAt, lastSeenAt).toDays(),
            rs.getInt("repost_count"),
            rs.getBoolean("is_evergreen"),
            rs.getInt("evergreen_score"),
            rs.getInt("total_seen_count"),
            rs.getInt("sites_posted_count"),
            List.of()
        );
    };

    private static final RowMapper<CompanyJobCount> COMPANY_COUNT_MAPPER = (rs, rowNum) -> new CompanyJobCount(
        rs.getLong("company_id"),
        rs.getString("company_name"),
        rs.getLong("job_count")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public TrackingJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = EntityJdbcRepository.detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("canonical_companies", countTable("canonical_companies"));
        counts.put("canonical_locations", countTable("canonical_locations"));
        counts.put("tracked_jobs", countTable("tracked_jobs"));
        counts.put("tracked_job_sources", countTable("tracked_job_sources"));
        counts.put("tracked_job_cycles", countTable("tracked_job_cycles"));
        counts.put("ingestion_runs", countTable("ingestion_runs"));
        return counts;
    }

    public TrackedJob findByFingerprint(String jobFingerprint) {
        List<TrackedJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM tracked_jobs tj
                WHERE tj.job_fingerprint = :fingerprint
                """,
            new MapSqlParameterSource("fingerprint", jobFingerprint),
            JOB_MAPPER
        );
        if (rows.isEmpty()) {
            return null;
        }
        TrackedJob job = rows.get(0);
        return job.withSources(findSources(job.id()));
    }

    /**
     * One page of fuzzy-match candidates: jobs of one company at one location whose core
     * title has {@code coreTokens} words, most recently seen first. Pass the last row of the
     * previous page as {@code after} to continue.
     */
    public List<TrackedJob> findScopeCandidates(
        long companyId,
        long locationId,
        int coreTokens,
        TrackedJob after,
        int limit
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("locationId", locationId)
            .addValue("coreTokens", coreTokens)
            .addValue("limit", limit);
        StringBuilder sql = new StringBuilder("SELECT " + JOB_COLUMNS + """
            FROM tracked_jobs tj
            WHERE tj.canonical_company_id = :companyId
              AND tj.canonical_location_id = :locationId
              AND tj.title_core_tokens = :coreTokens
            """);
        if (after != null) {
            sql.append("""
                  AND (
                    tj.last_seen_at < :afterSeenAt
                    OR (tj.last_seen_at = :afterSeenAt AND tj.id < :afterId)
                  )
                """);
            params.addValue("afterSeenAt", toTimestamp(after.lastSeenAt()));
            params.addValue("afterId", after.id());
        }
        sql.append("""
            ORDER BY tj.last_seen_at DESC, tj.id DESC
            LIMIT :limit
            """);
        return jdbc.query(sql.toString(), params, JOB_MAPPER);
    }

    /**
     * Marks scrape run {@code scrapeRunId} as counted for the job.
     *
     * @return false when that run was already counted
     */
    public boolean recordCycle(long trackedJobId, String scrapeRunId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", trackedJobId)
            .addValue("runId", scrapeRunId)
            .addValue("countedAt", toTimestamp(now));
        String insert = """
            INSERT INTO tracked_job_cycles (tracked_job_id, scrape_run_id, counted_at)
            VALUES (:jobId, :runId, :countedAt)
            """;
        if (postgres) {
            return jdbc.update(insert + " ON CONFLICT (tracked_job_id, scrape_run_id) DO NOTHING", params) > 0;
        }
        try {
            return jdbc.update(insert, params) > 0;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    /**
     * @return the generated id
     * @throws ResolutionConflictException when another writer already owns the fingerprint
     */
    public long insertTrackedJob(TrackedJob job, Instant now) {
        TitleKey titleKey = TitleNormalizer.key(job.normalizedTitle());
        MapSqlParameterSource params = jobParams(job)
            .addValue("titleCore", titleKey.core())
            .addValue("titleCoreTokens", titleKey.coreTokens().size())
            .addValue("updatedAt", toTimestamp(now));
        String insert = """
            INSERT INTO tracked_jobs (
                job_fingerprint,
                canonical_company_id,
                canonical_location_id,
                normalized_title,
                title_core,
                title_core_tokens,
                display_title,
                experience_level,
                job_category,
                job_type,
                is_remote,
                description_fingerprint,
                compensation_bucket,
                compensation_min,
                compensation_max,
                first_seen_at,
                last_seen_at,
                repost_count,
                is_evergreen,
                evergreen_score,
                total_seen_count,
                row_version,
                updated_at
            )
            VALUES (
                :fingerprint,
                :companyId,
                :locationId,
                :normalizedTitle,
                :titleCore,
                :titleCoreTokens,
                :displayTitle,
                :experienceLevel,
                :jobCategory,
                :jobType,
                :remote,
                :descriptionFingerprint,
                :compensationBucket,
                :compensationMin,
                :compensationMax,
                :firstSeenAt,
                :lastSeenAt,
                :repostCount,
                :evergreen,
                :evergreenScore,
                :totalSeenCount,
                0,
                :updatedAt
            )
            """;
        KeyHolder keys = new GeneratedKeyHolder();
        try {
            int inserted = jdbc.update(
                postgres ? insert + " ON CONFLICT (job_fingerprint) DO NOTHING" : insert,
                params,
                keys,
                new String[] {"id"}
            );
            if (inserted == 0) {
                throw new ResolutionConflictException("Tracked job " + job.jobFingerprint() + " was created concurrently");
            }
        } catch (DataIntegrityViolationException e) {
            throw new ResolutionConflictException("Tracked job " + job.jobFingerprint() + " was created concurrently", e);
        }
        Number id = keys.getKey();
        if (id == null) {
            throw new IllegalStateException("No id generated for tracked job " + job.jobFingerprint());
        }
        return id.longValue();
    }

    /**
     * Writes the temporal state of {@code job} if nobody else updated the row since
     * {@code job.version()} was read.
     */
    public void updateTrackedJob(TrackedJob job, Instant now) {
        MapSqlParameterSource params = jobParams(job)
            .addValue("id", job.id())
            .addValue("expectedVersion", job.version())
            .addValue("updatedAt", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE tracked_jobs
                SET display_title = :displayTitle,
                    experience_level = :experienceLevel,
                    job_type = COALESCE(:jobType, job_type),
                    is_remote = :remote,
                    description_fingerprint = COALESCE(:descriptionFingerprint, description_fingerprint),
                    compensation_min = :compensationMin,
                    compensation_max = :compensationMax,
                    first_seen_at = :firstSeenAt,
                    last_seen_at = :lastSeenAt,
                    repost_count = :repostCount,
                    is_evergreen = :evergreen,
                    evergreen_score = :evergreenScore,
                    total_seen_count = :totalSeenCount,
                    row_version = row_version + 1,
                    updated_at = :updatedAt
                WHERE id = :id
                  AND row_version = :expectedVersion
                """,
            params
        );
        if (updated == 0) {
            throw new ResolutionConflictException("Tracked job " + job.jobFingerprint() + " changed concurrently");
        }
    }

    public void upsertSource(long trackedJobId, String platform, String externalId, String postingUrl, Instant seenAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", trackedJobId)
            .addValue("platform", platform)
            .addValue("externalId", externalId, Types.VARCHAR)
            .addValue("postingUrl", postingUrl, Types.VARCHAR)
            .addValue("seenAt", toTimestamp(seenAt));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO tracked_job_sources (tracked_job_id, platform, external_id, posting_url, first_seen_at, last_seen_at)
                    VALUES (:jobId, :platform, :externalId, :postingUrl, :seenAt, :seenAt)
                    ON CONFLICT (tracked_job_id, platform)
                    DO UPDATE SET
                        external_id = COALESCE(EXCLUDED.external_id, tracked_job_sources.external_id),
                        posting_url = COALESCE(EXCLUDED.posting_url, tracked_job_sources.posting_url),
                        first_seen_at = LEAST(tracked_job_sources.first_seen_at, EXCLUDED.first_seen_at),
                        last_seen_at = GREATEST(tracked_job_sources.last_seen_at, EXCLUDED.last_seen_at)
                    """,
                params
            );
            return;
        }

        String update = """
            UPDATE tracked_job_sources
            SET external_id = COALESCE(:externalId, external_id),
                posting_url = COALESCE(:postingUrl, posting_url),
                first_seen_at = CASE WHEN first_seen_at > :seenAt THEN :seenAt ELSE first_seen_at END,
                last_seen_at = CASE WHEN last_seen_at < :seenAt THEN :seenAt ELSE last_seen_at END
            WHERE tracked_job_id = :jobId
              AND platform = :platform
            """;
        int updated = jdbc.update(update, params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO tracked_job_sources (tracked_job_id, platform, external_id, posting_url, first_seen_at, last_seen_at)
                        VALUES (:jobId, :platform, :externalId, :postingUrl, :seenAt, :seenAt)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                jdbc.update(update, params);
            }
        }
    }

    public List<JobSource> findSources(long trackedJobId) {
        return jdbc.query(
            """
                SELECT platform, external_id, posting_url, first_seen_at, last_seen_at
                FROM tracked_job_sources
                WHERE tracked_job_id = :jobId
                ORDER BY platform
                """,
            new MapSqlParameterSource("jobId", trackedJobId),
            SOURCE_MAPPER
        );
    }

    public Map<Long, List<JobSource>> findSourcesByJobIds(Collection<Long> trackedJobIds) {
        Map<Long, List<JobSource>> byJob = new LinkedHashMap<>();
        if (trackedJobIds == null || trackedJobIds.isEmpty()) {
            return byJob;
        }
        jdbc.query(
            """
                SELECT tracked_job_id, platform, external_id, posting_url, first_seen_at, last_seen_at
                FROM tracked_job_sources
                WHERE tracked_job_id IN (:ids)
                ORDER BY tracked_job_id, platform
                """,
            new MapSqlParameterSource("ids", trackedJobIds),
            rs -> {
                byJob.computeIfAbsent(rs.getLong("tracked_job_id"), ignored -> new ArrayList<>())
                    .add(SOURCE_MAPPER.mapRow(rs, 0));
            }
        );
        return byJob;
    }

    /**
     * One page of the read path ordered by {@code last_seen_at DESC, job_fingerprint ASC},
     * starting strictly after {@code cursor} when given. Sources are not attached.
     */
    public List<TrackedJobView> findPage(TrackedJobFilter filter, PageCursor cursor, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", limit);
        StringBuilder where = new StringBuilder(filterClause(filter, params));
        if (cursor != null) {
            where.append("""
                  AND (
                    tj.last_seen_at < :cursorSeenAt
                    OR (tj.last_seen_at = :cursorSeenAt AND tj.job_fingerprint > :cursorFingerprint)
                  )
                """);
            params.addValue("cursorSeenAt", toTimestamp(cursor.lastSeenAt()));
            params.addValue("cursorFingerprint", cursor.jobFingerprint());
        }

        return jdbc.query(
            VIEW_SELECT + where + """
                ORDER BY tj.last_seen_at DESC, tj.job_fingerprint ASC
                LIMIT :limit
                """,
            params,
            VIEW_MAPPER
        );
    }

    /**
     * Aggregates over every tracked job matching {@code filter}: headline counts, the
     * {@code topCompanies} companies with the most jobs, job type and category distributions
     * and average annual pay bounds.
     */
    public JobAnalytics findAnalytics(TrackedJobFilter filter, int topCompanies) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", topCompanies);
        String where = filterClause(filter, params);

        JobAnalytics totals = jdbc.queryForObject(
            """
                SELECT COUNT(*) AS total_jobs,
                       SUM(CASE WHEN tj.is_evergreen THEN 1 ELSE 0 END) AS evergreen_jobs,
                       SUM(CASE WHEN tj.repost_count > 0 THEN 1 ELSE 0 END) AS reposted_jobs,
                       SUM(CASE WHEN tj.is_remote THEN 1 ELSE 0 END) AS remote_jobs,
                       AVG(CAST(tj.compensation_min AS DOUBLE PRECISION)) AS average_min,
                       AVG(CAST(tj.compensation_max AS DOUBLE PRECISION)) AS average_max,
                       SUM(CASE WHEN tj.compensation_min IS NOT NULL OR tj.compensation_max IS NOT NULL
                                THEN 1 ELSE 0 END) AS compensation_samples
                """ + FILTERED_JOBS + where,
            params,
            (rs, rowNum) -> new JobAnalytics(
                rs.getLong("total_jobs"),
                rs.getLong("evergreen_jobs"),
                rs.getLong("reposted_jobs"),
                rs.getLong("remote_jobs"),
                List.of(),
                Map.of(),
                Map.of(),
                new CompensationSummary(
                    nullableDouble(rs, "average_min"),
                    nullableDouble(rs, "average_max"),
                    rs.getLong("compensation_samples")
                )
            )
        );
        if (totals == null) {
            throw new IllegalStateException("Analytics query returned no row");
        }

        List<CompanyJobCount> companies = jdbc.query(
            """
                SELECT c.id AS company_id, c.display_name AS company_name, COUNT(*) AS job_count
                """ + FILTERED_JOBS + where + """
                GROUP BY c.id, c.display_name
                ORDER BY job_count DESC, c.display_name ASC
                LIMIT :limit
                """,
            params,
            COMPANY_COUNT_MAPPER
        );

        return new JobAnalytics(
            totals.totalJobs(),
            totals.evergreenJobs(),
            totals.repostedJobs(),
            totals.remoteJobs(),
            companies,
            distribution("COALESCE(tj.job_type, 'unspecified')", where, params),
            distribution("tj.job_category", where, params),
            totals.compensation()
        );
    }

    public TrackedJobView findView(String jobFingerprint) {
        List<TrackedJobView> rows = jdbc.query(
            VIEW_SELECT + """
                WHERE tj.job_fingerprint = :fingerprint
                """,
            new MapSqlParameterSource("fingerprint", jobFingerprint),
            VIEW_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public Map<String, Long> findIdsByFingerprints(Collection<String> fingerprints) {
        Map<String, Long> ids = new LinkedHashMap<>();
        if (fingerprints == null || fingerprints.isEmpty()) {
            return ids;
        }
        jdbc.query(
            """
                SELECT id, job_fingerprint
                FROM tracked_jobs
                WHERE job_fingerprint IN (:fingerprints)
                """,
            new MapSqlParameterSource("fingerprints", fingerprints),
            rs -> {
                ids.put(rs.getString("job_fingerprint"), rs.getLong("id"));
            }
        );
        return ids;
    }

    /**
     * Shared WHERE clause of the read path over the {@code tj}, {@code c} and {@code l}
     * aliases. Adds its parameters to {@code params}.
     */
    private static String filterClause(TrackedJobFilter filter, MapSqlParameterSource params) {
        TrackedJobFilter effective = filter == null ? TrackedJobFilter.none() : filter;
        params
            .addValue("companyId", effective.companyId(), Types.BIGINT)
            .addValue("company", effective.company(), Types.VARCHAR)
            .addValue("locationId", effective.locationId(), Types.BIGINT)
            .addValue("country", effective.country(), Types.VARCHAR)
            .addValue("evergreen", effective.evergreen(), Types.BOOLEAN)
            .addValue("minRepostCount", effective.minRepostCount(), Types.INTEGER)
            .addValue("remote", effective.remote(), Types.BOOLEAN)
            .addValue("jobType", effective.jobType(), Types.VARCHAR)
            .addValue("category", effective.category(), Types.VARCHAR);

        StringBuilder where = new StringBuilder("""
            WHERE (:companyId IS NULL OR tj.canonical_company_id = :companyId)
              AND (:company IS NULL OR c.normalized_name = :company)
              AND (:locationId IS NULL OR tj.canonical_location_id = :locationId)
              AND (:country IS NULL OR l.country = :country)
              AND (:evergreen IS NULL OR tj.is_evergreen = :evergreen)
              AND (:minRepostCount IS NULL OR tj.repost_count >= :minRepostCount)
              AND (:remote IS NULL OR tj.is_remote = :remote)
              AND (:jobType IS NULL OR tj.job_type = :jobType)
              AND (:category IS NULL OR tj.job_category = :category)
            """);
        if (effective.seenFrom() != null) {
            where.append("  AND tj.last_seen_at >= :seenFrom\n");
            params.addValue("seenFrom", toTimestamp(effective.seenFrom()));
        }
        if (effective.seenTo() != null) {
            where.append("  AND tj.first_seen_at <= :seenTo\n");
            params.addValue("seenTo", toTimestamp(effective.seenTo()));
        }
        return where.toString();
    }

    private Map<String, Long> distribution(String bucketExpression, String where, MapSqlParameterSource params) {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            "SELECT " + bucketExpression + " AS bucket, COUNT(*) AS job_count\n"
                + FILTERED_JOBS
                + where
                + "GROUP BY " + bucketExpression + "\n"
                + "ORDER BY job_count DESC, bucket ASC\n",
            params,
            rs -> {
                counts.put(rs.getString("bucket"), rs.getLong("job_count"));
            }
        );
        return counts;
    }

    private MapSqlParameterSource jobParams(TrackedJob job) {
        return new MapSqlParameterSource()
            .addValue("fingerprint", job.jobFingerprint())
            .addValue("companyId", job.canonicalCompanyId())
            .addValue("locationId", job.canonicalLocationId())
            .addValue("normalizedTitle", job.normalizedTitle())
            .addValue("displayTitle", job.displayTitle())
            .addValue("experienceLevel", job.experienceLevel())
            .addValue("jobCategory", job.jobCategory())
            .addValue("jobType", job.jobType(), Types.VARCHAR)
            .addValue("remote", job.remote())
            .addValue("descriptionFingerprint", job.descriptionFingerprint(), Types.VARCHAR)
            .addValue("compensationBucket", job.compensationBucket())
            .addValue("compensationMin", job.compensationMin(), Types.BIGINT)
            .addValue("compensationMax", job.compensationMax(), Types.BIGINT)
            .addValue("firstSeenAt", toTimestamp(job.firstSeenAt()))
            .addValue("lastSeenAt", toTimestamp(job.lastSeenAt()))
            .addValue("repostCount", job.repostCount())
            .addValue("evergreen", job.evergreen())
            .addValue("evergreenScore", job.evergreenScore())
            .addValue("totalSeenCount", job.totalSeenCount());
    }

    private long countTable(String table) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0L : count;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
