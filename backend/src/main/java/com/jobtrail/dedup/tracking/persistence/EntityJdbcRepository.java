package com.jobtrail.dedup.tracking.persistence;

import com.jobtrail.dedup.tracking.model.CanonicalCompany;
import com.jobtrail.dedup.tracking.model.CanonicalLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Canonical company and location rows. Inserts never fail on a duplicate identity: the
 * loser of a create race inserts nothing and reads back the winner's row.
 */
@Repository
public class EntityJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(EntityJdbcRepository.class);

    private static final RowMapper<CanonicalCompany> COMPANY_MAPPER = (rs, rowNum) -> new CanonicalCompany(
        rs.getLong("id"),
        rs.getString("normalized_name"),
        rs.getString("domain"),
        rs.getString("display_name"),
        rs.getString("industry"),
        rs.getString("size_bucket"),
        toInstant(rs.getTimestamp("first_seen_at")),
        toInstant(rs.getTimestamp("last_seen_at"))
    );

    private static final RowMapper<CanonicalLocation> LOCATION_MAPPER = (rs, rowNum) -> new CanonicalLocation(
        rs.getLong("id"),
        rs.getString("city"),
        rs.getString("region"),
        rs.getString("country"),
        (Double) rs.getObject("latitude"),
        (Double) rs.getObject("longitude"),
        rs.getString("region_group")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public EntityJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public CanonicalCompany findCompany(String normalizedName, String domain) {
        List<CanonicalCompany> rows = jdbc.query(
            """
                SELECT id, normalized_name, domain, display_name, industry, size_bucket, first_seen_at, last_seen_at
                FROM canonical_companies
                WHERE normalized_name = :name
                  AND domain = :domain
                """,
            new MapSqlParameterSource()
                .addValue("name", normalizedName)
                .addValue("domain", domain == null ? "" : domain),
            COMPANY_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * All identities sharing a normalized name, domainless row first.
     */
    public List<CanonicalCompany> findCompaniesByName(String normalizedName) {
        return jdbc.query(
            """
                SELECT id, normalized_name, domain, display_name, industry, size_bucket, first_seen_at, last_seen_at
                FROM canonical_companies
                WHERE normalized_name = :name
                ORDER BY domain, id
                """,
            new MapSqlParameterSource("name", normalizedName),
            COMPANY_MAPPER
        );
    }

    public CanonicalCompany findCompanyById(long id) {
        List<CanonicalCompany> rows = jdbc.query(
            """
                SELECT id, normalized_name, domain, display_name, industry, size_bucket, first_seen_at, last_seen_at
                FROM canonical_companies
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            COMPANY_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * @return true when this call created the row, false when the identity already existed
     */
    public boolean insertCompanyIfAbsent(
        String normalizedName,
        String domain,
        String displayName,
        String industry,
        String sizeBucket,
        Instant seenAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", normalizedName)
            .addValue("domain", domain == null ? "" : domain)
            .addValue("displayName", displayName)
            .addValue("industry", industry)
            .addValue("sizeBucket", sizeBucket)
            .addValue("seenAt", toTimestamp(seenAt));
        if (postgres) {
            int inserted = jdbc.update(
                """
                    INSERT INTO canonical_companies (
                        normalized_name, domain, display_name, industry, size_bucket, first_seen_at, last_seen_at
                    )
                    VALUES (:name, :domain, :displayName, :industry, :sizeBucket, :seenAt, :seenAt)
                    ON CONFLICT (normalized_name, domain) DO NOTHING
                    """,
                params
            );
            return inserted > 0;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO canonical_companies (
                        normalized_name, domain, display_name, industry, size_bucket, first_seen_at, last_seen_at
                    )
                    VALUES (:name, :domain, :displayName, :industry, :sizeBucket, :seenAt, :seenAt)
                    """,
                params
            );
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Company {} / '{}' created concurrently; reusing existing row", normalizedName, domain);
            return false;
        }
    }

    /**
     * Widens the company's seen range and fills enrichment columns that are still empty.
     */
    public void touchCompany(long id, Instant seenAt, String industry, String sizeBucket) {
        jdbc.update(
            """
                UPDATE canonical_companies
                SET first_seen_at = CASE WHEN first_seen_at > :seenAt THEN :seenAt ELSE first_seen_at END,
                    last_seen_at = CASE WHEN last_seen_at < :seenAt THEN :seenAt ELSE last_seen_at END,
                    industry = COALESCE(industry, :industry),
                    size_bucket = COALESCE(size_bucket, :sizeBucket)
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("seenAt", toTimestamp(seenAt))
                .addValue("industry", industry)
                .addValue("sizeBucket", sizeBucket)
        );
    }

    public CanonicalLocation findLocation(String city, String region, String country) {
        List<CanonicalLocation> rows = jdbc.query(
            """
                SELECT id, city, region, country, latitude, longitude, region_group
                FROM canonical_locations
                WHERE city = :city
                  AND region = :region
                  AND country = :country
                """,
            locationParams(city, region, country, null),
            LOCATION_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public boolean insertLocationIfAbsent(String city, String region, String country, String regionGroup, Instant createdAt) {
        MapSqlParameterSource params = locationParams(city, region, country, regionGroup)
            .addValue("createdAt", toTimestamp(createdAt));
        if (postgres) {
            int inserted = jdbc.update(
                """
                    INSERT INTO canonical_locations (city, region, country, region_group, created_at)
                    VALUES (:city, :region, :country, :regionGroup, :createdAt)
                    ON CONFLICT (city, region, country) DO NOTHING
                    """,
                params
            );
            return inserted > 0;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO canonical_locations (city, region, country, region_group, created_at)
                    VALUES (:city, :region, :country, :regionGroup, :createdAt)
                    """,
                params
            );
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Location {}/{}/{} created concurrently; reusing existing row", city, region, country);
            return false;
        }
    }

    private MapSqlParameterSource locationParams(String city, String region, String country, String regionGroup) {
        return new MapSqlParameterSource()
            .addValue("city", city == null ? "" : city)
            .addValue("region", region == null ? "" : region)
            .addValue("country", country)
            .addValue("regionGroup", regionGroup);
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    static boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable upserts", e);
            return false;
        }
    }
}
