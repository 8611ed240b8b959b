package com.jobtrail.dedup.tracking.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobtrail.dedup.config.TrackingProperties;
import com.jobtrail.dedup.tracking.model.JobAnalytics;
import com.jobtrail.dedup.tracking.model.JobSource;
import com.jobtrail.dedup.tracking.model.PageCursor;
import com.jobtrail.dedup.tracking.model.StatusResponse;
import com.jobtrail.dedup.tracking.model.TrackedJob;
import com.jobtrail.dedup.tracking.model.TrackedJobFilter;
import com.jobtrail.dedup.tracking.model.TrackedJobPage;
import com.jobtrail.dedup.tracking.model.TrackedJobView;
import com.jobtrail.dedup.tracking.persistence.IngestionRunRepository;
import com.jobtrail.dedup.tracking.persistence.TrackingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Read path over tracked jobs. Pages are keyset-paginated on
 * {@code (last_seen_at DESC, job_fingerprint ASC)}, so rows inserted or advanced during a
 * traversal never cause an already-returned row to repeat.
 */
@Service
public class TrackedJobQueryService {
    private static final Logger log = LoggerFactory.getLogger(TrackedJobQueryService.class);
    static final int DEFAULT_TOP_COMPANIES = 10;

    private final TrackingJdbcRepository repository;
    private final IngestionRunRepository runRepository;
    private final TrackingProperties properties;
    private final ObjectMapper objectMapper;

    public TrackedJobQueryService(
        TrackingJdbcRepository repository,
        IngestionRunRepository runRepository,
        TrackingProperties properties,
        ObjectMapper objectMapper
    ) {
        this.repository = repository;
        this.runRepository = runRepository;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public TrackedJobPage query(TrackedJobFilter filter, String cursor, Integer limit) {
        int pageSize = resolvePageSize(limit);
        PageCursor after = decodeCursor(cursor);
        List<TrackedJobView> rows = repository.findPage(filter, after, pageSize + 1);
        boolean hasMore = rows.size() > pageSize;
        List<TrackedJobView> page = hasMore ? rows.subList(0, pageSize) : rows;

        List<TrackedJobView> items = attachSources(page);
        String nextCursor = null;
        if (hasMore) {
            TrackedJobView last = items.get(items.size() - 1);
            nextCursor = encodeCursor(new PageCursor(last.lastSeenAt(), last.jobFingerprint()));
        }
        return new TrackedJobPage(items, pageSize, nextCursor);
    }

    public TrackedJobView findByFingerprint(String jobFingerprint) {
        if (jobFingerprint == null || jobFingerprint.isBlank()) {
            return null;
        }
        TrackedJob job = repository.findByFingerprint(jobFingerprint.trim());
        if (job == null) {
            return null;
        }
        TrackedJobView view = repository.findView(job.jobFingerprint());
        if (view == null) {
            return null;
        }
        return withSources(view, job.sources());
    }

    /**
     * Aggregates over the jobs matching {@code filter}; {@code topCompanies} defaults to
     * {@value #DEFAULT_TOP_COMPANIES} and is capped at the maximum page size.
     */
    public JobAnalytics analytics(TrackedJobFilter filter, Integer topCompanies) {
        int top = topCompanies == null || topCompanies <= 0
            ? DEFAULT_TOP_COMPANIES
            : Math.min(topCompanies, properties.getQuery().getMaxPageSize());
        return repository.findAnalytics(filter, top);
    }

    public StatusResponse status() {
        boolean reachable;
        Map<String, Long> counts = Map.of();
        try {
            reachable = repository.isDbReachable();
            counts = repository.tableCounts();
        } catch (Exception e) {
            log.warn("Tracking store health check failed", e);
            reachable = false;
        }
        return new StatusResponse(reachable, counts, reachable ? runRepository.findLatestRun() : null);
    }

    int resolvePageSize(Integer limit) {
        int max = properties.getQuery().getMaxPageSize();
        if (limit == null || limit <= 0) {
            return properties.getQuery().getDefaultPageSize();
        }
        return Math.min(limit, max);
    }

    String encodeCursor(PageCursor cursor) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(cursor);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode page cursor", e);
        }
    }

    /**
     * @throws InvalidCursorException when the cursor was not produced by {@link #encodeCursor}
     */
    PageCursor decodeCursor(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return null;
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(cursor.trim());
            PageCursor decoded = objectMapper.readValue(new String(json, StandardCharsets.UTF_8), PageCursor.class);
            if (decoded == null || decoded.lastSeenAt() == null || decoded.jobFingerprint() == null) {
                throw new InvalidCursorException("Cursor is missing its sort key");
            }
            return decoded;
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new InvalidCursorException("Malformed cursor");
        }
    }

    private List<TrackedJobView> attachSources(List<TrackedJobView> page) {
        if (page.isEmpty()) {
            return List.of();
        }
        List<String> fingerprints = new ArrayList<>(page.size());
        for (TrackedJobView view : page) {
            fingerprints.add(view.jobFingerprint());
        }
        Map<String, Long> ids = repository.findIdsByFingerprints(fingerprints);
        Map<Long, List<JobSource>> sources = repository.findSourcesByJobIds(ids.values());
        List<TrackedJobView> items = new ArrayList<>(page.size());
        for (TrackedJobView view : page) {
            Long id = ids.get(view.jobFingerprint());
            items.add(withSources(view, id == null ? List.of() : sources.getOrDefault(id, List.of())));
        }
        return items;
    }

    private static TrackedJobView withSources(TrackedJobView view, List<JobSource> sources) {
        return new TrackedJobView(
            view.jobFingerprint(),
            view.title(),
            view.displayTitle(),
            view.companyId(),
            view.companyName(),
            view.companyDomain(),
            view.locationId(),
            view.city(),
            view.region(),
            view.country(),
            view.remote(),
            view.experienceLevel(),
            view.jobCategory(),
            view.jobType(),
            view.compensationBucket(),
            view.firstSeenAt(),
            view.lastSeenAt(),
            view.daysActive(),
            view.repostCount(),
            view.evergreen(),
            view.evergreenScore(),
            view.totalSeenCount(),
            view.sitesPostedCount(),
            List.copyOf(sources)
        );
    }
}
