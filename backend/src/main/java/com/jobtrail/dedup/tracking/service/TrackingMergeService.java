package com.jobtrail.dedup.tracking.service;

import com.jobtrail.dedup.config.TrackingProperties;
import com.jobtrail.dedup.tracking.fingerprint.JobFingerprinter;
import com.jobtrail.dedup.tracking.model.CanonicalLocation;
import com.jobtrail.dedup.tracking.model.CompanyResolution;
import com.jobtrail.dedup.tracking.model.Fingerprint;
import com.jobtrail.dedup.tracking.model.MatchCandidate;
import com.jobtrail.dedup.tracking.model.MergeOutcome;
import com.jobtrail.dedup.tracking.model.NormalizedJobView;
import com.jobtrail.dedup.tracking.model.RawJobRecord;
import com.jobtrail.dedup.tracking.model.ScrapeRunContext;
import com.jobtrail.dedup.tracking.model.TrackedJob;
import com.jobtrail.dedup.tracking.normalize.JobNormalizer;
import com.jobtrail.dedup.tracking.normalize.NormalizationException;
import com.jobtrail.dedup.tracking.normalize.TitleNormalizer;
import com.jobtrail.dedup.tracking.persistence.TrackingJdbcRepository;
import com.jobtrail.dedup.tracking.util.RejectionReasons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single write path for tracked jobs. Each observation is normalized, its company and
 * location resolved, and then matched and created-or-merged while holding the lock of its
 * (company, location) match scope inside one transaction.
 */
@Service
public class TrackingMergeService {
    private static final Logger log = LoggerFactory.getLogger(TrackingMergeService.class);

    private final JobNormalizer normalizer;
    private final JobFingerprinter fingerprinter;
    private final EntityResolverService entityResolver;
    private final DuplicateMatcherService matcher;
    private final TrackingJdbcRepository repository;
    private final IdentityLockRegistry locks;
    private final TransactionTemplate transactionTemplate;
    private final TrackingProperties properties;
    private final Clock clock;

    public TrackingMergeService(
        JobNormalizer normalizer,
        JobFingerprinter fingerprinter,
        EntityResolverService entityResolver,
        DuplicateMatcherService matcher,
        TrackingJdbcRepository repository,
        IdentityLockRegistry locks,
        TransactionTemplate transactionTemplate,
        TrackingProperties properties,
        Clock clock
    ) {
        this.normalizer = normalizer;
        this.fingerprinter = fingerprinter;
        this.entityResolver = entityResolver;
        this.matcher = matcher;
        this.repository = repository;
        this.locks = locks;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws StorageUnavailableException when the database cannot be reached; every other
     *     failure is reported as a rejected outcome
     */
    public MergeOutcome ingest(RawJobRecord record, ScrapeRunContext context) {
        RawJobRecord effective = record;
        if (record != null && isBlank(record.sourcePlatform()) && context != null && !isBlank(context.sourcePlatform())) {
            effective = record.withSourcePlatform(context.sourcePlatform());
        }

        NormalizedJobView view;
        try {
            view = normalizer.normalize(effective, context == null ? clock.instant() : context.ingestedAt());
        } catch (NormalizationException e) {
            return MergeOutcome.rejected(RejectionReasons.fromException(e), e.getMessage());
        }
        String scrapeRunId = context == null ? null : context.scrapeRunId();

        int maxAttempts = properties.getLock().getMaxAttempts();
        RuntimeException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return attemptIngest(view, scrapeRunId);
            } catch (ResolutionConflictException | DataIntegrityViolationException | ConcurrencyFailureException e) {
                lastConflict = e;
                log.debug("Conflict ingesting '{}' (attempt {}/{}): {}",
                    view.normalizedTitle(), attempt, maxAttempts, e.getMessage());
            } catch (DataAccessResourceFailureException
                     | TransientDataAccessResourceException
                     | CannotCreateTransactionException e) {
                throw new StorageUnavailableException("Tracking store unavailable", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return MergeOutcome.rejected(RejectionReasons.CANCELLED, "interrupted while waiting for lock");
            }
            if (attempt < maxAttempts && !backoff(attempt)) {
                return MergeOutcome.rejected(RejectionReasons.CANCELLED, "interrupted during conflict backoff");
            }
        }
        String detail = lastConflict == null ? "conflict" : lastConflict.getMessage();
        log.warn("Rejecting '{}' at {} after {} conflicting attempts: {}",
            view.normalizedTitle(), view.companyName(), maxAttempts, detail);
        return MergeOutcome.rejected(RejectionReasons.CONFLICT, detail);
    }

    private MergeOutcome attemptIngest(NormalizedJobView view, String scrapeRunId) throws InterruptedException {
        CompanyResolution company = entityResolver.resolveCompany(view);
        CanonicalLocation location = entityResolver.resolveLocation(view.location());
        long companyId = company.company().id();
        long locationId = location.id();
        Fingerprint fingerprint = fingerprinter.fingerprint(view, companyId, locationId);
        String descriptionFingerprint = fingerprinter.descriptionFingerprint(view);

        String scopeKey = fingerprinter.matchScopeKey(companyId, locationId);
        ReentrantLock lock = locks.tryAcquire(scopeKey, properties.getLock().getWaitMillis());
        if (lock == null) {
            throw new ResolutionConflictException("Timed out waiting for match scope " + scopeKey);
        }
        try {
            return transactionTemplate.execute(status -> createOrMerge(
                view,
                fingerprint,
                descriptionFingerprint,
                companyId,
                locationId,
                scrapeRunId
            ));
        } finally {
            lock.unlock();
        }
    }

    private MergeOutcome createOrMerge(
        NormalizedJobView view,
        Fingerprint fingerprint,
        String descriptionFingerprint,
        long companyId,
        long locationId,
        String scrapeRunId
    ) {
        Optional<MatchCandidate> candidate = matcher.findCandidate(
            fingerprint,
            descriptionFingerprint,
            view,
            companyId,
            locationId
        );
        Instant now = clock.instant();
        if (candidate.isEmpty()) {
            TrackedJob draft = newJob(view, fingerprint, descriptionFingerprint, companyId, locationId);
            long id = repository.insertTrackedJob(draft, now);
            repository.upsertSource(id, view.sourcePlatform(), view.externalId(), view.postingUrl(), view.observedAt());
            if (scrapeRunId != null) {
                repository.recordCycle(id, scrapeRunId, now);
            }
            TrackedJob created = withId(draft, id);
            log.debug("Created tracked job {} for '{}'", created.jobFingerprint(), view.normalizedTitle());
            return MergeOutcome.created(created);
        }

        MatchCandidate match = candidate.get();
        TrackedJob job = match.job();
        // a scrape run moves the counters at most once, and only with a strictly newer sighting
        boolean countCycle = view.observedAt().isAfter(job.lastSeenAt())
            && (scrapeRunId == null || repository.recordCycle(job.id(), scrapeRunId, now));
        TrackedJob merged = advance(
            job,
            view,
            descriptionFingerprint,
            countCycle,
            properties.getFreshnessWindow(),
            properties.getEvergreenThreshold()
        );
        repository.updateTrackedJob(merged, now);
        repository.upsertSource(merged.id(), view.sourcePlatform(), view.externalId(), view.postingUrl(), view.observedAt());
        log.debug("Merged '{}' into {} ({} score={})",
            view.normalizedTitle(), merged.jobFingerprint(), match.matchType(), match.score());
        return MergeOutcome.merged(merged, match.matchType(), match.score());
    }

    private TrackedJob newJob(
        NormalizedJobView view,
        Fingerprint fingerprint,
        String descriptionFingerprint,
        long companyId,
        long locationId
    ) {
        return new TrackedJob(
            0L,
            fingerprint.value(),
            companyId,
            locationId,
            view.normalizedTitle(),
            view.displayTitle(),
            TitleNormalizer.experienceLevel(view.title()),
            TitleNormalizer.category(view.title()),
            view.jobType(),
            view.remote(),
            descriptionFingerprint,
            view.compensation().key(),
            view.compensation().annualMin(),
            view.compensation().annualMax(),
            view.observedAt(),
            view.observedAt(),
            0,
            false,
            1,
            1,
            0L,
            List.of()
        );
    }

    /**
     * Applies one matching observation to the temporal state of {@code job}. When
     * {@code countCycle} is set, repost and evergreen counters move from a single gap
     * computation; the seen range only widens and the latest snapshot fields follow the
     * newest observation.
     */
    static TrackedJob advance(
        TrackedJob job,
        NormalizedJobView view,
        String descriptionFingerprint,
        boolean countCycle,
        Duration freshnessWindow,
        int evergreenThreshold
    ) {
        Instant observedAt = view.observedAt();
        boolean newer = !observedAt.isBefore(job.lastSeenAt());

        int repostCount = job.repostCount();
        int evergreenScore = job.evergreenScore();
        boolean evergreen = job.evergreen();
        if (countCycle) {
            Duration gap = Duration.between(job.lastSeenAt(), observedAt);
            if (gap.compareTo(freshnessWindow) <= 0) {
                evergreenScore = evergreenScore + 1;
                evergreen = evergreenScore >= evergreenThreshold;
            } else {
                repostCount = repostCount + 1;
                evergreenScore = 1;
                evergreen = false;
            }
        }

        return new TrackedJob(
            job.id(),
            job.jobFingerprint(),
            job.canonicalCompanyId(),
            job.canonicalLocationId(),
            job.normalizedTitle(),
            newer ? view.displayTitle() : job.displayTitle(),
            newer ? TitleNormalizer.experienceLevel(view.title()) : job.experienceLevel(),
            job.jobCategory(),
            newer && view.jobType() != null ? view.jobType() : job.jobType(),
            newer ? view.remote() : job.remote(),
            newer && descriptionFingerprint != null ? descriptionFingerprint : job.descriptionFingerprint(),
            job.compensationBucket(),
            newer ? view.compensation().annualMin() : job.compensationMin(),
            newer ? view.compensation().annualMax() : job.compensationMax(),
            observedAt.isBefore(job.firstSeenAt()) ? observedAt : job.firstSeenAt(),
            newer ? observedAt : job.lastSeenAt(),
            repostCount,
            evergreen,
            evergreenScore,
            job.totalSeenCount() + 1,
            job.version(),
            job.sources()
        );
    }

    private boolean backoff(int attempt) {
        long base = properties.getLock().getBackoffMillis();
        if (base <= 0) {
            return true;
        }
        long delay = base * (1L << Math.min(attempt - 1, 10));
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static TrackedJob withId(TrackedJob job, long id) {
        return new TrackedJob(
            id,
            job.jobFingerprint(),
            job.canonicalCompanyId(),
            job.canonicalLocationId(),
            job.normalizedTitle(),
            job.displayTitle(),
            job.experienceLevel(),
            job.jobCategory(),
            job.jobType(),
            job.remote(),
            job.descriptionFingerprint(),
            job.compensationBucket(),
            job.compensationMin(),
            job.compensationMax(),
            job.firstSeenAt(),
            job.lastSeenAt(),
            job.repostCount(),
            job.evergreen(),
            job.evergreenScore(),
            job.totalSeenCount(),
            job.version(),
            job.sources()
        );
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
