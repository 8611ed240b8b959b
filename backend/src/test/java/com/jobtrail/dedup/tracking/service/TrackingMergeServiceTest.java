package com.jobtrail.dedup.tracking.service;

import com.jobtrail.dedup.tracking.model.Compensation;
import com.jobtrail.dedup.tracking.model.JobSource;
import com.jobtrail.dedup.tracking.model.MatchType;
import com.jobtrail.dedup.tracking.model.MergeOutcome;
import com.jobtrail.dedup.tracking.model.RawJobRecord;
import com.jobtrail.dedup.tracking.model.ScrapeRunContext;
import com.jobtrail.dedup.tracking.model.TrackedJob;
import com.jobtrail.dedup.tracking.persistence.TrackingJdbcRepository;
import com.jobtrail.dedup.tracking.util.RejectionReasons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class TrackingMergeServiceTest {
    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");
    private static final Duration WINDOW = Duration.ofHours(24);

    @Autowired
    private TrackingMergeService mergeService;

    @Autowired
    private TrackingJdbcRepository repository;

    private String company;

    @BeforeEach
    void setUp() {
        company = "Merge Co " + UUID.randomUUID().toString().substring(0, 6);
    }

    @Test
    void firstObservationCreatesJobWithFreshCounters() {
        MergeOutcome outcome = ingest(record("Data Analyst", "indeed", "in-1", T0), "run-a");

        assertEquals(MergeOutcome.Type.CREATED, outcome.type());
        TrackedJob job = repository.findByFingerprint(outcome.jobFingerprint());
        assertEquals(T0, job.firstSeenAt());
        assertEquals(T0, job.lastSeenAt());
        assertEquals(0, job.repostCount());
        assertEquals(1, job.evergreenScore());
        assertFalse(job.evergreen());
        assertEquals(1, job.sources().size());
    }

    @Test
    void observationJustInsideWindowIsContinuousPresence() {
        String fingerprint = ingest(record("Data Analyst", "indeed", "in-1", T0), "run-a").jobFingerprint();
        Instant next = T0.plus(WINDOW).minusSeconds(1);

        MergeOutcome outcome = ingest(record("Data Analyst", "indeed", "in-1", next), "run-b");

        assertEquals(MergeOutcome.Type.MERGED, outcome.type());
        assertEquals(MatchType.EXACT, outcome.matchType());
        TrackedJob job = repository.findByFingerprint(fingerprint);
        assertEquals(0, job.repostCount());
        assertEquals(2, job.evergreenScore());
        assertEquals(next, job.lastSeenAt());
        assertEquals(T0, job.firstSeenAt());
    }

    @Test
    void gapEqualToWindowStillCountsAsPresence() {
        String fingerprint = ingest(record("Data Analyst", "indeed", "in-1", T0), "run-a").jobFingerprint();

        ingest(record("Data Analyst", "indeed", "in-1", T0.plus(WINDOW)), "run-b");

        TrackedJob job = repository.findByFingerprint(fingerprint);
        assertEquals(0, job.repostCount());
        assertEquals(2, job.evergreenScore());
    }

    @Test
    void observationJustOutsideWindowIsARepost() {
        String fingerprint = ingest(record("Data Analyst", "indeed", "in-1", T0), "run-a").jobFingerprint();
        ingest(record("Data Analyst", "indeed", "in-1", T0.plusSeconds(3600)), "run-b");
        Instant lapse = T0.plusSeconds(3600).plus(WINDOW).plusSeconds(1);

        ingest(record("Data Analyst", "indeed", "in-1", lapse), "run-c");

        TrackedJob job = repository.findByFingerprint(fingerprint);
        assertEquals(1, job.repostCount());
        assertEquals(1, job.evergreenScore());
        assertFalse(job.evergreen());
        assertEquals(lapse, job.lastSeenAt());
        assertEquals(3, job.totalSeenCount());
    }

    @Test
    void evergreenAfterThresholdConsecutiveCyclesAndResetByLapse() {
        String fingerprint = null;
        for (int cycle = 0; cycle < 6; cycle++) {
            MergeOutcome outcome = ingest(record("Nurse Practitioner", "indeed", "in-9", T0.plusSeconds(cycle * 3600L)), "cycle-" + cycle);
            fingerprint = outcome.jobFingerprint();
        }
        TrackedJob beforeThreshold = repository.findByFingerprint(fingerprint);
        assertEquals(6, beforeThreshold.evergreenScore());
        assertFalse(beforeThreshold.evergreen());

        ingest(record("Nurse Practitioner", "indeed", "in-9", T0.plusSeconds(6 * 3600L)), "cycle-6");
        TrackedJob evergreen = repository.findByFingerprint(fingerprint);
        assertEquals(7, evergreen.evergreenScore());
        assertTrue(evergreen.evergreen());

        ingest(record("Nurse Practitioner", "indeed", "in-9", T0.plus(Duration.ofDays(5))), "cycle-7");
        TrackedJob lapsed = repository.findByFingerprint(fingerprint);
        assertFalse(lapsed.evergreen());
        assertEquals(1, lapsed.evergreenScore());
        assertEquals(1, lapsed.repostCount());
    }

    @Test
    void sameRecordTwiceInOneRunYieldsOneJobWithTwoMergeEvents() {
        RawJobRecord record = record("Account Executive", "indeed", "in-2", T0);

        MergeOutcome first = ingest(record, "run-a");
        MergeOutcome second = ingest(record, "run-a");

        assertEquals(MergeOutcome.Type.CREATED, first.type());
        assertEquals(MergeOutcome.Type.MERGED, second.type());
        assertEquals(first.jobFingerprint(), second.jobFingerprint());
        assertEquals(first.trackedJobId(), second.trackedJobId());
        TrackedJob job = repository.findByFingerprint(first.jobFingerprint());
        assertEquals(2, job.totalSeenCount());
        assertEquals(1, job.evergreenScore());
        assertEquals(0, job.repostCount());
    }

    @Test
    void sameJobOnTwoPlatformsAggregatesSources() {
        MergeOutcome indeed = ingest(record("Graphic Designer", "indeed", "in-3", T0), "run-a");
        MergeOutcome linkedin = ingest(record("Graphic Designer", "linkedin", "li-3", T0.plusSeconds(600)), "run-a");

        assertEquals(indeed.jobFingerprint(), linkedin.jobFingerprint());
        TrackedJob job = repository.findByFingerprint(indeed.jobFingerprint());
        List<String> platforms = job.sources().stream().map(JobSource::platform).collect(Collectors.toList());
        assertEquals(List.of("indeed", "linkedin"), platforms);
        assertEquals(T0.plusSeconds(600), job.lastSeenAt());
    }

    @Test
    void seniorityVariantMergesIntoExistingIdentity() {
        MergeOutcome senior = ingest(record("Senior Software Engineer", "indeed", "in-4", T0), "run-a");
        MergeOutcome suffixed = ingest(record("Software Engineer Sr", "linkedin", "li-4", T0.plusSeconds(60)), "run-a");

        assertEquals(MergeOutcome.Type.MERGED, suffixed.type());
        assertEquals(MatchType.FUZZY, suffixed.matchType());
        assertEquals(senior.jobFingerprint(), suffixed.jobFingerprint());
        TrackedJob job = repository.findByFingerprint(senior.jobFingerprint());
        assertEquals("senior software engineer", job.normalizedTitle());
        assertEquals("Software Engineer Sr", job.displayTitle());
        assertEquals("senior", job.experienceLevel());
    }

    @Test
    void identicalTitleAtAnotherCompanyNeverMerges() {
        MergeOutcome here = ingest(record("Senior Software Engineer", "indeed", "in-5", T0), "run-a");
        RawJobRecord elsewhere = new RawJobRecord(
            "indeed", null, "Senior Software Engineer", company + " Rival", null, null, "Remote",
            null, null, null, "in-6", null, T0, null
        );

        MergeOutcome there = ingest(elsewhere, "run-a");

        assertEquals(MergeOutcome.Type.CREATED, there.type());
        assertNotEquals(here.jobFingerprint(), there.jobFingerprint());
    }

    @Test
    void payChangeAtSameEmployerMergesIntoOriginalIdentity() {
        MergeOutcome low = ingest(withSalary(record("Data Analyst", "indeed", "in-7", T0), "60000"), "run-a");
        MergeOutcome high = ingest(withSalary(record("Data Analyst", "indeed", "in-7", T0.plusSeconds(60)), "90000"), "run-b");

        assertEquals(MatchType.FUZZY, high.matchType());
        assertEquals(low.jobFingerprint(), high.jobFingerprint());
        TrackedJob job = repository.findByFingerprint(low.jobFingerprint());
        assertEquals("usd:60000-open", job.compensationBucket());
        assertEquals(90000L, job.compensationMin());
    }

    @Test
    void olderObservationNeverMovesLastSeenBackwards() {
        Instant later = T0.plusSeconds(7200);
        String fingerprint = ingest(record("Warehouse Supervisor", "indeed", "in-10", later), "run-a").jobFingerprint();

        ingest(record("WAREHOUSE  SUPERVISOR", "linkedin", "li-10", T0), "run-b");

        TrackedJob job = repository.findByFingerprint(fingerprint);
        assertEquals(later, job.lastSeenAt());
        assertEquals(T0, job.firstSeenAt());
        assertEquals("Warehouse Supervisor", job.displayTitle());
        assertEquals(1, job.evergreenScore());
        assertEquals(0, job.repostCount());
        assertEquals(2, job.totalSeenCount());
        assertEquals(2, job.sources().size());
    }

    @Test
    void laterSightingInAnAlreadyCountedRunDoesNotCountAgain() {
        String fingerprint = ingest(record("Line Cook", "indeed", "in-12", T0), "run-a").jobFingerprint();
        ingest(record("Line Cook", "indeed", "in-12", T0.plusSeconds(3600)), "run-b");

        ingest(record("Line Cook", "linkedin", "li-12", T0.plusSeconds(7200)), "run-b");

        TrackedJob job = repository.findByFingerprint(fingerprint);
        assertEquals(2, job.evergreenScore());
        assertEquals(T0.plusSeconds(7200), job.lastSeenAt());
        assertEquals(3, job.totalSeenCount());
    }

    @Test
    void storesJobTypeRemoteFlagAndCategory() {
        RawJobRecord onsite = new RawJobRecord(
            "indeed", null, "Graphic Designer", company, null, null, "Austin, TX",
            null, null, null, "in-13", null, T0, "Full-Time"
        );
        String fingerprint = ingest(onsite, "run-a").jobFingerprint();

        TrackedJob created = repository.findByFingerprint(fingerprint);
        assertEquals("full_time", created.jobType());
        assertFalse(created.remote());
        assertEquals("Design", created.jobCategory());

        RawJobRecord contract = new RawJobRecord(
            "linkedin", null, "Graphic Designer (Remote)", company, null, null, "Austin, TX",
            null, null, null, "li-13", null, T0.plusSeconds(60), "contract"
        );
        ingest(contract, "run-b");

        TrackedJob merged = repository.findByFingerprint(fingerprint);
        assertEquals("contract", merged.jobType());
        assertTrue(merged.remote());
        assertEquals("Design", merged.jobCategory());
    }

    @Test
    void missingTitleIsRejectedWithReason() {
        MergeOutcome outcome = ingest(record(null, "indeed", "in-11", T0), "run-a");

        assertTrue(outcome.isRejected());
        assertEquals(RejectionReasons.MISSING_TITLE, outcome.reason());
    }

    @Test
    void recordWithoutPlatformUsesBatchPlatform() {
        MergeOutcome outcome = mergeService.ingest(
            record("Sales Associate", null, "gd-1", T0),
            new ScrapeRunContext("run-a", "glassdoor", T0)
        );

        TrackedJob job = repository.findByFingerprint(outcome.jobFingerprint());
        assertEquals("glassdoor", job.sources().get(0).platform());
    }

    private MergeOutcome ingest(RawJobRecord record, String runId) {
        return mergeService.ingest(record, new ScrapeRunContext(runId, "indeed", T0));
    }

    private RawJobRecord record(String title, String platform, String externalId, Instant observedAt) {
        return new RawJobRecord(
            platform,
            null,
            title,
            company,
            null,
            null,
            "Remote",
            null,
            null,
            null,
            externalId,
            "https://jobs.example/" + externalId,
            observedAt,
            null
        );
    }

    private static RawJobRecord withSalary(RawJobRecord record, String annual) {
        return new RawJobRecord(
            record.sourcePlatform(),
            record.scrapeRunId(),
            record.title(),
            record.companyName(),
            record.companyDomain(),
            record.companySize(),
            record.location(),
            record.description(),
            record.postedDate(),
            new Compensation(new BigDecimal(annual), null, "USD", "year"),
            record.externalId(),
            record.postingUrl(),
            record.observedAt(),
            record.jobType()
        );
    }
}
