package com.jobtrail.dedup.tracking.service;

import com.jobtrail.dedup.tracking.model.CompanyResolution;
import com.jobtrail.dedup.tracking.model.MergeOutcome;
import com.jobtrail.dedup.tracking.model.RawJobRecord;
import com.jobtrail.dedup.tracking.model.ScrapeRunContext;
import com.jobtrail.dedup.tracking.model.TrackedJob;
import com.jobtrail.dedup.tracking.model.TrackedJobFilter;
import com.jobtrail.dedup.tracking.model.TrackedJobView;
import com.jobtrail.dedup.tracking.normalize.JobNormalizer;
import com.jobtrail.dedup.tracking.persistence.TrackingJdbcRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Runs without a test transaction: every worker commits for real, so names are unique per run.
 */
@SpringBootTest
@ActiveProfiles("test")
class ConcurrentIngestionTest {
    private static final int WORKERS = 8;
    private static final Instant T0 = Instant.parse("2026-05-01T12:00:00Z");

    @Autowired
    private TrackingMergeService mergeService;

    @Autowired
    private EntityResolverService resolver;

    @Autowired
    private IngestionBatchService batchService;

    @Autowired
    private TrackedJobQueryService queryService;

    @Autowired
    private TrackingJdbcRepository repository;

    private ExecutorService pool;
    private String suffix;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(WORKERS);
        suffix = UUID.randomUUID().toString().substring(0, 6);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void concurrentObservationsOfOneJobCreateExactlyOnce() throws Exception {
        String company = "Race Co " + suffix;
        List<Callable<MergeOutcome>> tasks = new ArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < WORKERS; i++) {
            RawJobRecord record = new RawJobRecord(
                "platform-" + i,
                null,
                "Site Reliability Engineer",
                company,
                null,
                null,
                "Denver, CO",
                null,
                null,
                null,
                "ext-" + i,
                null,
                T0,
                null
            );
            tasks.add(() -> {
                start.await();
                return mergeService.ingest(record, new ScrapeRunContext("race-" + suffix, null, T0));
            });
        }

        List<Future<MergeOutcome>> futures = new ArrayList<>();
        for (Callable<MergeOutcome> task : tasks) {
            futures.add(pool.submit(task));
        }
        start.countDown();

        int created = 0;
        int merged = 0;
        String fingerprint = null;
        for (Future<MergeOutcome> future : futures) {
            MergeOutcome outcome = future.get(30, TimeUnit.SECONDS);
            if (outcome.type() == MergeOutcome.Type.CREATED) {
                created++;
            } else if (outcome.type() == MergeOutcome.Type.MERGED) {
                merged++;
            }
            if (fingerprint == null) {
                fingerprint = outcome.jobFingerprint();
            }
            assertEquals(fingerprint, outcome.jobFingerprint());
        }

        assertEquals(1, created);
        assertEquals(WORKERS - 1, merged);
        TrackedJob job = repository.findByFingerprint(fingerprint);
        assertEquals(WORKERS, job.totalSeenCount());
        assertEquals(WORKERS, job.sources().size());
        assertEquals(1, job.evergreenScore());
    }

    @Test
    void concurrentResolutionOfNewCompanyHasOneWinner() throws Exception {
        String name = "race resolver " + suffix;
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CompanyResolution>> futures = new ArrayList<>();
        for (int i = 0; i < WORKERS; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return resolver.resolveCompany(name, "race.example");
            }));
        }
        start.countDown();

        long createdCount = 0;
        Long id = null;
        for (Future<CompanyResolution> future : futures) {
            CompanyResolution resolution = future.get(30, TimeUnit.SECONDS);
            if (resolution.confidence() == CompanyResolution.Confidence.CREATED) {
                createdCount++;
            }
            if (id == null) {
                id = resolution.company().id();
            }
            assertEquals(id.longValue(), resolution.company().id());
        }
        assertEquals(1, createdCount);
    }

    @Test
    void overlappingBatchesFromDifferentRunsConverge() throws Exception {
        String company = "Overlap Co " + suffix;
        List<String> titles = List.of("Data Analyst", "Product Manager", "Backend Engineer", "Graphic Designer", "Sales Associate");
        List<RawJobRecord> fromIndeed = new ArrayList<>();
        List<RawJobRecord> fromLinkedin = new ArrayList<>();
        for (int i = 0; i < titles.size(); i++) {
            fromIndeed.add(record(titles.get(i), company, "indeed", "in-" + i));
            fromLinkedin.add(record(titles.get(i), company, "linkedin", "li-" + i));
        }

        batchService.submitAsync("overlap-a-" + suffix, "indeed", fromIndeed);
        batchService.submitAsync("overlap-b-" + suffix, "linkedin", fromLinkedin);
        awaitIdle("overlap-a-" + suffix);
        awaitIdle("overlap-b-" + suffix);

        TrackedJobFilter filter = new TrackedJobFilter(
            null, JobNormalizer.normalizeCompanyName(company), null, null, null, null, null, null, null, null, null
        );
        List<TrackedJobView> jobs = queryService.query(filter, null, 50).items();
        assertEquals(titles.size(), jobs.size());
        for (TrackedJobView job : jobs) {
            assertEquals(2, job.totalSeenCount());
            assertEquals(2, job.sources().size());
        }
        assertEquals(IngestionBatchService.STATUS_COMPLETED, batchService.findRun("overlap-a-" + suffix).status());
        assertEquals(IngestionBatchService.STATUS_COMPLETED, batchService.findRun("overlap-b-" + suffix).status());
    }

    private void awaitIdle(String runId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 30_000;
        while (batchService.isActive(runId) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(batchService.isActive(runId), "run " + runId + " still active");
    }

    private static RawJobRecord record(String title, String company, String platform, String externalId) {
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
            null,
            T0,
            null
        );
    }
}
