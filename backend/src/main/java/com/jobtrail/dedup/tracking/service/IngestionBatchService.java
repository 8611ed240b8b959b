package com.jobtrail.dedup.tracking.service;

import com.jobtrail.dedup.config.TrackingProperties;
import com.jobtrail.dedup.tracking.model.BatchSummary;
import com.jobtrail.dedup.tracking.model.IngestionRunStatus;
import com.jobtrail.dedup.tracking.model.MergeOutcome;
import com.jobtrail.dedup.tracking.model.RawJobRecord;
import com.jobtrail.dedup.tracking.model.RecordRejection;
import com.jobtrail.dedup.tracking.model.ScrapeRunContext;
import com.jobtrail.dedup.tracking.persistence.IngestionRunRepository;
import com.jobtrail.dedup.tracking.util.RejectionReasons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one scrape batch through the merge engine and reports what happened to every
 * record. A rejected record never stops the batch; an unreachable store stops it and the
 * summary lists the indexes that were never attempted.
 */
@Service
public class IngestionBatchService {
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_REJECTIONS = "COMPLETED_WITH_REJECTIONS";
    public static final String STATUS_TIMED_OUT = "TIMED_OUT";
    public static final String STATUS_CANCELLED = "CANCELLED";
    public static final String STATUS_FAILED = "FAILED";

    private static final Logger log = LoggerFactory.getLogger(IngestionBatchService.class);

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<RawJobRecord> CANONICAL_ORDER = Comparator
        .comparing(RawJobRecord::observedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
        .thenComparing(RawJobRecord::sourcePlatform, NULLS_FIRST)
        .thenComparing(RawJobRecord::externalId, NULLS_FIRST)
        .thenComparing(RawJobRecord::title, NULLS_FIRST)
        .thenComparing(RawJobRecord::companyName, NULLS_FIRST)
        .thenComparing(RawJobRecord::location, NULLS_FIRST);

    private final TrackingMergeService mergeService;
    private final IngestionRunRepository runRepository;
    private final ExecutorService ingestionExecutor;
    private final TrackingProperties properties;
    private final Clock clock;
    private final Map<String, AtomicBoolean> activeRuns = new ConcurrentHashMap<>();

    public IngestionBatchService(
        TrackingMergeService mergeService,
        IngestionRunRepository runRepository,
        @Qualifier("ingestionExecutor") ExecutorService ingestionExecutor,
        TrackingProperties properties,
        Clock clock
    ) {
        this.mergeService = mergeService;
        this.runRepository = runRepository;
        this.ingestionExecutor = ingestionExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public BatchSummary processBatch(String scrapeRunId, String sourcePlatform, List<RawJobRecord> records) {
        AtomicBoolean cancelFlag = register(scrapeRunId);
        try {
            return runBatch(scrapeRunId, sourcePlatform, records, cancelFlag);
        } finally {
            activeRuns.remove(scrapeRunId, cancelFlag);
        }
    }

    /**
     * Queues the batch on the ingestion pool. The run is registered before returning, so a
     * second submission of the same id is refused immediately.
     */
    public String submitAsync(String scrapeRunId, String sourcePlatform, List<RawJobRecord> records) {
        AtomicBoolean cancelFlag = register(scrapeRunId);
        try {
            ingestionExecutor.submit(() -> {
                try {
                    runBatch(scrapeRunId, sourcePlatform, records, cancelFlag);
                } catch (Exception e) {
                    log.warn("Async ingestion of run {} failed", scrapeRunId, e);
                } finally {
                    activeRuns.remove(scrapeRunId, cancelFlag);
                }
            });
        } catch (RuntimeException e) {
            activeRuns.remove(scrapeRunId, cancelFlag);
            throw e;
        }
        return scrapeRunId;
    }

    /**
     * @return false when no batch with this id is running here
     */
    public boolean cancel(String scrapeRunId) {
        AtomicBoolean cancelFlag = scrapeRunId == null ? null : activeRuns.get(scrapeRunId);
        if (cancelFlag == null) {
            return false;
        }
        cancelFlag.set(true);
        log.info("Cancellation requested for ingestion run {}", scrapeRunId);
        return true;
    }

    public boolean isActive(String scrapeRunId) {
        return scrapeRunId != null && activeRuns.containsKey(scrapeRunId);
    }

    public IngestionRunStatus findRun(String scrapeRunId) {
        return runRepository.findRun(scrapeRunId);
    }

    private AtomicBoolean register(String scrapeRunId) {
        if (scrapeRunId == null || scrapeRunId.isBlank()) {
            throw new IllegalArgumentException("scrapeRunId is required");
        }
        AtomicBoolean cancelFlag = new AtomicBoolean(false);
        if (activeRuns.putIfAbsent(scrapeRunId, cancelFlag) != null) {
            throw new ActiveIngestionRunException("Ingestion run " + scrapeRunId + " is already in progress");
        }
        return cancelFlag;
    }

    private BatchSummary runBatch(
        String scrapeRunId,
        String sourcePlatform,
        List<RawJobRecord> records,
        AtomicBoolean cancelFlag
    ) {
        List<RawJobRecord> batch = records == null ? List.of() : records;
        Instant startedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant deadline = startedAt.plusSeconds(properties.getBatch().getTimeoutSeconds());
        ScrapeRunContext context = new ScrapeRunContext(scrapeRunId, sourcePlatform, startedAt);
        log.info("Ingestion run {} started: platform={} records={}", scrapeRunId, sourcePlatform, batch.size());

        int created = 0;
        int merged = 0;
        List<RecordRejection> rejections = new ArrayList<>();
        List<Integer> unprocessed = new ArrayList<>();
        String status = null;
        String lastError = null;

        List<Integer> order = canonicalOrder(batch);
        try {
            runRepository.startRun(scrapeRunId, sourcePlatform, batch.size(), startedAt);
        } catch (DataAccessException e) {
            log.warn("Ingestion run {} failed: tracking store unavailable", scrapeRunId, e);
            status = STATUS_FAILED;
            lastError = "storage_unavailable: " + e.getMessage();
            unprocessed.addAll(order);
        }

        for (int position = 0; status == null && position < order.size(); position++) {
            int index = order.get(position);
            RawJobRecord record = batch.get(index);
            if (cancelFlag.get() || Thread.currentThread().isInterrupted()) {
                status = STATUS_CANCELLED;
                rejectRemaining(batch, order, position, RejectionReasons.CANCELLED, "batch cancelled", rejections);
                break;
            }
            if (clock.instant().isAfter(deadline)) {
                status = STATUS_TIMED_OUT;
                rejectRemaining(batch, order, position, RejectionReasons.TIMEOUT, "batch deadline exceeded", rejections);
                break;
            }

            MergeOutcome outcome;
            try {
                outcome = mergeService.ingest(record, context);
            } catch (StorageUnavailableException e) {
                log.warn("Ingestion run {} failed at record {}: tracking store unavailable", scrapeRunId, index, e);
                status = STATUS_FAILED;
                lastError = "storage_unavailable: " + rootMessage(e);
                unprocessed.addAll(order.subList(position, order.size()));
                break;
            } catch (RuntimeException e) {
                log.warn("Unexpected error ingesting record {} of run {}", index, scrapeRunId, e);
                outcome = MergeOutcome.rejected(RejectionReasons.fromException(e), e.getClass().getSimpleName() + ": " + e.getMessage());
            }

            switch (outcome.type()) {
                case CREATED -> created++;
                case MERGED -> merged++;
                case REJECTED -> {
                    rejections.add(new RecordRejection(index, externalId(record), outcome.reason(), outcome.detail()));
                    log.debug("Record {} of run {} rejected: {} ({})", index, scrapeRunId, outcome.reason(), outcome.detail());
                }
            }
        }

        if (status == null) {
            status = rejections.isEmpty() ? STATUS_COMPLETED : STATUS_COMPLETED_WITH_REJECTIONS;
        }
        rejections.sort(Comparator.comparingInt(RecordRejection::index));
        unprocessed.sort(Comparator.naturalOrder());
        Map<String, Integer> reasons = new TreeMap<>();
        for (RecordRejection rejection : rejections) {
            reasons.merge(rejection.reason(), 1, Integer::sum);
        }

        BatchSummary summary = new BatchSummary(
            scrapeRunId,
            sourcePlatform,
            status,
            batch.size(),
            created,
            merged,
            rejections.size(),
            reasons,
            List.copyOf(rejections),
            List.copyOf(unprocessed),
            startedAt,
            clock.instant().truncatedTo(ChronoUnit.MILLIS)
        );
        try {
            runRepository.finishRun(summary, lastError);
        } catch (DataAccessException e) {
            log.warn("Could not record outcome of ingestion run {}", scrapeRunId, e);
        }
        if (STATUS_FAILED.equals(status)) {
            log.warn("Ingestion run {} {}: created={} merged={} rejected={} unprocessed={}",
                scrapeRunId, status, created, merged, rejections.size(), unprocessed.size());
        } else {
            log.info("Ingestion run {} {}: created={} merged={} rejected={} reasons={}",
                scrapeRunId, status, created, merged, rejections.size(), reasons);
        }
        return summary;
    }

    private static List<Integer> canonicalOrder(List<RawJobRecord> batch) {
        List<Integer> order = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            order.add(i);
        }
        order.sort((a, b) -> {
            RawJobRecord left = batch.get(a);
            RawJobRecord right = batch.get(b);
            if (left == null || right == null) {
                return left == null ? (right == null ? Integer.compare(a, b) : -1) : 1;
            }
            int compared = CANONICAL_ORDER.compare(left, right);
            return compared != 0 ? compared : Integer.compare(a, b);
        });
        return order;
    }

    private static void rejectRemaining(
        List<RawJobRecord> batch,
        List<Integer> order,
        int fromPosition,
        String reason,
        String detail,
        List<RecordRejection> rejections
    ) {
        for (int position = fromPosition; position < order.size(); position++) {
            int index = order.get(position);
            rejections.add(new RecordRejection(index, externalId(batch.get(index)), reason, detail));
        }
    }

    private static String externalId(RawJobRecord record) {
        return record == null ? null : record.externalId();
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
