package com.jobtrail.dedup.tracking.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one scrape batch. {@code unprocessedIndexes} lists the batch positions that
 * were never attempted because the batch failed; resubmitting exactly those records
 * completes the run.
 */
public record BatchSummary(
    String scrapeRunId,
    String sourcePlatform,
    String status,
    int total,
    int created,
    int merged,
    int rejected,
    Map<String, Integer> rejectionReasons,
    List<RecordRejection> rejections,
    List<Integer> unprocessedIndexes,
    Instant startedAt,
    Instant finishedAt
) {
}
