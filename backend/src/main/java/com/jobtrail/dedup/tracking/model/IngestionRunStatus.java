package com.jobtrail.dedup.tracking.model;

import java.time.Instant;
import java.util.Map;

public record IngestionRunStatus(
    String scrapeRunId,
    String sourcePlatform,
    String status,
    int totalRecords,
    int created,
    int merged,
    int rejected,
    Map<String, Integer> rejectionReasons,
    Instant startedAt,
    Instant finishedAt,
    String lastError
) {
}
