package com.jobtrail.dedup.tracking.model;

import java.time.Instant;

/**
 * @param ingestedAt observation time for records that carry none of their own
 */
public record ScrapeRunContext(
    String scrapeRunId,
    String sourcePlatform,
    Instant ingestedAt
) {
}
