package com.jobtrail.dedup.tracking.model;

import java.time.Instant;

public record JobSource(
    String platform,
    String externalId,
    String postingUrl,
    Instant firstSeenAt,
    Instant lastSeenAt
) {
}
