package com.jobtrail.dedup.tracking.model;

import java.time.Instant;

public record CanonicalCompany(
    long id,
    String normalizedName,
    String domain,
    String displayName,
    String industry,
    String sizeBucket,
    Instant firstSeenAt,
    Instant lastSeenAt
) {
}
