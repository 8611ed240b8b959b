package com.jobtrail.dedup.tracking.model;

import java.time.Instant;

public record TrackedJobFilter(
    Long companyId,
    String company,
    Long locationId,
    String country,
    Boolean evergreen,
    Integer minRepostCount,
    Boolean remote,
    String jobType,
    String category,
    Instant seenFrom,
    Instant seenTo
) {
    public static TrackedJobFilter none() {
        return new TrackedJobFilter(null, null, null, null, null, null, null, null, null, null, null);
    }
}
