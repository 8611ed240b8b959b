package com.jobtrail.dedup.tracking.model;

import java.time.Instant;
import java.util.List;

/**
 * Read-side projection of a tracked job. {@code daysActive} is the whole number of days
 * between first and last sighting; {@code sitesPostedCount} the number of platforms that
 * carried it.
 */
public record TrackedJobView(
    String jobFingerprint,
    String title,
    String displayTitle,
    long companyId,
    String companyName,
    String companyDomain,
    long locationId,
    String city,
    String region,
    String country,
    boolean remote,
    String experienceLevel,
    String jobCategory,
    String jobType,
    String compensationBucket,
    Instant firstSeenAt,
    Instant lastSeenAt,
    long daysActive,
    int repostCount,
    boolean evergreen,
    int evergreenScore,
    int totalSeenCount,
    int sitesPostedCount,
    List<JobSource> sources
) {
}
