package com.jobtrail.dedup.tracking.model;

import java.time.Instant;
import java.util.List;

public record TrackedJob(
    long id,
    String jobFingerprint,
    long canonicalCompanyId,
    long canonicalLocationId,
    String normalizedTitle,
    String displayTitle,
    String experienceLevel,
    String jobCategory,
    String jobType,
    boolean remote,
    String descriptionFingerprint,
    String compensationBucket,
    Long compensationMin,
    Long compensationMax,
    Instant firstSeenAt,
    Instant lastSeenAt,
    int repostCount,
    boolean evergreen,
    int evergreenScore,
    int totalSeenCount,
    long version,
    List<JobSource> sources
) {
    public TrackedJob withSources(List<JobSource> jobSources) {
        return new TrackedJob(
            id,
            jobFingerprint,
            canonicalCompanyId,
            canonicalLocationId,
            normalizedTitle,
            displayTitle,
            experienceLevel,
            jobCategory,
            jobType,
            remote,
            descriptionFingerprint,
            compensationBucket,
            compensationMin,
            compensationMax,
            firstSeenAt,
            lastSeenAt,
            repostCount,
            evergreen,
            evergreenScore,
            totalSeenCount,
            version,
            jobSources == null ? List.of() : List.copyOf(jobSources)
        );
    }
}
