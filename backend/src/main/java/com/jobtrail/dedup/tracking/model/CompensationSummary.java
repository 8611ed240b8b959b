package com.jobtrail.dedup.tracking.model;

/**
 * Average annual pay bounds over the jobs that stated any; {@code sampleSize} counts them.
 * Averages are null when no job had the bound.
 */
public record CompensationSummary(
    Double averageMin,
    Double averageMax,
    long sampleSize
) {
}
