package com.jobtrail.dedup.tracking.model;

import java.util.List;
import java.util.Map;

public record JobAnalytics(
    long totalJobs,
    long evergreenJobs,
    long repostedJobs,
    long remoteJobs,
    List<CompanyJobCount> topCompanies,
    Map<String, Long> jobTypeDistribution,
    Map<String, Long> categoryDistribution,
    CompensationSummary compensation
) {
}
