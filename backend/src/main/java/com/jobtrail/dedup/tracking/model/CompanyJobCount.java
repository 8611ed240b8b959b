package com.jobtrail.dedup.tracking.model;

public record CompanyJobCount(
    long companyId,
    String companyName,
    long jobCount
) {
}
