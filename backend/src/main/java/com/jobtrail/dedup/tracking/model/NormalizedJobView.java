package com.jobtrail.dedup.tracking.model;

import java.time.Instant;
import java.time.LocalDate;

public record NormalizedJobView(
    TitleKey title,
    String displayTitle,
    String companyName,
    String companyDisplayName,
    String companyDomain,
    String companySize,
    ParsedLocation location,
    String descriptionText,
    CompensationBucket compensation,
    String jobType,
    boolean remote,
    String sourcePlatform,
    String externalId,
    String postingUrl,
    LocalDate postedDate,
    Instant observedAt
) {
    public String normalizedTitle() {
        return title.normalized();
    }
}
