package com.jobtrail.dedup.tracking.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One posting as captured by a scraping adapter. Field values are kept verbatim;
 * all cleanup happens in normalization.
 */
public record RawJobRecord(
    String sourcePlatform,
    String scrapeRunId,
    String title,
    String companyName,
    String companyDomain,
    String companySize,
    String location,
    String description,
    LocalDate postedDate,
    Compensation compensation,
    String externalId,
    String postingUrl,
    Instant observedAt,
    String jobType
) {
    public RawJobRecord withSourcePlatform(String platform) {
        return new RawJobRecord(
            platform,
            scrapeRunId,
            title,
            companyName,
            companyDomain,
            companySize,
            location,
            description,
            postedDate,
            compensation,
            externalId,
            postingUrl,
            observedAt,
            jobType
        );
    }
}
