package com.jobtrail.dedup.tracking.model;

public record CanonicalLocation(
    long id,
    String city,
    String region,
    String country,
    Double latitude,
    Double longitude,
    String regionGroup
) {
}
