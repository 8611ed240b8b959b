package com.jobtrail.dedup.tracking.model;

/**
 * Structured location. Missing components are empty strings; an unparseable country is
 * {@link #UNKNOWN_COUNTRY}.
 */
public record ParsedLocation(
    String city,
    String region,
    String country,
    boolean remote
) {
    public static final String UNKNOWN_COUNTRY = "unknown";
    public static final String REMOTE_COUNTRY = "remote";

    public static ParsedLocation unknown() {
        return new ParsedLocation("", "", UNKNOWN_COUNTRY, false);
    }
}
