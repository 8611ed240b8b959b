package com.jobtrail.dedup.tracking.model;

public record CompanyResolution(CanonicalCompany company, Confidence confidence) {

    public enum Confidence {
        /** Matched on the full (name, domain) identity. */
        EXACT,
        /** No domain supplied; matched the only company carrying that name. */
        NAME_ONLY,
        CREATED
    }
}
