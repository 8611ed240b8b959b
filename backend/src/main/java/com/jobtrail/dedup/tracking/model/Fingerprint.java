package com.jobtrail.dedup.tracking.model;

public record Fingerprint(String value) {
    public Fingerprint {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("fingerprint value is required");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
