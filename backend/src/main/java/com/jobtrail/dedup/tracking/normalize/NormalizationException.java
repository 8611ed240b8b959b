package com.jobtrail.dedup.tracking.normalize;

public class NormalizationException extends RuntimeException {
    private final String field;

    public NormalizationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
