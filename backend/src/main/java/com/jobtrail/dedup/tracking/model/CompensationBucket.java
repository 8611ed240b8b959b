package com.jobtrail.dedup.tracking.model;

/**
 * Annualized compensation range rounded to bucket boundaries. {@link #NONE} stands for
 * "no compensation stated" and is never equal to a stated zero.
 */
public record CompensationBucket(
    String key,
    Long annualMin,
    Long annualMax,
    String currency
) {
    public static final String NONE_KEY = "none";
    public static final CompensationBucket NONE = new CompensationBucket(NONE_KEY, null, null, null);

    public boolean isNone() {
        return NONE_KEY.equals(key);
    }
}
