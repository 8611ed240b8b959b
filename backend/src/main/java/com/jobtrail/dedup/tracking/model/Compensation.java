package com.jobtrail.dedup.tracking.model;

import java.math.BigDecimal;

public record Compensation(
    BigDecimal minAmount,
    BigDecimal maxAmount,
    String currency,
    String interval
) {
    public boolean isStated() {
        return minAmount != null || maxAmount != null;
    }
}
