package com.jobtrail.dedup.tracking.normalize;

import com.jobtrail.dedup.config.TrackingProperties;
import com.jobtrail.dedup.tracking.model.Compensation;
import com.jobtrail.dedup.tracking.model.CompensationBucket;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;

/**
 * Annualizes a stated range, converts it to USD and floors both ends to the bucket size.
 * Currencies without a configured rate stay in their own unit and keep their code in the key.
 */
public class CompensationNormalizer {
    private static final String BASE_CURRENCY = "usd";
    private static final String OPEN_END = "open";
    private static final Map<String, Integer> PERIODS_PER_YEAR = Map.ofEntries(
        Map.entry("hour", 2080),
        Map.entry("hourly", 2080),
        Map.entry("day", 260),
        Map.entry("daily", 260),
        Map.entry("week", 52),
        Map.entry("weekly", 52),
        Map.entry("biweekly", 26),
        Map.entry("month", 12),
        Map.entry("monthly", 12),
        Map.entry("year", 1),
        Map.entry("yearly", 1),
        Map.entry("annual", 1),
        Map.entry("annually", 1)
    );

    private final TrackingProperties.Currency currency;

    public CompensationNormalizer(TrackingProperties.Currency currency) {
        this.currency = currency;
    }

    public CompensationBucket bucket(Compensation compensation) {
        if (compensation == null || !compensation.isStated()) {
            return CompensationBucket.NONE;
        }
        String code = compensation.currency() == null || compensation.currency().isBlank()
            ? "USD"
            : compensation.currency().trim().toUpperCase(Locale.ROOT);
        Double rate = currency.rateFor(code);
        String unit = rate == null ? code.toLowerCase(Locale.ROOT) : BASE_CURRENCY;
        double factor = periodsPerYear(compensation.interval()) * (rate == null ? 1.0 : rate);

        Long min = toBucket(compensation.minAmount(), factor);
        Long max = toBucket(compensation.maxAmount(), factor);
        if (min != null && max != null && min > max) {
            Long swap = min;
            min = max;
            max = swap;
        }
        String key = unit + ":" + (min == null ? OPEN_END : min) + "-" + (max == null ? OPEN_END : max);
        return new CompensationBucket(key, min, max, unit);
    }

    private Long toBucket(BigDecimal amount, double factor) {
        if (amount == null) {
            return null;
        }
        BigDecimal annual = amount.abs().multiply(BigDecimal.valueOf(factor));
        long size = currency.getBucketSize();
        long floored = annual.setScale(0, RoundingMode.FLOOR).longValue();
        return (floored / size) * size;
    }

    private static int periodsPerYear(String interval) {
        if (interval == null || interval.isBlank()) {
            return 1;
        }
        String normalized = interval.trim().toLowerCase(Locale.ROOT).replace("-", "");
        if (normalized.startsWith("per ")) {
            normalized = normalized.substring(4).trim();
        }
        return PERIODS_PER_YEAR.getOrDefault(normalized, 1);
    }
}
