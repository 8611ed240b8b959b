package com.jobtrail.dedup.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TrackingPropertiesGuardrailTest {

    @Test
    void freshnessWindowFallsBackToDefaultWhenNotPositive() {
        TrackingProperties properties = new TrackingProperties();
        properties.setFreshnessWindow(Duration.ZERO);
        assertEquals(Duration.ofHours(24), properties.getFreshnessWindow());

        properties.setFreshnessWindow(Duration.ofHours(-3));
        assertEquals(Duration.ofHours(24), properties.getFreshnessWindow());

        properties.setFreshnessWindow(Duration.ofHours(12));
        assertEquals(Duration.ofHours(12), properties.getFreshnessWindow());
    }

    @Test
    void evergreenThresholdNeverDropsBelowTwo() {
        TrackingProperties properties = new TrackingProperties();
        assertEquals(7, properties.getEvergreenThreshold());
        properties.setEvergreenThreshold(0);
        assertEquals(2, properties.getEvergreenThreshold());
    }

    @Test
    void similarityRatiosAreClamped() {
        TrackingProperties properties = new TrackingProperties();
        assertEquals(0.85, properties.getFuzzyTitleSimilarityThreshold(), 1e-9);
        properties.setFuzzyTitleSimilarityThreshold(1.7);
        properties.setDescriptionMatchBonus(-0.2);
        assertEquals(1.0, properties.getFuzzyTitleSimilarityThreshold(), 1e-9);
        assertEquals(0.0, properties.getDescriptionMatchBonus(), 1e-9);
    }

    @Test
    void lockBatchAndQueryLimitsAreClamped() {
        TrackingProperties properties = new TrackingProperties();
        properties.getLock().setMaxAttempts(0);
        properties.getLock().setWaitMillis(-5);
        properties.getLock().setBackoffMillis(-1);
        properties.getBatch().setWorkerThreads(0);
        properties.getBatch().setTimeoutSeconds(0);
        properties.getQuery().setMaxPageSize(20);
        properties.getQuery().setDefaultPageSize(100);

        assertEquals(1, properties.getLock().getMaxAttempts());
        assertEquals(1, properties.getLock().getWaitMillis());
        assertEquals(0, properties.getLock().getBackoffMillis());
        assertEquals(1, properties.getBatch().getWorkerThreads());
        assertEquals(1, properties.getBatch().getTimeoutSeconds());
        assertEquals(20, properties.getQuery().getDefaultPageSize());
    }

    @Test
    void currencyRatesAreKeyedCaseInsensitively() {
        TrackingProperties.Currency currency = new TrackingProperties.Currency();
        currency.setRates(Map.of("eur", 1.1, "bad", -1.0));
        assertEquals(1.1, currency.rateFor(" EUR "), 1e-9);
        assertNull(currency.rateFor("BAD"));
        assertNull(currency.rateFor("USD"));
        assertNull(currency.rateFor(null));
    }
}
