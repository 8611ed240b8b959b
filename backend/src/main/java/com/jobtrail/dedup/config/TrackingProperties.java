package com.jobtrail.dedup.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {
    private static final Duration DEFAULT_FRESHNESS_WINDOW = Duration.ofHours(24);

    private Duration freshnessWindow = DEFAULT_FRESHNESS_WINDOW;
    private int evergreenThreshold = 7;
    private double fuzzyTitleSimilarityThreshold = 0.85;
    private double descriptionMatchBonus = 0.05;
    private int fuzzyCandidatePageSize = 200;
    private int descriptionFingerprintChars = 500;
    private Lock lock = new Lock();
    private Batch batch = new Batch();
    private Query query = new Query();
    private Currency currency = new Currency();
    private Cli cli = new Cli();

    public Duration getFreshnessWindow() {
        return normalizeWindow(freshnessWindow);
    }

    public void setFreshnessWindow(Duration freshnessWindow) {
        this.freshnessWindow = normalizeWindow(freshnessWindow);
    }

    /**
     * Minimum of two: a job seen once can never be evergreen.
     */
    public int getEvergreenThreshold() {
        return Math.max(2, evergreenThreshold);
    }

    public void setEvergreenThreshold(int evergreenThreshold) {
        this.evergreenThreshold = Math.max(2, evergreenThreshold);
    }

    public double getFuzzyTitleSimilarityThreshold() {
        return clampRatio(fuzzyTitleSimilarityThreshold);
    }

    public void setFuzzyTitleSimilarityThreshold(double fuzzyTitleSimilarityThreshold) {
        this.fuzzyTitleSimilarityThreshold = clampRatio(fuzzyTitleSimilarityThreshold);
    }

    public double getDescriptionMatchBonus() {
        return clampRatio(descriptionMatchBonus);
    }

    public void setDescriptionMatchBonus(double descriptionMatchBonus) {
        this.descriptionMatchBonus = clampRatio(descriptionMatchBonus);
    }

    public int getFuzzyCandidatePageSize() {
        return Math.max(1, fuzzyCandidatePageSize);
    }

    public void setFuzzyCandidatePageSize(int fuzzyCandidatePageSize) {
        this.fuzzyCandidatePageSize = Math.max(1, fuzzyCandidatePageSize);
    }

    public int getDescriptionFingerprintChars() {
        return Math.max(1, descriptionFingerprintChars);
    }

    public void setDescriptionFingerprintChars(int descriptionFingerprintChars) {
        this.descriptionFingerprintChars = Math.max(1, descriptionFingerprintChars);
    }

    public Lock getLock() {
        return lock;
    }

    public void setLock(Lock lock) {
        this.lock = lock;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Currency getCurrency() {
        return currency;
    }

    public void setCurrency(Currency currency) {
        this.currency = currency;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static Duration normalizeWindow(Duration candidate) {
        if (candidate == null || candidate.isNegative() || candidate.isZero()) {
            return DEFAULT_FRESHNESS_WINDOW;
        }
        return candidate;
    }

    private static double clampRatio(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static class Lock {
        private long waitMillis = 2000;
        private int maxAttempts = 5;
        private long backoffMillis = 50;

        public long getWaitMillis() {
            return Math.max(1, waitMillis);
        }

        public void setWaitMillis(long waitMillis) {
            this.waitMillis = Math.max(1, waitMillis);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBackoffMillis() {
            return Math.max(0, backoffMillis);
        }

        public void setBackoffMillis(long backoffMillis) {
            this.backoffMillis = Math.max(0, backoffMillis);
        }
    }

    public static class Batch {
        private int workerThreads = 4;
        private int timeoutSeconds = 600;
        private int staleRunMinutes = 60;

        public int getWorkerThreads() {
            return Math.max(1, workerThreads);
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = Math.max(1, workerThreads);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }
    }

    public static class Query {
        private int defaultPageSize = 50;
        private int maxPageSize = 500;

        public int getDefaultPageSize() {
            return Math.max(1, Math.min(defaultPageSize, getMaxPageSize()));
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = Math.max(1, defaultPageSize);
        }

        public int getMaxPageSize() {
            return Math.max(1, maxPageSize);
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = Math.max(1, maxPageSize);
        }
    }

    public static class Currency {
        private Map<String, Double> rates = defaultRates();
        private long bucketSize = 5000;

        public Map<String, Double> getRates() {
            return rates;
        }

        public void setRates(Map<String, Double> rates) {
            Map<String, Double> normalized = new LinkedHashMap<>();
            if (rates != null) {
                rates.forEach((code, rate) -> {
                    if (code != null && rate != null && rate > 0) {
                        normalized.put(code.trim().toUpperCase(Locale.ROOT), rate);
                    }
                });
            }
            this.rates = normalized;
        }

        public Double rateFor(String currencyCode) {
            if (currencyCode == null || currencyCode.isBlank()) {
                return null;
            }
            return rates.get(currencyCode.trim().toUpperCase(Locale.ROOT));
        }

        public long getBucketSize() {
            return Math.max(1, bucketSize);
        }

        public void setBucketSize(long bucketSize) {
            this.bucketSize = Math.max(1, bucketSize);
        }

        private static Map<String, Double> defaultRates() {
            Map<String, Double> rates = new LinkedHashMap<>();
            rates.put("USD", 1.0);
            rates.put("EUR", 1.08);
            rates.put("GBP", 1.27);
            rates.put("CAD", 0.73);
            rates.put("AUD", 0.66);
            rates.put("INR", 0.012);
            return rates;
        }
    }

    public static class Cli {
        private boolean run;
        private String file = "";
        private String platform = "csv";
        private String scrapeRunId = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getPlatform() {
            return platform;
        }

        public void setPlatform(String platform) {
            this.platform = platform;
        }

        public String getScrapeRunId() {
            return scrapeRunId;
        }

        public void setScrapeRunId(String scrapeRunId) {
            this.scrapeRunId = scrapeRunId;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
