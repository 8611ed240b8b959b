package com.jobtrail.dedup.tracking.service;

import com.jobtrail.dedup.config.TrackingProperties;
import com.jobtrail.dedup.tracking.persistence.IngestionRunRepository;
import com.jobtrail.dedup.tracking.persistence.TrackingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Marks RUNNING ingestion runs left over from a previous process as ABORTED so they can be
 * resubmitted.
 */
@Component
public class IngestionRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestionRunLifecycleRunner.class);

    private final TrackingJdbcRepository trackingRepository;
    private final IngestionRunRepository runRepository;
    private final TrackingProperties properties;
    private final Clock clock;

    public IngestionRunLifecycleRunner(
        TrackingJdbcRepository trackingRepository,
        IngestionRunRepository runRepository,
        TrackingProperties properties,
        Clock clock
    ) {
        this.trackingRepository = trackingRepository;
        this.runRepository = runRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = trackingRepository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping ingestion run cleanup because database is unreachable");
            return;
        }

        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getBatch().getStaleRunMinutes()));
        int aborted = runRepository.abortRunsStartedBefore(cutoff, now, "aborted_on_startup_stale_run");
        if (aborted > 0) {
            log.info("Aborted {} stale ingestion runs started before {}", aborted, cutoff);
        }
    }
}
