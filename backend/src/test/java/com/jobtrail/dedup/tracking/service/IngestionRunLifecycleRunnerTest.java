package com.jobtrail.dedup.tracking.service;

import com.jobtrail.dedup.config.TrackingProperties;
import com.jobtrail.dedup.tracking.persistence.IngestionRunRepository;
import com.jobtrail.dedup.tracking.persistence.TrackingJdbcRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionRunLifecycleRunnerTest {
    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    @Mock
    private TrackingJdbcRepository trackingRepository;
    @Mock
    private IngestionRunRepository runRepository;

    @Test
    void abortsRunsOlderThanConfiguredStaleness() {
        TrackingProperties properties = new TrackingProperties();
        properties.getBatch().setStaleRunMinutes(30);
        when(trackingRepository.isDbReachable()).thenReturn(true);
        when(runRepository.abortRunsStartedBefore(any(), any(), anyString())).thenReturn(2);

        runner(properties).run(new DefaultApplicationArguments());

        verify(runRepository).abortRunsStartedBefore(
            eq(NOW.minusSeconds(30 * 60)),
            eq(NOW),
            eq("aborted_on_startup_stale_run")
        );
    }

    @Test
    void skipsCleanupWhenDatabaseIsDown() {
        when(trackingRepository.isDbReachable()).thenThrow(new DataAccessResourceFailureException("down"));

        runner(new TrackingProperties()).run(new DefaultApplicationArguments());

        verify(runRepository, never()).abortRunsStartedBefore(any(), any(), anyString());
    }

    private IngestionRunLifecycleRunner runner(TrackingProperties properties) {
        return new IngestionRunLifecycleRunner(
            trackingRepository,
            runRepository,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }
}
