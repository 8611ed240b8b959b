package com.jobtrail.dedup.tracking.util;

import com.jobtrail.dedup.tracking.normalize.NormalizationException;
import com.jobtrail.dedup.tracking.service.ResolutionConflictException;
import com.jobtrail.dedup.tracking.service.StorageUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RejectionReasonsTest {

    @Test
    void normalizationFailuresMapToTheirField() {
        assertEquals(RejectionReasons.MISSING_TITLE, RejectionReasons.fromException(new NormalizationException("title", "x")));
        assertEquals(RejectionReasons.MISSING_COMPANY, RejectionReasons.fromException(new NormalizationException("company", "x")));
        assertEquals(RejectionReasons.MISSING_PLATFORM, RejectionReasons.fromException(new NormalizationException("platform", "x")));
        assertEquals(RejectionReasons.INVALID_RECORD, RejectionReasons.fromException(new NormalizationException("observed_at", "x")));
    }

    @Test
    void storageAndConflictFailuresAreClassified() {
        assertEquals(RejectionReasons.CONFLICT, RejectionReasons.fromException(new ResolutionConflictException("race")));
        assertEquals(RejectionReasons.CONFLICT, RejectionReasons.fromException(new DataIntegrityViolationException("dup")));
        assertEquals(
            RejectionReasons.STORAGE_UNAVAILABLE,
            RejectionReasons.fromException(new StorageUnavailableException("down", new DataAccessResourceFailureException("down")))
        );
        assertEquals(RejectionReasons.UNKNOWN, RejectionReasons.fromException(new IllegalStateException("boom")));
        assertEquals(RejectionReasons.UNKNOWN, RejectionReasons.fromException(null));
    }

    @Test
    void onlyTransientReasonsAreRetryable() {
        assertTrue(RejectionReasons.isRetryable(RejectionReasons.CONFLICT));
        assertTrue(RejectionReasons.isRetryable(RejectionReasons.TIMEOUT));
        assertFalse(RejectionReasons.isRetryable(RejectionReasons.MISSING_TITLE));
        assertFalse(RejectionReasons.isRetryable(null));
    }
}
