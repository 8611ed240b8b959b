package com.jobtrail.dedup.tracking.model;

import java.time.Instant;

/**
 * Sort key of the last row on a page: {@code last_seen_at DESC, job_fingerprint ASC}.
 */
public record PageCursor(Instant lastSeenAt, String jobFingerprint) {
}
