package com.jobtrail.dedup.tracking.service;

/**
 * Lost a create/update race on a canonical entity or tracked job. Safe to retry.
 */
public class ResolutionConflictException extends RuntimeException {
    public ResolutionConflictException(String message) {
        super(message);
    }

    public ResolutionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
