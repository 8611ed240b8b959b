package com.jobtrail.dedup.tracking.model;

public record MatchCandidate(TrackedJob job, MatchType matchType, double score) {
}
