package com.jobtrail.dedup.tracking.model;

public record MergeOutcome(
    Type type,
    Long trackedJobId,
    String jobFingerprint,
    MatchType matchType,
    Double similarity,
    String reason,
    String detail
) {
    public enum Type {
        CREATED,
        MERGED,
        REJECTED
    }

    public static MergeOutcome created(TrackedJob job) {
        return new MergeOutcome(Type.CREATED, job.id(), job.jobFingerprint(), MatchType.NONE, null, null, null);
    }

    public static MergeOutcome merged(TrackedJob job, MatchType matchType, double similarity) {
        return new MergeOutcome(Type.MERGED, job.id(), job.jobFingerprint(), matchType, similarity, null, null);
    }

    public static MergeOutcome rejected(String reason, String detail) {
        return new MergeOutcome(Type.REJECTED, null, null, MatchType.NONE, null, reason, detail);
    }

    public boolean isRejected() {
        return type == Type.REJECTED;
    }
}
