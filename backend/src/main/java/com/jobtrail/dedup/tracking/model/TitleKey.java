package com.jobtrail.dedup.tracking.model;

import java.util.List;

/**
 * A normalized title split into its seniority qualifier and the remaining core words.
 * "senior software engineer", "software engineer sr" and "sr. software engineer" share
 * the core "software engineer" and the level {@link SeniorityLevel#SENIOR}.
 */
public record TitleKey(
    String normalized,
    String core,
    SeniorityLevel level
) {
    public List<String> coreTokens() {
        if (core == null || core.isBlank()) {
            return List.of();
        }
        return List.of(core.trim().split(" +"));
    }
}
