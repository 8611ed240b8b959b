package com.jobtrail.dedup.tracking.model;

public enum MatchType {
    EXACT,
    FUZZY,
    NONE
}
