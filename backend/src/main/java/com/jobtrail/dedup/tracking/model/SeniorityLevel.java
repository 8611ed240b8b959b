package com.jobtrail.dedup.tracking.model;

public enum SeniorityLevel {
    NONE("mid"),
    JUNIOR("entry"),
    SENIOR("senior"),
    STAFF("senior"),
    LEAD("senior"),
    PRINCIPAL("senior"),
    GRADE_1("entry"),
    GRADE_2("mid"),
    GRADE_3("senior"),
    GRADE_4("senior");

    private final String experienceLevel;

    SeniorityLevel(String experienceLevel) {
        this.experienceLevel = experienceLevel;
    }

    public String experienceLevel() {
        return experienceLevel;
    }

    public boolean isQualified() {
        return this != NONE;
    }
}
