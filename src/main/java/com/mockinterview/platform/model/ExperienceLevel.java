package com.mockinterview.platform.model;

/**
 * Seniority bands used to pick problem difficulty.
 */
public enum ExperienceLevel {
    JUNIOR("basic system components and simple scaling"),
    MID("distributed systems concepts and trade-offs"),
    SENIOR("multiple services and data consistency"),
    STAFF("large-scale systems with organizational and technical challenges");

    private final String focus;

    ExperienceLevel(String focus) {
        this.focus = focus;
    }

    public String focus() {
        return focus;
    }

    public static ExperienceLevel fromYears(int years) {
        if (years <= 2) {
            return JUNIOR;
        }
        if (years <= 5) {
            return MID;
        }
        if (years <= 10) {
            return SENIOR;
        }
        return STAFF;
    }
}
