package com.mockinterview.platform.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    /** Unknown or missing values map to {@link #LOW}. */
    @JsonCreator
    public static ConfidenceLevel parse(String raw) {
        if (raw == null) {
            return LOW;
        }
        return switch (raw.trim().toLowerCase()) {
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            default -> LOW;
        };
    }
}
