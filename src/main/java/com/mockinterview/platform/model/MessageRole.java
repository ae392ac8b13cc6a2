package com.mockinterview.platform.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
    INTERVIEWER("Interviewer"),
    CANDIDATE("Candidate");

    private final String label;

    MessageRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
