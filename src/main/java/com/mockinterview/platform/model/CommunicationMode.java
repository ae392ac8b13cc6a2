package com.mockinterview.platform.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mockinterview.platform.exception.InterviewPlatformException;

import java.util.Arrays;

public enum CommunicationMode {
    TEXT("text"),
    AUDIO("audio"),
    VIDEO("video"),
    WHITEBOARD("whiteboard"),
    SCREEN_SHARE("screen_share");

    private final String value;

    CommunicationMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Accepts the wire value, the enum name, or the hyphenated spelling ("screen-share").
     */
    @JsonCreator
    public static CommunicationMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw InterviewPlatformException.configuration("Communication mode must not be blank");
        }
        String normalized = raw.trim().toLowerCase().replace('-', '_');
        return Arrays.stream(values())
                .filter(m -> m.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> InterviewPlatformException.configuration(
                        "Unknown communication mode: " + raw));
    }
}
