package com.mockinterview.platform.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum SessionStatus {
    CREATED,
    ACTIVE,
    PAUSED,
    COMPLETED;

    /**
     * Allowed lifecycle edges: created→active→completed, active↔paused, paused→completed.
     * Completed is terminal.
     */
    public boolean canTransitionTo(SessionStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<SessionStatus> allowedTargets() {
        return switch (this) {
            case CREATED -> EnumSet.of(ACTIVE);
            case ACTIVE -> EnumSet.of(PAUSED, COMPLETED);
            case PAUSED -> EnumSet.of(ACTIVE, COMPLETED);
            case COMPLETED -> EnumSet.noneOf(SessionStatus.class);
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
