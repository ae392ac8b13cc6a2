package com.mockinterview.platform.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable per-session configuration.
 */
@Getter
@ToString
public class SessionConfig {

    private final Set<CommunicationMode> enabledModes;
    private final String aiProvider;
    private final String aiModel;
    private final ResumeData resumeData;
    private final Integer durationMinutes;

    @Builder
    public SessionConfig(Set<CommunicationMode> enabledModes, String aiProvider, String aiModel,
                         ResumeData resumeData, Integer durationMinutes) {
        this.enabledModes = enabledModes == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(enabledModes));
        this.aiProvider = aiProvider;
        this.aiModel = aiModel;
        this.resumeData = resumeData;
        this.durationMinutes = durationMinutes;
    }

    public boolean hasResume() {
        return resumeData != null;
    }
}
