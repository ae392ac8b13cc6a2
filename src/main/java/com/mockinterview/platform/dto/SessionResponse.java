package com.mockinterview.platform.dto;

import com.mockinterview.platform.model.CommunicationMode;
import com.mockinterview.platform.model.InterviewSession;
import com.mockinterview.platform.model.SessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionResponse {
    private String id;
    private String userId;
    private SessionStatus status;
    private Set<CommunicationMode> enabledModes;
    private String aiProvider;
    private String aiModel;
    private Integer durationMinutes;
    private Boolean hasResume;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;

    public static SessionResponse from(InterviewSession session) {
        return SessionResponse.builder()
                .id(session.getId())
                .userId(session.getUserId())
                .status(session.getStatus())
                .enabledModes(session.getEnabledModes())
                .aiProvider(session.getAiProvider())
                .aiModel(session.getAiModel())
                .durationMinutes(session.getDurationMinutes())
                .hasResume(session.getResumeData() != null)
                .createdAt(session.getCreatedAt())
                .startedAt(session.getStartedAt())
                .endedAt(session.getEndedAt())
                .build();
    }
}
