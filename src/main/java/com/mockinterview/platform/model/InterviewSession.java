package com.mockinterview.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;

@Entity
@Table(name = "sessions", indexes = {
        @Index(name = "idx_sessions_created_at", columnList = "created_at"),
        @Index(name = "idx_sessions_user_id", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterviewSession {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SessionStatus status;

    @Convert(converter = CommunicationModeSetConverter.class)
    @Column(name = "enabled_modes", nullable = false)
    private Set<CommunicationMode> enabledModes;

    @Column(name = "ai_provider", nullable = false, length = 50)
    private String aiProvider;

    @Column(name = "ai_model", nullable = false, length = 100)
    private String aiModel;

    @Convert(converter = ResumeDataConverter.class)
    @Column(name = "resume_data", columnDefinition = "TEXT")
    private ResumeData resumeData;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "ended_at")
    private LocalDateTime endedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public SessionConfig getConfig() {
        return SessionConfig.builder()
                .enabledModes(enabledModes)
                .aiProvider(aiProvider)
                .aiModel(aiModel)
                .resumeData(resumeData)
                .durationMinutes(durationMinutes)
                .build();
    }
}
