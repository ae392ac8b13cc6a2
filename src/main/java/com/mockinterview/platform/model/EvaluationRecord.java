package com.mockinterview.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted form of an {@link EvaluationReport}; nested sections are stored as JSON text.
 */
@Entity
@Table(name = "evaluations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationRecord {

    @Id
    @Column(name = "session_id", length = 36)
    private String sessionId;

    @Column(name = "overall_score", nullable = false)
    private Double overallScore;

    @Column(name = "competency_scores", nullable = false, columnDefinition = "TEXT")
    private String competencyScoresJson;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String feedbackJson;

    @Column(name = "communication_analysis", nullable = false, columnDefinition = "TEXT")
    private String communicationAnalysisJson;

    @Column(name = "improvement_plan", nullable = false, columnDefinition = "TEXT")
    private String improvementPlanJson;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
