package com.mockinterview.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final assessment of a completed session. Built once by the evaluation pipeline and
 * never modified after it is stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationReport {
    private String sessionId;
    private double overallScore;
    @Builder.Default
    private Map<String, CompetencyScore> competencyScores = new LinkedHashMap<>();
    @Builder.Default
    private List<FeedbackItem> wentWell = new ArrayList<>();
    @Builder.Default
    private List<FeedbackItem> wentOkay = new ArrayList<>();
    @Builder.Default
    private List<FeedbackItem> needsImprovement = new ArrayList<>();
    private ModeAnalysis communicationModeAnalysis;
    private ImprovementPlan improvementPlan;
    private LocalDateTime createdAt;

    public int feedbackCount() {
        return wentWell.size() + wentOkay.size() + needsImprovement.size();
    }
}
