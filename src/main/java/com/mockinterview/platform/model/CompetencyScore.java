package com.mockinterview.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompetencyScore {
    private double score;
    private ConfidenceLevel confidenceLevel;
    @Builder.Default
    private List<String> evidence = new ArrayList<>();

    public static CompetencyScore fallback() {
        return CompetencyScore.builder()
                .score(50.0)
                .confidenceLevel(ConfidenceLevel.LOW)
                .build();
    }
}
