package com.mockinterview.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Aggregated token counts and cost, either for a whole session or for one operation label.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsageSummary {
    private String operation;
    private long inputTokens;
    private long outputTokens;
    private long totalTokens;
    @Builder.Default
    private BigDecimal cost = BigDecimal.ZERO;
    private int calls;
}
