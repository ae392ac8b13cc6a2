package com.mockinterview.platform.service;

import com.mockinterview.platform.config.AiProperties;
import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.model.InterviewSession;
import com.mockinterview.platform.model.TokenUsageRecord;
import com.mockinterview.platform.model.TokenUsageSummary;
import com.mockinterview.platform.store.DataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Token usage and cost accounting. Every aggregate is derived from the stored usage
 * rows, so the per-operation breakdown always sums to the session total.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TokenTracker {

    public static final String TOTAL = "total";

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);
    private static final int COST_SCALE = 6;

    private final DataStore dataStore;
    private final AiProperties aiProperties;
    private final SessionLockRegistry lockRegistry;

    public TokenUsageRecord recordUsage(String sessionId, String operation, long inputTokens, long outputTokens) {
        if (inputTokens < 0 || outputTokens < 0) {
            throw InterviewPlatformException.configuration("token usage", "Token counts must not be negative");
        }
        if (operation == null || operation.isBlank()) {
            throw InterviewPlatformException.configuration("token usage", "Operation label is required");
        }
        InterviewSession session = requireSession(sessionId);
        BigDecimal cost = calculateCost(session.getAiProvider(), session.getAiModel(), inputTokens, outputTokens);

        TokenUsageRecord record = TokenUsageRecord.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .operation(operation)
                .provider(session.getAiProvider())
                .model(session.getAiModel())
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .cost(cost)
                .recordedAt(LocalDateTime.now())
                .build();

        TokenUsageRecord saved = lockRegistry.withLock(sessionId, SessionLockRegistry.TOKENS,
                () -> dataStore.saveTokenUsage(record));
        log.debug("Recorded {} tokens for {} in session {} (cost ${})",
                record.getTotalTokens(), operation, sessionId, cost);
        return saved;
    }

    public BigDecimal calculateCost(String provider, String model, long inputTokens, long outputTokens) {
        return aiProperties.findModel(provider, model)
                .map(spec -> BigDecimal.valueOf(inputTokens).multiply(spec.getInputCostPerMillion())
                        .add(BigDecimal.valueOf(outputTokens).multiply(spec.getOutputCostPerMillion()))
                        .divide(ONE_MILLION, COST_SCALE, RoundingMode.HALF_UP))
                .orElseGet(() -> {
                    log.warn("No pricing configured for {}/{}, recording zero cost", provider, model);
                    return BigDecimal.ZERO.setScale(COST_SCALE);
                });
    }

    public TokenUsageSummary getSessionUsage(String sessionId) {
        requireSession(sessionId);
        return aggregate(TOTAL, dataStore.getTokenUsage(sessionId));
    }

    /** Per-operation aggregates in order of first use. */
    public Map<String, TokenUsageSummary> getUsageBreakdown(String sessionId) {
        requireSession(sessionId);
        Map<String, List<TokenUsageRecord>> byOperation = new LinkedHashMap<>();
        for (TokenUsageRecord record : dataStore.getTokenUsage(sessionId)) {
            byOperation.computeIfAbsent(record.getOperation(), k -> new ArrayList<>()).add(record);
        }
        Map<String, TokenUsageSummary> breakdown = new LinkedHashMap<>();
        byOperation.forEach((operation, records) -> breakdown.put(operation, aggregate(operation, records)));
        return breakdown;
    }

    public BigDecimal getTotalCost(String sessionId) {
        return getSessionUsage(sessionId).getCost();
    }

    private TokenUsageSummary aggregate(String operation, List<TokenUsageRecord> records) {
        long input = 0;
        long output = 0;
        BigDecimal cost = BigDecimal.ZERO.setScale(COST_SCALE);
        for (TokenUsageRecord record : records) {
            input += record.getInputTokens();
            output += record.getOutputTokens();
            cost = cost.add(record.getCost());
        }
        return TokenUsageSummary.builder()
                .operation(operation)
                .inputTokens(input)
                .outputTokens(output)
                .totalTokens(input + output)
                .cost(cost)
                .calls(records.size())
                .build();
    }

    private InterviewSession requireSession(String sessionId) {
        return dataStore.findSession(sessionId)
                .orElseThrow(() -> InterviewPlatformException.sessionNotFound(sessionId));
    }
}
