package com.mockinterview.platform.service;

import com.mockinterview.platform.config.AiProperties;
import com.mockinterview.platform.model.CommunicationMode;
import com.mockinterview.platform.model.TokenUsageSummary;
import com.mockinterview.platform.testutil.FakeLlmClient;
import com.mockinterview.platform.testutil.TestPlatform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenTrackerTest {

    @TempDir
    Path sessionsDir;

    private TestPlatform platform;
    private TokenTracker tracker;
    private String sessionId;

    @BeforeEach
    void setUp() {
        platform = new TestPlatform(sessionsDir);
        tracker = platform.tokenTracker;
        sessionId = platform.activeSession(CommunicationMode.TEXT);
    }

    @Test
    void costUsesPerMillionPricing() {
        BigDecimal cost = tracker.calculateCost(FakeLlmClient.PROVIDER, FakeLlmClient.MODEL, 1_000_000, 500_000);

        assertThat(cost).isEqualByComparingTo("2.000000");
        assertThat(cost.scale()).isEqualTo(6);
    }

    @Test
    void costIsRoundedHalfUpToSixDecimals() {
        AiProperties.ModelSpec cheap = new AiProperties.ModelSpec();
        cheap.setName("cheap-model");
        cheap.setInputCostPerMillion(new BigDecimal("0.10"));
        platform.aiProperties.findProvider(FakeLlmClient.PROVIDER).orElseThrow().getModels().add(cheap);

        // 5 tokens at $0.10/M is 0.0000005
        assertThat(tracker.calculateCost(FakeLlmClient.PROVIDER, "cheap-model", 5, 0))
                .isEqualByComparingTo("0.000001");
        assertThat(tracker.calculateCost(FakeLlmClient.PROVIDER, "cheap-model", 4, 0))
                .isEqualByComparingTo("0");
        assertThat(tracker.calculateCost(FakeLlmClient.PROVIDER, FakeLlmClient.MODEL, 1, 1))
                .isEqualByComparingTo("0.000003");
    }

    @Test
    void unknownModelCostsNothing() {
        assertThat(tracker.calculateCost("fake", "other-model", 1000, 1000)).isEqualByComparingTo("0");
    }

    @Test
    void breakdownSumsToSessionTotal() {
        tracker.recordUsage(sessionId, "start_interview", 100, 40);
        tracker.recordUsage(sessionId, "process_response", 300, 60);
        tracker.recordUsage(sessionId, "process_response", 500, 80);

        Map<String, TokenUsageSummary> breakdown = tracker.getUsageBreakdown(sessionId);
        TokenUsageSummary total = tracker.getSessionUsage(sessionId);

        assertThat(breakdown.keySet()).containsExactly("start_interview", "process_response");
        assertThat(breakdown.get("process_response").getCalls()).isEqualTo(2);
        assertThat(breakdown.get("process_response").getTotalTokens()).isEqualTo(940);
        assertThat(total.getOperation()).isEqualTo(TokenTracker.TOTAL);
        assertThat(total.getInputTokens()).isEqualTo(900);
        assertThat(total.getOutputTokens()).isEqualTo(180);
        assertThat(breakdown.values().stream().mapToLong(TokenUsageSummary::getTotalTokens).sum())
                .isEqualTo(total.getTotalTokens());
        assertThat(breakdown.values().stream().map(TokenUsageSummary::getCost).reduce(BigDecimal.ZERO, BigDecimal::add))
                .isEqualByComparingTo(total.getCost());
        assertThat(tracker.getTotalCost(sessionId)).isEqualByComparingTo("0.001260");
    }

    @Test
    void concurrentRecordsAreAllCounted() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                futures.add(pool.submit(() -> tracker.recordUsage(sessionId, "process_response", 10, 5)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        TokenUsageSummary total = tracker.getSessionUsage(sessionId);
        assertThat(total.getCalls()).isEqualTo(40);
        assertThat(total.getTotalTokens()).isEqualTo(600);
    }

    @Test
    void invalidUsageIsRejected() {
        assertThatThrownBy(() -> tracker.recordUsage(sessionId, "op", -1, 0))
                .hasFieldOrPropertyWithValue("subsystem", "token usage");
        assertThatThrownBy(() -> tracker.recordUsage(sessionId, " ", 1, 1))
                .hasMessage("Operation label is required");
        assertThatThrownBy(() -> tracker.recordUsage("ghost", "op", 1, 1))
                .hasMessage("Session ghost not found");
    }

    @Test
    void sessionWithoutUsageReportsZero() {
        TokenUsageSummary total = tracker.getSessionUsage(sessionId);

        assertThat(total.getTotalTokens()).isZero();
        assertThat(total.getCost()).isEqualByComparingTo("0");
        assertThat(tracker.getUsageBreakdown(sessionId)).isEmpty();
    }
}
