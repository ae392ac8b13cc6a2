package com.mockinterview.platform.service;

import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.llm.LlmCompletion;
import com.mockinterview.platform.llm.LlmGateway;
import com.mockinterview.platform.model.*;
import com.mockinterview.platform.store.DataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Post-session analysis pipeline.
 * <p>
 * Four model calls (competencies, feedback, communication modes, improvement plan)
 * followed by a local weighted score. A failed call aborts the run and nothing is stored.
 * Between steps the run stops if its thread was interrupted or the session was deleted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EvaluationManager {

    public static final String PROBLEM_DECOMPOSITION = "Problem Decomposition";
    public static final String SCALABILITY = "Scalability Considerations";
    public static final String RELIABILITY = "Reliability & Fault Tolerance";
    public static final String DATA_MODELING = "Data Modeling";
    public static final String TRADE_OFFS = "Trade-off Analysis";
    public static final String COMMUNICATION = "Communication Clarity";
    public static final String PATTERNS = "System Design Patterns";

    public static final List<String> COMPETENCIES = List.of(
            PROBLEM_DECOMPOSITION, SCALABILITY, RELIABILITY, DATA_MODELING, TRADE_OFFS, COMMUNICATION, PATTERNS);

    /** Overall-score weights; they sum to 1. */
    public static final Map<String, Double> WEIGHTS = Map.of(
            PROBLEM_DECOMPOSITION, 0.20,
            SCALABILITY, 0.20,
            RELIABILITY, 0.15,
            TRADE_OFFS, 0.15,
            DATA_MODELING, 0.10,
            COMMUNICATION, 0.10,
            PATTERNS, 0.10);

    static final String OP_COMPETENCIES = "evaluation_competency_analysis";
    static final String OP_FEEDBACK = "evaluation_feedback";
    static final String OP_MODES = "evaluation_communication_modes";
    static final String OP_PLAN = "evaluation_improvement_plan";

    private static final int PRIORITY_AREA_COUNT = 3;

    private final DataStore dataStore;
    private final LlmGateway llmGateway;
    private final TokenTracker tokenTracker;
    private final PromptService promptService;
    private final StructuredOutputParser parser;

    /**
     * Generates and stores the report for a completed session that has none yet.
     */
    public EvaluationReport generateEvaluation(String sessionId) {
        InterviewSession session = dataStore.findSession(sessionId)
                .orElseThrow(() -> InterviewPlatformException.sessionNotFound(sessionId));
        if (session.getStatus() != SessionStatus.COMPLETED) {
            throw InterviewPlatformException.configuration("evaluation",
                    "Session " + sessionId + " must be completed before it can be evaluated");
        }
        if (dataStore.findEvaluation(sessionId).isPresent()) {
            throw InterviewPlatformException.configuration("evaluation",
                    "Evaluation for session " + sessionId + " already exists");
        }
        EvaluationReport report = buildReport(session);
        return dataStore.saveEvaluation(report);
    }

    public Optional<EvaluationReport> getEvaluation(String sessionId) {
        if (!dataStore.sessionExists(sessionId)) {
            throw InterviewPlatformException.sessionNotFound(sessionId);
        }
        return dataStore.findEvaluation(sessionId);
    }

    /**
     * Runs the pipeline without storing the result.
     */
    EvaluationReport buildReport(InterviewSession session) {
        String sessionId = session.getId();
        long start = System.currentTimeMillis();
        log.info("Generating evaluation for session {}", sessionId);

        List<ConversationMessage> messages = dataStore.getMessages(sessionId);
        String transcript = messages.isEmpty()
                ? "(no conversation was recorded)"
                : promptService.formatTranscript(messages);

        checkpoint(sessionId, "competency analysis");
        Map<String, CompetencyScore> scores = parser.parseCompetencies(
                call(session, promptService.competencyPrompt(transcript, COMPETENCIES), OP_COMPETENCIES),
                COMPETENCIES);

        checkpoint(sessionId, "feedback generation");
        StructuredOutputParser.Feedback feedback = parser.parseFeedback(
                call(session, promptService.feedbackPrompt(transcript, scores), OP_FEEDBACK));

        checkpoint(sessionId, "communication mode analysis");
        Map<MediaKind, Integer> mediaCounts = countMedia(dataStore.getMediaFiles(sessionId));
        ModeAnalysis modeAnalysis = parser.parseModeAnalysis(
                call(session, promptService.modeAnalysisPrompt(transcript, session.getEnabledModes(), mediaCounts), OP_MODES),
                session.getEnabledModes(), mediaCounts);

        checkpoint(sessionId, "improvement plan");
        Map<String, CompetencyScore> lowest = lowestScoring(scores);
        ImprovementPlan plan = parser.parseImprovementPlan(
                call(session, promptService.improvementPlanPrompt(lowest, feedback.getNeedsImprovement()), OP_PLAN),
                new ArrayList<>(lowest.keySet()));

        checkpoint(sessionId, "overall score");
        EvaluationReport report = EvaluationReport.builder()
                .sessionId(sessionId)
                .overallScore(overallScore(scores))
                .competencyScores(scores)
                .wentWell(feedback.getWentWell())
                .wentOkay(feedback.getWentOkay())
                .needsImprovement(feedback.getNeedsImprovement())
                .communicationModeAnalysis(modeAnalysis)
                .improvementPlan(plan)
                .createdAt(LocalDateTime.now())
                .build();

        log.info("Evaluation for session {} completed in {}ms, overall score {}",
                sessionId, System.currentTimeMillis() - start, report.getOverallScore());
        return report;
    }

    /** Weighted mean of competency scores, clamped to [0, 100] and rounded to two decimals. */
    public static double overallScore(Map<String, CompetencyScore> scores) {
        double total = 0.0;
        for (String competency : COMPETENCIES) {
            CompetencyScore score = scores.get(competency);
            double value = score == null ? StructuredOutputParser.DEFAULT_SCORE : score.getScore();
            total += WEIGHTS.get(competency) * value;
        }
        double clamped = Math.max(0.0, Math.min(100.0, total));
        return BigDecimal.valueOf(clamped).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private String call(InterviewSession session, String prompt, String operation) {
        LlmCompletion completion;
        try {
            completion = llmGateway.generate(session.getConfig(), prompt);
        } catch (InterviewPlatformException e) {
            log.error("Evaluation step {} failed for session {}: {}", operation, session.getId(), e.getMessage());
            throw e;
        }
        tokenTracker.recordUsage(session.getId(), operation, completion.getInputTokens(), completion.getOutputTokens());
        return completion.getText();
    }

    private void checkpoint(String sessionId, String step) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Evaluation for session {} interrupted before {}", sessionId, step);
            throw InterviewPlatformException.configuration("evaluation",
                    "Evaluation for session " + sessionId + " was cancelled");
        }
        if (!dataStore.sessionExists(sessionId)) {
            log.warn("Session {} was deleted during evaluation, discarding partial results", sessionId);
            throw InterviewPlatformException.sessionNotFound(sessionId);
        }
    }

    private static Map<MediaKind, Integer> countMedia(List<MediaFile> mediaFiles) {
        Map<MediaKind, Integer> counts = new EnumMap<>(MediaKind.class);
        for (MediaFile mediaFile : mediaFiles) {
            counts.merge(mediaFile.getKind(), 1, Integer::sum);
        }
        return counts;
    }

    private static Map<String, CompetencyScore> lowestScoring(Map<String, CompetencyScore> scores) {
        return scores.entrySet().stream()
                .sorted(Comparator.comparingDouble(e -> e.getValue().getScore()))
                .limit(PRIORITY_AREA_COUNT)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }
}
