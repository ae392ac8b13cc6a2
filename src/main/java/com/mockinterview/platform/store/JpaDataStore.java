package com.mockinterview.platform.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.model.*;
import com.mockinterview.platform.repository.*;
import io.github.resilience4j.retry.Retry;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.TypedQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaDataStore implements DataStore {

    private static final TypeReference<Map<String, CompetencyScore>> COMPETENCY_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, List<FeedbackItem>>> FEEDBACK_MAP = new TypeReference<>() {
    };

    private static final String WENT_WELL = "went_well";
    private static final String WENT_OKAY = "went_okay";
    private static final String NEEDS_IMPROVEMENT = "needs_improvement";

    private final InterviewSessionRepository sessionRepository;
    private final ConversationMessageRepository messageRepository;
    private final MediaFileRepository mediaFileRepository;
    private final TokenUsageRepository tokenUsageRepository;
    private final EvaluationRepository evaluationRepository;
    private final ResumeRepository resumeRepository;
    private final AuditLogRepository auditLogRepository;
    private final ActiveModeRepository activeModeRepository;
    private final EntityManager entityManager;
    private final TransactionTemplate transactionTemplate;
    private final Retry dataStoreRetry;
    private final ObjectMapper objectMapper;

    // ─── Sessions ───────────────────────────────────────────────────────

    @Override
    public InterviewSession saveSession(InterviewSession session) {
        return withRetry("save session", () -> sessionRepository.save(session));
    }

    @Override
    public Optional<InterviewSession> findSession(String sessionId) {
        return withRetry("get session", () -> sessionRepository.findById(sessionId));
    }

    @Override
    public List<InterviewSession> listSessions(int limit, int offset, String userId) {
        return withRetry("list sessions", () -> {
            String jpql = userId == null
                    ? "select s from InterviewSession s order by s.createdAt desc, s.id desc"
                    : "select s from InterviewSession s where s.userId = :userId order by s.createdAt desc, s.id desc";
            TypedQuery<InterviewSession> query = entityManager.createQuery(jpql, InterviewSession.class);
            if (userId != null) {
                query.setParameter("userId", userId);
            }
            return query.setFirstResult(offset).setMaxResults(limit).getResultList();
        });
    }

    @Override
    public long countSessions() {
        return withRetry("count sessions", sessionRepository::count);
    }

    @Override
    public boolean sessionExists(String sessionId) {
        return withRetry("check session", () -> sessionRepository.existsById(sessionId));
    }

    @Override
    public boolean deleteSession(String sessionId) {
        Boolean deleted = withRetry("delete session", () -> transactionTemplate.execute(status -> {
            if (!sessionRepository.existsById(sessionId)) {
                return false;
            }
            messageRepository.deleteBySessionId(sessionId);
            mediaFileRepository.deleteBySessionId(sessionId);
            tokenUsageRepository.deleteBySessionId(sessionId);
            evaluationRepository.findById(sessionId).ifPresent(evaluationRepository::delete);
            activeModeRepository.findById(sessionId).ifPresent(activeModeRepository::delete);
            sessionRepository.deleteById(sessionId);
            return true;
        }));
        return Boolean.TRUE.equals(deleted);
    }

    // ─── Conversation ───────────────────────────────────────────────────

    @Override
    public ConversationMessage saveMessage(ConversationMessage message) {
        return withRetry("append message", () -> messageRepository.save(message));
    }

    @Override
    public List<ConversationMessage> getMessages(String sessionId) {
        return withRetry("get messages", () -> messageRepository.findBySessionIdOrderBySequenceAsc(sessionId));
    }

    @Override
    public Optional<ConversationMessage> findLastMessage(String sessionId) {
        return withRetry("get last message",
                () -> messageRepository.findFirstBySessionIdOrderBySequenceDesc(sessionId));
    }

    // ─── Media ──────────────────────────────────────────────────────────

    @Override
    public MediaFile saveMediaFile(MediaFile mediaFile) {
        return withRetry("save media file", () -> mediaFileRepository.save(mediaFile));
    }

    @Override
    public List<MediaFile> getMediaFiles(String sessionId) {
        return withRetry("get media files",
                () -> mediaFileRepository.findBySessionIdOrderByKindAscSequenceAsc(sessionId));
    }

    @Override
    public List<MediaFile> getMediaFiles(String sessionId, MediaKind kind) {
        return withRetry("get media files",
                () -> mediaFileRepository.findBySessionIdAndKindOrderBySequenceAsc(sessionId, kind));
    }

    @Override
    public int nextMediaSequence(String sessionId, MediaKind kind) {
        return withRetry("next media sequence", () -> mediaFileRepository.findMaxSequence(sessionId, kind) + 1);
    }

    // ─── Token usage ────────────────────────────────────────────────────

    @Override
    public TokenUsageRecord saveTokenUsage(TokenUsageRecord record) {
        return withRetry("save token usage", () -> tokenUsageRepository.save(record));
    }

    @Override
    public List<TokenUsageRecord> getTokenUsage(String sessionId) {
        return withRetry("get token usage", () -> tokenUsageRepository.findBySessionIdOrderByRecordedAtAsc(sessionId));
    }

    // ─── Evaluations ────────────────────────────────────────────────────

    @Override
    public EvaluationReport saveEvaluation(EvaluationReport report) {
        EvaluationRecord record = toRecord(report);
        if (withRetry("check evaluation", () -> evaluationRepository.existsById(report.getSessionId()))) {
            throw evaluationExists(report.getSessionId());
        }
        withRetry("save evaluation", () -> evaluationRepository.save(record));
        return report;
    }

    @Override
    public Optional<EvaluationReport> findEvaluation(String sessionId) {
        return withRetry("get evaluation", () -> evaluationRepository.findById(sessionId)).map(this::fromRecord);
    }

    @Override
    public InterviewSession completeSession(InterviewSession session, EvaluationReport report) {
        EvaluationRecord record = toRecord(report);
        return withRetry("complete session", () -> transactionTemplate.execute(status -> {
            if (!sessionRepository.existsById(session.getId())) {
                throw InterviewPlatformException.sessionNotFound(session.getId());
            }
            if (evaluationRepository.existsById(session.getId())) {
                throw evaluationExists(session.getId());
            }
            InterviewSession saved = sessionRepository.save(session);
            evaluationRepository.save(record);
            return saved;
        }));
    }

    // ─── Resumes, audit, modes ──────────────────────────────────────────

    @Override
    public ResumeData saveResume(ResumeData resume) {
        ResumeRecord record = new ResumeRecord(resume.getUserId(), resume.getYearsOfExperience(),
                resume, LocalDateTime.now());
        withRetry("save resume", () -> resumeRepository.save(record));
        return resume;
    }

    @Override
    public Optional<ResumeData> findResume(String userId) {
        return withRetry("get resume", () -> resumeRepository.findById(userId)).map(ResumeRecord::getPayload);
    }

    /** Not retried: audit rows use generated keys, so a repeat would duplicate the entry. */
    @Override
    public void appendAuditLog(String component, String operation, String sessionId, String message) {
        try {
            auditLogRepository.save(new AuditLogEntry(component, operation, sessionId, message));
        } catch (DataAccessException e) {
            throw InterviewPlatformException.dataStore("database write failed for audit log: " + e.getMessage(), e);
        }
    }

    @Override
    public List<AuditLogEntry> getAuditLog(String sessionId) {
        return withRetry("get audit log", () -> auditLogRepository.findBySessionIdOrderByIdAsc(sessionId));
    }

    @Override
    public void saveActiveModes(String sessionId, Set<CommunicationMode> modes) {
        ActiveModeSet row = new ActiveModeSet(sessionId, new LinkedHashSet<>(modes), LocalDateTime.now());
        withRetry("save active modes", () -> activeModeRepository.save(row));
    }

    @Override
    public Set<CommunicationMode> getActiveModes(String sessionId) {
        return withRetry("get active modes", () -> activeModeRepository.findById(sessionId))
                .map(row -> (Set<CommunicationMode>) new LinkedHashSet<>(row.getModes()))
                .orElseGet(LinkedHashSet::new);
    }

    @Override
    public boolean healthCheck() {
        try {
            sessionRepository.count();
            return true;
        } catch (DataAccessException | PersistenceException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    // ─── Helpers ────────────────────────────────────────────────────────

    private <T> T withRetry(String operation, Supplier<T> action) {
        try {
            return Retry.decorateSupplier(dataStoreRetry, action).get();
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            log.error("Database operation '{}' failed after retries: {}", operation, e.getMessage(), e);
            throw InterviewPlatformException.dataStore(
                    "database operation '" + operation + "' failed: " + e.getMessage(), e);
        }
    }

    private static InterviewPlatformException evaluationExists(String sessionId) {
        return InterviewPlatformException.configuration("evaluation",
                "Evaluation for session " + sessionId + " already exists");
    }

    private EvaluationRecord toRecord(EvaluationReport report) {
        Map<String, List<FeedbackItem>> feedback = new LinkedHashMap<>();
        feedback.put(WENT_WELL, report.getWentWell());
        feedback.put(WENT_OKAY, report.getWentOkay());
        feedback.put(NEEDS_IMPROVEMENT, report.getNeedsImprovement());
        try {
            return EvaluationRecord.builder()
                    .sessionId(report.getSessionId())
                    .overallScore(report.getOverallScore())
                    .competencyScoresJson(objectMapper.writeValueAsString(report.getCompetencyScores()))
                    .feedbackJson(objectMapper.writeValueAsString(feedback))
                    .communicationAnalysisJson(objectMapper.writeValueAsString(report.getCommunicationModeAnalysis()))
                    .improvementPlanJson(objectMapper.writeValueAsString(report.getImprovementPlan()))
                    .createdAt(report.getCreatedAt() != null ? report.getCreatedAt() : LocalDateTime.now())
                    .build();
        } catch (JsonProcessingException e) {
            throw InterviewPlatformException.dataStore("evaluation report could not be serialized for the database", e);
        }
    }

    private EvaluationReport fromRecord(EvaluationRecord record) {
        try {
            Map<String, List<FeedbackItem>> feedback = objectMapper.readValue(record.getFeedbackJson(), FEEDBACK_MAP);
            return EvaluationReport.builder()
                    .sessionId(record.getSessionId())
                    .overallScore(record.getOverallScore())
                    .competencyScores(objectMapper.readValue(record.getCompetencyScoresJson(), COMPETENCY_MAP))
                    .wentWell(feedback.getOrDefault(WENT_WELL, List.of()))
                    .wentOkay(feedback.getOrDefault(WENT_OKAY, List.of()))
                    .needsImprovement(feedback.getOrDefault(NEEDS_IMPROVEMENT, List.of()))
                    .communicationModeAnalysis(
                            objectMapper.readValue(record.getCommunicationAnalysisJson(), ModeAnalysis.class))
                    .improvementPlan(objectMapper.readValue(record.getImprovementPlanJson(), ImprovementPlan.class))
                    .createdAt(record.getCreatedAt())
                    .build();
        } catch (JsonProcessingException e) {
            throw InterviewPlatformException.dataStore(
                    "stored evaluation for session " + record.getSessionId() + " in the database is corrupt", e);
        }
    }
}
