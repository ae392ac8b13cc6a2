package com.mockinterview.platform.store;

import com.mockinterview.platform.model.*;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence boundary for sessions and everything recorded against them.
 * <p>
 * Implementations hold no business rules. Transient failures are retried here and
 * nowhere else; once the retry budget is spent a {@code DATA_STORE} error is raised.
 */
public interface DataStore {

    InterviewSession saveSession(InterviewSession session);

    Optional<InterviewSession> findSession(String sessionId);

    /** Sessions ordered by creation time, newest first. {@code userId} may be null. */
    List<InterviewSession> listSessions(int limit, int offset, String userId);

    long countSessions();

    boolean sessionExists(String sessionId);

    /**
     * Removes a session with its messages, media rows, usage, evaluation and active modes.
     *
     * @return false when no such session exists
     */
    boolean deleteSession(String sessionId);

    ConversationMessage saveMessage(ConversationMessage message);

    List<ConversationMessage> getMessages(String sessionId);

    Optional<ConversationMessage> findLastMessage(String sessionId);

    MediaFile saveMediaFile(MediaFile mediaFile);

    List<MediaFile> getMediaFiles(String sessionId);

    List<MediaFile> getMediaFiles(String sessionId, MediaKind kind);

    int nextMediaSequence(String sessionId, MediaKind kind);

    TokenUsageRecord saveTokenUsage(TokenUsageRecord record);

    List<TokenUsageRecord> getTokenUsage(String sessionId);

    /** Stores a report for a session that has none yet. */
    EvaluationReport saveEvaluation(EvaluationReport report);

    Optional<EvaluationReport> findEvaluation(String sessionId);

    /**
     * Writes the completed session row and its report in one transaction.
     * Fails if the session has been deleted or already carries a report.
     */
    InterviewSession completeSession(InterviewSession session, EvaluationReport report);

    ResumeData saveResume(ResumeData resume);

    Optional<ResumeData> findResume(String userId);

    void appendAuditLog(String component, String operation, String sessionId, String message);

    List<AuditLogEntry> getAuditLog(String sessionId);

    void saveActiveModes(String sessionId, Set<CommunicationMode> modes);

    Set<CommunicationMode> getActiveModes(String sessionId);

    boolean healthCheck();
}
