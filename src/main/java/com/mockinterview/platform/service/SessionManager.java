package com.mockinterview.platform.service;

import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.model.*;
import com.mockinterview.platform.store.DataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Session lifecycle: created → active ⇄ paused → completed.
 * <p>
 * Lifecycle calls for one session are serialized. Ending a session first fences off
 * conversation and media input, then runs the evaluation pipeline and stores the
 * completed status together with the report. A failed evaluation lifts the fence and
 * leaves the session where it was.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionManager {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    private static final String COMPONENT = "SessionManager";

    private final DataStore dataStore;
    private final SessionConfigValidator validator;
    private final CommunicationManager communicationManager;
    private final EvaluationManager evaluationManager;
    private final FileStorageService fileStorage;
    private final SessionLockRegistry lockRegistry;

    public InterviewSession createSession(SessionConfig config) {
        validator.validate(config);

        String sessionId = UUID.randomUUID().toString();
        String userId = config.hasResume()
                ? config.getResumeData().getUserId()
                : "user_" + sessionId.substring(0, 8);

        if (config.hasResume()) {
            dataStore.saveResume(config.getResumeData());
        }
        InterviewSession session = InterviewSession.builder()
                .id(sessionId)
                .userId(userId)
                .status(SessionStatus.CREATED)
                .enabledModes(config.getEnabledModes())
                .aiProvider(config.getAiProvider().toLowerCase())
                .aiModel(config.getAiModel())
                .resumeData(config.getResumeData())
                .durationMinutes(config.getDurationMinutes())
                .createdAt(LocalDateTime.now())
                .build();
        InterviewSession saved = dataStore.saveSession(session);

        String modes = config.getEnabledModes().stream().map(CommunicationMode::value).collect(Collectors.joining(","));
        log.info("Created session {} for {} ({}/{}, modes {})",
                sessionId, userId, session.getAiProvider(), session.getAiModel(), modes);
        audit(sessionId, "create_session", "Session created with modes " + modes);
        return saved;
    }

    public InterviewSession startSession(String sessionId) {
        return lockRegistry.withLock(sessionId, SessionLockRegistry.LIFECYCLE, () -> {
            InterviewSession session = requireStatus(sessionId, "start", SessionStatus.CREATED);
            session.setStatus(SessionStatus.ACTIVE);
            session.setStartedAt(LocalDateTime.now());
            InterviewSession saved = dataStore.saveSession(session);
            communicationManager.activateConfiguredModes(saved);
            log.info("Started session {}", sessionId);
            audit(sessionId, "start_session", "Session started");
            return saved;
        });
    }

    public InterviewSession pauseSession(String sessionId) {
        return lockRegistry.withLock(sessionId, SessionLockRegistry.LIFECYCLE, () -> {
            InterviewSession session = requireStatus(sessionId, "pause", SessionStatus.ACTIVE);
            session.setStatus(SessionStatus.PAUSED);
            InterviewSession saved = dataStore.saveSession(session);
            log.info("Paused session {}", sessionId);
            audit(sessionId, "pause_session", "Session paused");
            return saved;
        });
    }

    public InterviewSession resumeSession(String sessionId) {
        return lockRegistry.withLock(sessionId, SessionLockRegistry.LIFECYCLE, () -> {
            InterviewSession session = requireStatus(sessionId, "resume", SessionStatus.PAUSED);
            session.setStatus(SessionStatus.ACTIVE);
            InterviewSession saved = dataStore.saveSession(session);
            log.info("Resumed session {}", sessionId);
            audit(sessionId, "resume_session", "Session resumed");
            return saved;
        });
    }

    /**
     * Completes the session and returns its evaluation. Succeeds once per session.
     */
    public EvaluationReport endSession(String sessionId) {
        return lockRegistry.withLock(sessionId, SessionLockRegistry.LIFECYCLE, () -> {
            InterviewSession session = requireSession(sessionId);
            if (session.getStatus() == SessionStatus.COMPLETED) {
                throw InterviewPlatformException.configuration("session lifecycle",
                        "Session " + sessionId + " has already ended");
            }
            if (!session.getStatus().canTransitionTo(SessionStatus.COMPLETED)) {
                throw wrongStatus(session, "end");
            }

            lockRegistry.fenceInput(sessionId);
            try {
                EvaluationReport report;
                try {
                    report = evaluationManager.buildReport(session);
                } catch (InterviewPlatformException e) {
                    log.error("Evaluation failed for session {}, status left at {}: {}",
                            sessionId, session.getStatus().value(), e.getMessage());
                    throw e;
                }

                session.setStatus(SessionStatus.COMPLETED);
                session.setEndedAt(LocalDateTime.now());
                dataStore.completeSession(session, report);
                communicationManager.deactivateAllModes(sessionId);

                log.info("Ended session {} with overall score {}", sessionId, report.getOverallScore());
                audit(sessionId, "end_session", "Session completed with overall score " + report.getOverallScore());
                return report;
            } finally {
                lockRegistry.liftFence(sessionId);
            }
        });
    }

    public InterviewSession getSession(String sessionId) {
        return requireSession(sessionId);
    }

    public List<InterviewSession> listSessions(Integer limit, Integer offset, String userId) {
        int effectiveLimit = limit == null ? DEFAULT_LIMIT : limit;
        int effectiveOffset = offset == null ? 0 : offset;
        if (effectiveLimit < 1 || effectiveLimit > MAX_LIMIT) {
            throw InterviewPlatformException.configuration("pagination",
                    "limit must be between 1 and " + MAX_LIMIT);
        }
        if (effectiveOffset < 0) {
            throw InterviewPlatformException.configuration("pagination", "offset must not be negative");
        }
        return dataStore.listSessions(effectiveLimit, effectiveOffset,
                userId == null || userId.isBlank() ? null : userId);
    }

    public long countSessions() {
        return dataStore.countSessions();
    }

    /**
     * Removes a session, its dependent rows and its media files. Not serialized with
     * {@link #endSession}: an evaluation still running for the session notices the
     * deletion and discards its results.
     */
    public void deleteSession(String sessionId) {
        if (!dataStore.deleteSession(sessionId)) {
            throw InterviewPlatformException.sessionNotFound(sessionId);
        }
        fileStorage.deleteSessionFiles(sessionId);
        log.info("Deleted session {}", sessionId);
        audit(sessionId, "delete_session", "Session deleted");
    }

    private InterviewSession requireSession(String sessionId) {
        return dataStore.findSession(sessionId)
                .orElseThrow(() -> InterviewPlatformException.sessionNotFound(sessionId));
    }

    private InterviewSession requireStatus(String sessionId, String operation, SessionStatus expected) {
        InterviewSession session = requireSession(sessionId);
        if (session.getStatus() != expected) {
            throw wrongStatus(session, operation);
        }
        return session;
    }

    private static InterviewPlatformException wrongStatus(InterviewSession session, String operation) {
        return InterviewPlatformException.configuration("session lifecycle",
                "Cannot " + operation + " session " + session.getId() + " while it is " + session.getStatus().value());
    }

    private void audit(String sessionId, String operation, String message) {
        try {
            dataStore.appendAuditLog(COMPONENT, operation, sessionId, message);
        } catch (InterviewPlatformException e) {
            log.warn("Audit entry for {} on session {} was not written: {}", operation, sessionId, e.getMessage(), e);
        }
    }
}
