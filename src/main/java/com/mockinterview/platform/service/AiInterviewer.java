package com.mockinterview.platform.service;

import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.llm.LlmCompletion;
import com.mockinterview.platform.llm.LlmGateway;
import com.mockinterview.platform.model.*;
import com.mockinterview.platform.store.DataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives the interview conversation. Holds no state of its own: the persisted messages
 * of a session are the conversation.
 * <p>
 * Provider calls are made at most once. A failed call leaves no interviewer turn behind,
 * while candidate input that was already stored stays stored. Every append re-checks
 * under the conversation lock that the session is active and not being ended.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AiInterviewer {

    public static final String START_INTERVIEW = "start_interview";
    public static final String PROCESS_RESPONSE = "process_response";

    private final DataStore dataStore;
    private final LlmGateway llmGateway;
    private final TokenTracker tokenTracker;
    private final PromptService promptService;
    private final SessionLockRegistry lockRegistry;

    public ConversationMessage startInterview(String sessionId) {
        InterviewSession session = requireActive(sessionId);
        requireNotStarted(sessionId);
        log.info("Starting interview for session {} (resume: {})", sessionId, session.getResumeData() != null);

        String prompt = promptService.openingPrompt(session.getResumeData());
        String opening = generate(session, prompt, START_INTERVIEW);
        return lockRegistry.withLock(sessionId, SessionLockRegistry.CONVERSATION, () -> {
            requireNotStarted(sessionId);
            return append(sessionId, MessageRole.INTERVIEWER, opening);
        });
    }

    public ConversationMessage processResponse(String sessionId, String candidateText) {
        if (candidateText == null || candidateText.isBlank()) {
            throw InterviewPlatformException.configuration("conversation", "Candidate response must not be blank");
        }
        InterviewSession session = requireActive(sessionId);

        append(sessionId, MessageRole.CANDIDATE, candidateText.trim());
        List<ConversationMessage> history = dataStore.getMessages(sessionId);

        String reply = generate(session, promptService.followUpPrompt(history), PROCESS_RESPONSE);
        return append(sessionId, MessageRole.INTERVIEWER, reply);
    }

    public List<ConversationMessage> getConversationHistory(String sessionId) {
        if (!dataStore.sessionExists(sessionId)) {
            throw InterviewPlatformException.sessionNotFound(sessionId);
        }
        return dataStore.getMessages(sessionId);
    }

    private String generate(InterviewSession session, String prompt, String operation) {
        LlmCompletion completion;
        try {
            completion = llmGateway.generate(session.getConfig(), prompt);
        } catch (InterviewPlatformException e) {
            log.error("{} failed for session {}: {}", operation, session.getId(), e.getMessage());
            throw e;
        }
        tokenTracker.recordUsage(session.getId(), operation, completion.getInputTokens(), completion.getOutputTokens());

        String text = completion.getText() == null ? "" : completion.getText().trim();
        if (text.isEmpty()) {
            throw InterviewPlatformException.aiProvider("provider response",
                    session.getAiProvider() + " returned an empty interviewer turn for " + operation, null);
        }
        return text;
    }

    private ConversationMessage append(String sessionId, MessageRole role, String content) {
        return lockRegistry.withLock(sessionId, SessionLockRegistry.CONVERSATION, () -> {
            lockRegistry.requireInputOpen(sessionId);
            requireActive(sessionId);
            Optional<ConversationMessage> last = dataStore.findLastMessage(sessionId);
            LocalDateTime now = LocalDateTime.now();
            LocalDateTime timestamp = last.map(ConversationMessage::getTimestamp)
                    .filter(previous -> previous.isAfter(now))
                    .orElse(now);
            ConversationMessage message = ConversationMessage.builder()
                    .id(UUID.randomUUID().toString())
                    .sessionId(sessionId)
                    .sequence(last.map(m -> m.getSequence() + 1).orElse(1))
                    .role(role)
                    .content(content)
                    .timestamp(timestamp)
                    .build();
            return dataStore.saveMessage(message);
        });
    }

    private void requireNotStarted(String sessionId) {
        if (dataStore.findLastMessage(sessionId).isPresent()) {
            throw InterviewPlatformException.configuration("session lifecycle",
                    "Interview for session " + sessionId + " has already started");
        }
    }

    private InterviewSession requireActive(String sessionId) {
        InterviewSession session = dataStore.findSession(sessionId)
                .orElseThrow(() -> InterviewPlatformException.sessionNotFound(sessionId));
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw InterviewPlatformException.configuration("session lifecycle",
                    "Session " + sessionId + " is " + session.getStatus().value() + ", expected active");
        }
        return session;
    }
}
