package com.mockinterview.platform.controller;

import com.mockinterview.platform.dto.*;
import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.model.*;
import com.mockinterview.platform.service.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class InterviewController {

    private final SessionManager sessionManager;
    private final AiInterviewer aiInterviewer;
    private final CommunicationManager communicationManager;
    private final TokenTracker tokenTracker;
    private final EvaluationManager evaluationManager;

    // ─── Sessions ───────────────────────────────────────────────────────

    @PostMapping
    public SessionResponse createSession(@RequestBody CreateSessionRequest request) {
        return SessionResponse.from(sessionManager.createSession(request.toConfig()));
    }

    @GetMapping
    public SessionListResponse listSessions(@RequestParam(required = false) Integer limit,
                                            @RequestParam(required = false) Integer offset,
                                            @RequestParam(name = "user_id", required = false) String userId) {
        List<SessionResponse> sessions = sessionManager.listSessions(limit, offset, userId).stream()
                .map(SessionResponse::from)
                .collect(Collectors.toList());
        return new SessionListResponse(sessions, sessionManager.countSessions(),
                limit == null ? SessionManager.DEFAULT_LIMIT : limit,
                offset == null ? 0 : offset);
    }

    @GetMapping("/{sessionId}")
    public SessionResponse getSession(@PathVariable String sessionId) {
        return SessionResponse.from(sessionManager.getSession(sessionId));
    }

    @PostMapping("/{sessionId}/start")
    public SessionResponse startSession(@PathVariable String sessionId) {
        return SessionResponse.from(sessionManager.startSession(sessionId));
    }

    @PostMapping("/{sessionId}/pause")
    public SessionResponse pauseSession(@PathVariable String sessionId) {
        return SessionResponse.from(sessionManager.pauseSession(sessionId));
    }

    @PostMapping("/{sessionId}/resume")
    public SessionResponse resumeSession(@PathVariable String sessionId) {
        return SessionResponse.from(sessionManager.resumeSession(sessionId));
    }

    @PostMapping("/{sessionId}/end")
    public EvaluationReport endSession(@PathVariable String sessionId) {
        return sessionManager.endSession(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    public Map<String, String> deleteSession(@PathVariable String sessionId) {
        sessionManager.deleteSession(sessionId);
        return Map.of("message", "Session deleted", "session_id", sessionId);
    }

    // ─── Conversation ───────────────────────────────────────────────────

    @PostMapping("/{sessionId}/interview/start")
    public MessageResponse startInterview(@PathVariable String sessionId) {
        return MessageResponse.from(aiInterviewer.startInterview(sessionId));
    }

    @PostMapping("/{sessionId}/responses")
    public MessageResponse processResponse(@PathVariable String sessionId,
                                           @RequestBody CandidateResponseRequest request) {
        log.info("Candidate response received for session {} ({} chars)", sessionId,
                request.getContent() == null ? 0 : request.getContent().length());
        return MessageResponse.from(aiInterviewer.processResponse(sessionId, request.getContent()));
    }

    @GetMapping("/{sessionId}/messages")
    public List<MessageResponse> getMessages(@PathVariable String sessionId) {
        return aiInterviewer.getConversationHistory(sessionId).stream()
                .map(MessageResponse::from)
                .collect(Collectors.toList());
    }

    // ─── Modes and media ────────────────────────────────────────────────

    @GetMapping("/{sessionId}/modes")
    public Set<CommunicationMode> getActiveModes(@PathVariable String sessionId) {
        return communicationManager.getActiveModes(sessionId);
    }

    @PutMapping("/{sessionId}/modes/{mode}")
    public Set<CommunicationMode> enableMode(@PathVariable String sessionId, @PathVariable String mode) {
        return communicationManager.enableMode(sessionId, CommunicationMode.fromValue(mode));
    }

    @DeleteMapping("/{sessionId}/modes/{mode}")
    public Set<CommunicationMode> disableMode(@PathVariable String sessionId, @PathVariable String mode) {
        return communicationManager.disableMode(sessionId, CommunicationMode.fromValue(mode));
    }

    @PostMapping("/{sessionId}/whiteboard")
    public MediaUploadResponse uploadWhiteboard(@PathVariable String sessionId,
                                                @RequestParam("file") MultipartFile file) {
        return MediaUploadResponse.from(communicationManager.saveMedia(sessionId, MediaKind.WHITEBOARD, read(file)));
    }

    @PostMapping("/{sessionId}/screen")
    public MediaUploadResponse uploadScreenCapture(@PathVariable String sessionId,
                                                   @RequestParam("file") MultipartFile file) {
        return MediaUploadResponse.from(communicationManager.saveMedia(sessionId, MediaKind.SCREEN, read(file)));
    }

    @PostMapping("/{sessionId}/audio")
    public MediaUploadResponse uploadAudio(@PathVariable String sessionId,
                                           @RequestParam("file") MultipartFile file) {
        return MediaUploadResponse.from(communicationManager.saveMedia(sessionId, MediaKind.AUDIO, read(file)));
    }

    @PostMapping("/{sessionId}/video")
    public MediaUploadResponse uploadVideo(@PathVariable String sessionId,
                                           @RequestParam("file") MultipartFile file) {
        return MediaUploadResponse.from(communicationManager.saveMedia(sessionId, MediaKind.VIDEO, read(file)));
    }

    @GetMapping("/{sessionId}/media")
    public List<MediaFile> getMediaFiles(@PathVariable String sessionId) {
        return communicationManager.getMediaFiles(sessionId);
    }

    // ─── Usage and evaluation ───────────────────────────────────────────

    @GetMapping("/{sessionId}/usage")
    public TokenUsageSummary getUsage(@PathVariable String sessionId) {
        return tokenTracker.getSessionUsage(sessionId);
    }

    @GetMapping("/{sessionId}/usage/breakdown")
    public Map<String, TokenUsageSummary> getUsageBreakdown(@PathVariable String sessionId) {
        return tokenTracker.getUsageBreakdown(sessionId);
    }

    @GetMapping("/{sessionId}/cost")
    public Map<String, BigDecimal> getTotalCost(@PathVariable String sessionId) {
        return Map.of("total_cost", tokenTracker.getTotalCost(sessionId));
    }

    @GetMapping("/{sessionId}/evaluation")
    public EvaluationReport getEvaluation(@PathVariable String sessionId) {
        return evaluationManager.getEvaluation(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No evaluation for session " + sessionId));
    }

    @PostMapping("/{sessionId}/evaluation")
    public EvaluationReport generateEvaluation(@PathVariable String sessionId) {
        return evaluationManager.generateEvaluation(sessionId);
    }

    private static byte[] read(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw InterviewPlatformException.communication("could not read uploaded file " + file.getOriginalFilename(), e);
        }
    }
}
