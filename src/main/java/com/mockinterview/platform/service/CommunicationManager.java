package com.mockinterview.platform.service;

import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.model.*;
import com.mockinterview.platform.store.DataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Active communication modes and media artifacts for a session.
 * <p>
 * Media sequence numbers are assigned under a per-(session, kind) lock and backed by a
 * unique (session, kind, sequence) constraint, so concurrent saves yield a gap-free run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CommunicationManager {

    private final DataStore dataStore;
    private final FileStorageService fileStorage;
    private final SessionLockRegistry lockRegistry;

    // ─── Modes ──────────────────────────────────────────────────────────

    public Set<CommunicationMode> enableMode(String sessionId, CommunicationMode mode) {
        InterviewSession session = requireSession(sessionId);
        requireConfigured(session, mode);
        return lockRegistry.withLock(sessionId, SessionLockRegistry.MODES, () -> {
            Set<CommunicationMode> active = dataStore.getActiveModes(sessionId);
            if (active.add(mode)) {
                dataStore.saveActiveModes(sessionId, active);
                log.info("Enabled {} for session {}", mode.value(), sessionId);
            }
            return active;
        });
    }

    public Set<CommunicationMode> disableMode(String sessionId, CommunicationMode mode) {
        InterviewSession session = requireSession(sessionId);
        requireConfigured(session, mode);
        return lockRegistry.withLock(sessionId, SessionLockRegistry.MODES, () -> {
            Set<CommunicationMode> active = dataStore.getActiveModes(sessionId);
            if (active.remove(mode)) {
                dataStore.saveActiveModes(sessionId, active);
                log.info("Disabled {} for session {}", mode.value(), sessionId);
            }
            return active;
        });
    }

    public Set<CommunicationMode> getActiveModes(String sessionId) {
        requireSession(sessionId);
        return dataStore.getActiveModes(sessionId);
    }

    void activateConfiguredModes(InterviewSession session) {
        lockRegistry.withLock(session.getId(), SessionLockRegistry.MODES, () -> {
            dataStore.saveActiveModes(session.getId(), new LinkedHashSet<>(session.getEnabledModes()));
            return null;
        });
    }

    void deactivateAllModes(String sessionId) {
        lockRegistry.withLock(sessionId, SessionLockRegistry.MODES, () -> {
            dataStore.saveActiveModes(sessionId, new LinkedHashSet<>());
            return null;
        });
    }

    // ─── Media ──────────────────────────────────────────────────────────

    /** Stores a whiteboard snapshot and returns its storage path. */
    public String saveWhiteboard(String sessionId, byte[] snapshot) {
        return saveMedia(sessionId, MediaKind.WHITEBOARD, snapshot).getFilePath();
    }

    public String saveScreenCapture(String sessionId, byte[] capture) {
        return saveMedia(sessionId, MediaKind.SCREEN, capture).getFilePath();
    }

    public String saveAudio(String sessionId, byte[] recording) {
        return saveMedia(sessionId, MediaKind.AUDIO, recording).getFilePath();
    }

    public String saveVideo(String sessionId, byte[] recording) {
        return saveMedia(sessionId, MediaKind.VIDEO, recording).getFilePath();
    }

    public MediaFile saveMedia(String sessionId, MediaKind kind, byte[] data) {
        if (data == null || data.length == 0) {
            throw InterviewPlatformException.configuration("media", kind.value() + " data must not be empty");
        }
        InterviewSession session = requireSession(sessionId);
        requireNotCompleted(session);
        requireConfigured(session, kind.mode());

        return lockRegistry.withLock(sessionId, SessionLockRegistry.MEDIA + kind.value(), () -> {
            lockRegistry.requireInputOpen(sessionId);
            requireNotCompleted(requireSession(sessionId));
            int sequence = dataStore.nextMediaSequence(sessionId, kind);
            Path path = fileStorage.write(sessionId, kind, sequence, data);
            MediaFile mediaFile = MediaFile.builder()
                    .id(UUID.randomUUID().toString())
                    .sessionId(sessionId)
                    .kind(kind)
                    .filePath(path.toString())
                    .sequence(sequence)
                    .sizeBytes((long) data.length)
                    .createdAt(LocalDateTime.now())
                    .build();
            try {
                dataStore.saveMediaFile(mediaFile);
            } catch (RuntimeException e) {
                fileStorage.discard(path);
                throw e;
            }
            log.info("Saved {} #{} for session {}", kind.value(), sequence, sessionId);
            return mediaFile;
        });
    }

    public List<MediaFile> getMediaFiles(String sessionId) {
        requireSession(sessionId);
        return dataStore.getMediaFiles(sessionId);
    }

    // ─── Helpers ────────────────────────────────────────────────────────

    private InterviewSession requireSession(String sessionId) {
        return dataStore.findSession(sessionId)
                .orElseThrow(() -> InterviewPlatformException.sessionNotFound(sessionId));
    }

    private static void requireNotCompleted(InterviewSession session) {
        if (session.getStatus() == SessionStatus.COMPLETED) {
            throw InterviewPlatformException.configuration("media",
                    "Session " + session.getId() + " has ended, media can no longer be recorded");
        }
    }

    private static void requireConfigured(InterviewSession session, CommunicationMode mode) {
        if (mode == null || !session.getEnabledModes().contains(mode)) {
            throw InterviewPlatformException.configuration(
                    "Mode " + (mode == null ? "null" : mode.value()) + " is not configured for session " + session.getId());
        }
    }
}
