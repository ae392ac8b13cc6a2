package com.mockinterview.platform.service;

import com.mockinterview.platform.config.StorageProperties;
import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.model.MediaKind;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Session-scoped, write-once media storage on the local file system.
 * Layout: {@code <sessions-dir>/<session-id>/<kind>/<file>}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FileStorageService {

    private final StorageProperties storageProperties;

    @PostConstruct
    public void initialize() {
        try {
            Files.createDirectories(root());
            log.info("FileStorageService initialized with local storage at {}", root().toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to create sessions directory {}: {}", root(), e.getMessage());
        }
    }

    public Path write(String sessionId, MediaKind kind, int sequence, byte[] data) {
        Path target = root().resolve(sessionId).resolve(kind.value()).resolve(kind.fileName(sequence));
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.debug("Stored {} bytes at {}", data.length, target);
            return target;
        } catch (IOException e) {
            log.error("Error writing media file {}: {}", target, e.getMessage());
            throw InterviewPlatformException.communication(
                    "file storage could not write " + target + ": " + e.getMessage(), e);
        }
    }

    /** Removes a file whose metadata row could not be recorded. */
    public void discard(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.error("Could not remove orphaned media file {}: {}", file, e.getMessage());
        }
    }

    public void deleteSessionFiles(String sessionId) {
        Path sessionDir = root().resolve(sessionId);
        try {
            if (FileSystemUtils.deleteRecursively(sessionDir)) {
                log.info("Deleted media directory {}", sessionDir);
            }
        } catch (IOException e) {
            throw InterviewPlatformException.communication(
                    "file storage could not delete " + sessionDir + ": " + e.getMessage(), e);
        }
    }

    private Path root() {
        return Paths.get(storageProperties.getSessionsDir());
    }
}
