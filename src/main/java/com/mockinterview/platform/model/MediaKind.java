package com.mockinterview.platform.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of stored media. Each kind names its directory, file prefix and extension,
 * so a sequence number alone determines the file name.
 */
public enum MediaKind {
    WHITEBOARD("whiteboard", "snapshot", "png", CommunicationMode.WHITEBOARD),
    SCREEN("screen", "capture", "png", CommunicationMode.SCREEN_SHARE),
    AUDIO("audio", "recording", "wav", CommunicationMode.AUDIO),
    VIDEO("video", "recording", "webm", CommunicationMode.VIDEO);

    private final String value;
    private final String filePrefix;
    private final String extension;
    private final CommunicationMode mode;

    MediaKind(String value, String filePrefix, String extension, CommunicationMode mode) {
        this.value = value;
        this.filePrefix = filePrefix;
        this.extension = extension;
        this.mode = mode;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public CommunicationMode mode() {
        return mode;
    }

    public String fileName(int sequence) {
        return String.format("%s_%03d.%s", filePrefix, sequence, extension);
    }
}
