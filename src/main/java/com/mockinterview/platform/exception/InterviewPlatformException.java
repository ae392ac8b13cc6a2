package com.mockinterview.platform.exception;

import lombok.Getter;

/**
 * Single exception type for all platform failures, tagged with an {@link ErrorKind}
 * and the subsystem that failed (e.g. "database", "provider credentials").
 */
@Getter
public class InterviewPlatformException extends RuntimeException {

    private final ErrorKind kind;
    private final String subsystem;

    public InterviewPlatformException(ErrorKind kind, String subsystem, String message) {
        super(message);
        this.kind = kind;
        this.subsystem = subsystem;
    }

    public InterviewPlatformException(ErrorKind kind, String subsystem, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.subsystem = subsystem;
    }

    public static InterviewPlatformException configuration(String message) {
        return new InterviewPlatformException(ErrorKind.CONFIGURATION, "session configuration", message);
    }

    public static InterviewPlatformException configuration(String subsystem, String message) {
        return new InterviewPlatformException(ErrorKind.CONFIGURATION, subsystem, message);
    }

    public static InterviewPlatformException aiProvider(String subsystem, String message, Throwable cause) {
        return new InterviewPlatformException(ErrorKind.AI_PROVIDER, subsystem, message, cause);
    }

    public static InterviewPlatformException dataStore(String message, Throwable cause) {
        return new InterviewPlatformException(ErrorKind.DATA_STORE, "database", message, cause);
    }

    public static InterviewPlatformException communication(String message, Throwable cause) {
        return new InterviewPlatformException(ErrorKind.COMMUNICATION, "file storage", message, cause);
    }

    public static InterviewPlatformException sessionNotFound(String sessionId) {
        return configuration("session lifecycle", "Session " + sessionId + " not found");
    }
}
