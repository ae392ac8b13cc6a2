package com.mockinterview.platform.service;

import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.llm.LlmGateway;
import com.mockinterview.platform.model.ResumeData;
import com.mockinterview.platform.model.SessionConfig;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a session configuration before anything is written.
 */
@Component
@RequiredArgsConstructor
public class SessionConfigValidator {

    private static final int MAX_DURATION_MINUTES = 240;

    private final Validator validator;
    private final LlmGateway llmGateway;

    public void validate(SessionConfig config) {
        if (config == null) {
            throw InterviewPlatformException.configuration("Session configuration is required");
        }
        if (config.getEnabledModes().isEmpty()) {
            throw InterviewPlatformException.configuration("At least one communication mode must be enabled");
        }
        if (isBlank(config.getAiProvider()) || isBlank(config.getAiModel())) {
            throw InterviewPlatformException.configuration("ai_provider and ai_model are required");
        }
        if (!llmGateway.isRecognized(config.getAiProvider(), config.getAiModel())) {
            throw InterviewPlatformException.configuration(
                    "Unrecognized provider/model pairing: " + config.getAiProvider() + "/" + config.getAiModel());
        }
        Integer duration = config.getDurationMinutes();
        if (duration != null && (duration < 1 || duration > MAX_DURATION_MINUTES)) {
            throw InterviewPlatformException.configuration(
                    "duration_minutes must be between 1 and " + MAX_DURATION_MINUTES);
        }
        if (config.hasResume()) {
            Set<ConstraintViolation<ResumeData>> violations = validator.validate(config.getResumeData());
            if (!violations.isEmpty()) {
                String message = violations.stream()
                        .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                        .map(ConstraintViolation::getMessage)
                        .collect(Collectors.joining("; "));
                throw InterviewPlatformException.configuration("resume", "Invalid resume data: " + message);
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
