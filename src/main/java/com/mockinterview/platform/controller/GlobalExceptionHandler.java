package com.mockinterview.platform.controller;

import com.mockinterview.platform.exception.ErrorKind;
import com.mockinterview.platform.exception.InterviewPlatformException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

/**
 * Maps platform errors onto HTTP statuses with an {@link ApiError} body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InterviewPlatformException.class)
    ResponseEntity<ApiError> handlePlatformError(InterviewPlatformException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            log.error("{} failure in {}: {}", ex.getKind(), ex.getSubsystem(), ex.getMessage(), ex);
        } else {
            log.warn("Rejected request ({}): {}", ex.getSubsystem(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ApiError(ex.getKind().name(), ex.getSubsystem(), ex.getMessage(), Instant.now()));
    }

    /**
     * Malformed bodies, missing parameters and oversized uploads (HTTP 400).
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class,
            MaxUploadSizeExceededException.class
    })
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiError(ErrorKind.CONFIGURATION.name(), "request", ex.getMessage(), Instant.now()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex) {
        return ResponseEntity.status(ex.getStatusCode())
                .body(new ApiError(String.valueOf(ex.getStatusCode().value()), "request",
                        ex.getReason(), Instant.now()));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse) {
            ErrorResponse framework = (ErrorResponse) ex;
            return ResponseEntity.status(framework.getStatusCode())
                    .body(new ApiError(String.valueOf(framework.getStatusCode().value()), "request",
                            ex.getMessage(), Instant.now()));
        }
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("INTERNAL", "server", "Unexpected server error", Instant.now()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case CONFIGURATION -> HttpStatus.BAD_REQUEST;
            case AI_PROVIDER -> HttpStatus.BAD_GATEWAY;
            case DATA_STORE -> HttpStatus.SERVICE_UNAVAILABLE;
            case COMMUNICATION -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
