package com.mockinterview.platform.controller;

import com.mockinterview.platform.exception.ErrorKind;
import com.mockinterview.platform.exception.InterviewPlatformException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void everyErrorKindHasAStatus() {
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.CONFIGURATION)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.AI_PROVIDER)).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.DATA_STORE)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.COMMUNICATION)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void platformErrorBodyCarriesKindAndSubsystem() {
        ResponseEntity<ApiError> response = handler.handlePlatformError(
                InterviewPlatformException.aiProvider("provider quota", "openai rate limit exceeded", null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().getError()).isEqualTo("AI_PROVIDER");
        assertThat(response.getBody().getSubsystem()).isEqualTo("provider quota");
        assertThat(response.getBody().getMessage()).isEqualTo("openai rate limit exceeded");
    }

    @Test
    void responseStatusIsPreserved() {
        ResponseEntity<ApiError> response = handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.NOT_FOUND, "No evaluation for session s-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getMessage()).isEqualTo("No evaluation for session s-1");
    }

    @Test
    void unexpectedErrorsHideDetails() {
        ResponseEntity<ApiError> response = handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).isEqualTo("Unexpected server error");
    }
}
