package com.mockinterview.platform.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.mockinterview.platform.exception.InterviewPlatformException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Shared request/response handling for HTTP providers: bounded timeout, blocking
 * retrieval and mapping of HTTP and transport failures onto provider error subsystems.
 */
@Slf4j
public abstract class AbstractWebClientLlmClient implements LlmClient {

    protected final WebClient webClient;
    private final Duration timeout;

    protected AbstractWebClientLlmClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public LlmCompletion generate(String prompt, String model, double temperature, int maxOutputTokens) {
        JsonNode body;
        try {
            body = exchange(prompt, model, temperature, maxOutputTokens)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw mapStatus(e.getStatusCode(), e);
        } catch (InterviewPlatformException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                log.warn("{} call timed out after {}", provider(), timeout);
                throw InterviewPlatformException.aiProvider("provider availability",
                        provider() + " did not respond within " + timeout.toSeconds() + "s", cause);
            }
            if (cause instanceof WebClientRequestException) {
                log.warn("{} transport failure: {}", provider(), cause.getMessage());
                throw InterviewPlatformException.aiProvider("provider availability",
                        provider() + " is unreachable: " + cause.getMessage(), cause);
            }
            throw InterviewPlatformException.aiProvider("provider availability",
                    provider() + " call failed: " + cause.getMessage(), cause);
        }
        if (body == null) {
            throw InterviewPlatformException.aiProvider("provider response",
                    provider() + " returned an empty response", null);
        }
        return toCompletion(body);
    }

    protected abstract Mono<JsonNode> exchange(String prompt, String model, double temperature, int maxOutputTokens);

    protected abstract LlmCompletion toCompletion(JsonNode body);

    protected InterviewPlatformException missingApiKey() {
        return InterviewPlatformException.aiProvider("provider credentials",
                "No API key configured for " + provider(), null);
    }

    private InterviewPlatformException mapStatus(HttpStatusCode status, WebClientResponseException e) {
        int code = status.value();
        log.warn("{} returned HTTP {}: {}", provider(), code, e.getResponseBodyAsString());
        if (code == 401 || code == 403) {
            return InterviewPlatformException.aiProvider("provider credentials",
                    provider() + " rejected the provider credentials (HTTP " + code + ")", e);
        }
        if (code == 429) {
            return InterviewPlatformException.aiProvider("provider quota",
                    provider() + " rate limit or quota exceeded (HTTP 429)", e);
        }
        if (status.is4xxClientError()) {
            return InterviewPlatformException.aiProvider("provider request",
                    provider() + " rejected the request as malformed (HTTP " + code + ")", e);
        }
        return InterviewPlatformException.aiProvider("provider availability",
                provider() + " is unavailable (HTTP " + code + ")", e);
    }

    protected static long tokens(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.canConvertToLong() ? Math.max(0, value.asLong()) : 0;
    }
}
