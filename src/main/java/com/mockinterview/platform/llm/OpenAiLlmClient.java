package com.mockinterview.platform.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public class OpenAiLlmClient extends AbstractWebClientLlmClient {

    private final String apiKey;

    public OpenAiLlmClient(WebClient openAiWebClient, String apiKey, Duration timeout) {
        super(openAiWebClient, timeout);
        this.apiKey = apiKey;
    }

    @Override
    public String provider() {
        return "openai";
    }

    @Override
    protected Mono<JsonNode> exchange(String prompt, String model, double temperature, int maxOutputTokens) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(missingApiKey());
        }
        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(Map.of("role", "user", "content", prompt)),
                "temperature", temperature,
                "max_tokens", maxOutputTokens
        );
        return webClient.post()
                .uri("/v1/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    @Override
    protected LlmCompletion toCompletion(JsonNode body) {
        JsonNode usage = body.path("usage");
        return new LlmCompletion(
                body.path("choices").path(0).path("message").path("content").asText(""),
                tokens(usage, "prompt_tokens"),
                tokens(usage, "completion_tokens"));
    }
}
