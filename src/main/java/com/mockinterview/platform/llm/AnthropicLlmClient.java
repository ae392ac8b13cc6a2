package com.mockinterview.platform.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public class AnthropicLlmClient extends AbstractWebClientLlmClient {

    static final String API_VERSION = "2023-06-01";

    private final String apiKey;

    public AnthropicLlmClient(WebClient anthropicWebClient, String apiKey, Duration timeout) {
        super(anthropicWebClient, timeout);
        this.apiKey = apiKey;
    }

    @Override
    public String provider() {
        return "anthropic";
    }

    @Override
    protected Mono<JsonNode> exchange(String prompt, String model, double temperature, int maxOutputTokens) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(missingApiKey());
        }
        Map<String, Object> body = Map.of(
                "model", model,
                "max_tokens", maxOutputTokens,
                "temperature", temperature,
                "messages", List.of(Map.of("role", "user", "content", prompt))
        );
        return webClient.post()
                .uri("/v1/messages")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    @Override
    protected LlmCompletion toCompletion(JsonNode body) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : body.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        JsonNode usage = body.path("usage");
        return new LlmCompletion(text.toString(), tokens(usage, "input_tokens"), tokens(usage, "output_tokens"));
    }
}
