package com.mockinterview.platform.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

public class OllamaLlmClient extends AbstractWebClientLlmClient {

    public OllamaLlmClient(WebClient ollamaWebClient, Duration timeout) {
        super(ollamaWebClient, timeout);
    }

    @Override
    public String provider() {
        return "ollama";
    }

    @Override
    protected Mono<JsonNode> exchange(String prompt, String model, double temperature, int maxOutputTokens) {
        Map<String, Object> body = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "options", Map.of(
                        "temperature", temperature,
                        "num_predict", maxOutputTokens
                )
        );
        return webClient.post()
                .uri("/api/generate")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    @Override
    protected LlmCompletion toCompletion(JsonNode body) {
        return new LlmCompletion(
                body.path("response").asText(""),
                tokens(body, "prompt_eval_count"),
                tokens(body, "eval_count"));
    }
}
