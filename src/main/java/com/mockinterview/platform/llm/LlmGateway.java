package com.mockinterview.platform.llm;

import com.mockinterview.platform.config.AiProperties;
import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.model.SessionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Routes a prompt to the client registered for a session's provider, applying the
 * provider's sampling settings.
 */
@Service
@Slf4j
public class LlmGateway {

    private final Map<String, LlmClient> clients;
    private final AiProperties aiProperties;

    public LlmGateway(List<LlmClient> clients, AiProperties aiProperties) {
        this.clients = clients.stream()
                .collect(Collectors.toMap(c -> c.provider().toLowerCase(), Function.identity()));
        this.aiProperties = aiProperties;
        log.info("LlmGateway initialized with providers {}", this.clients.keySet());
    }

    /** True when a client exists for the provider and the model is in its priced catalog. */
    public boolean isRecognized(String provider, String model) {
        return provider != null
                && clients.containsKey(provider.toLowerCase())
                && aiProperties.findModel(provider, model).isPresent();
    }

    public Set<String> providers() {
        return clients.keySet();
    }

    public LlmCompletion generate(SessionConfig config, String prompt) {
        String provider = config.getAiProvider().toLowerCase();
        LlmClient client = clients.get(provider);
        if (client == null) {
            throw InterviewPlatformException.aiProvider("provider configuration",
                    "No client configured for provider " + provider, null);
        }
        AiProperties.ProviderSpec spec = aiProperties.findProvider(provider)
                .orElseGet(AiProperties.ProviderSpec::new);

        long start = System.currentTimeMillis();
        LlmCompletion completion = client.generate(prompt, config.getAiModel(),
                spec.getTemperature(), spec.getMaxOutputTokens());
        log.info("{}/{} call completed in {}ms ({} in, {} out)", provider, config.getAiModel(),
                System.currentTimeMillis() - start, completion.getInputTokens(), completion.getOutputTokens());
        return completion;
    }
}
