package com.mockinterview.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Language-model providers, their endpoints and the priced model catalog.
 */
@Data
@ConfigurationProperties(prefix = "interview.ai")
public class AiProperties {

    private Duration requestTimeout = Duration.ofSeconds(60);

    /** Keyed by provider name, e.g. "openai". */
    private Map<String, ProviderSpec> providers = new LinkedHashMap<>();

    public Optional<ProviderSpec> findProvider(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(provider.toLowerCase()));
    }

    public Optional<ModelSpec> findModel(String provider, String model) {
        return findProvider(provider).flatMap(spec -> spec.getModels().stream()
                .filter(m -> m.getName().equals(model))
                .findFirst());
    }

    @Data
    public static class ProviderSpec {
        private String baseUrl;
        private String apiKey;
        private double temperature = 0.7;
        private int maxOutputTokens = 2000;
        private List<ModelSpec> models = new ArrayList<>();
    }

    @Data
    public static class ModelSpec {
        private String name;
        /** USD per one million input tokens. */
        private BigDecimal inputCostPerMillion = BigDecimal.ZERO;
        /** USD per one million output tokens. */
        private BigDecimal outputCostPerMillion = BigDecimal.ZERO;
    }
}
