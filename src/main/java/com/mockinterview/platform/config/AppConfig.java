package com.mockinterview.platform.config;

import com.mockinterview.platform.llm.AnthropicLlmClient;
import com.mockinterview.platform.llm.OllamaLlmClient;
import com.mockinterview.platform.llm.OpenAiLlmClient;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties({AiProperties.class, DataStoreProperties.class, StorageProperties.class})
public class AppConfig implements WebMvcConfigurer {

    @Value("${interview.cors.allowed-origins:http://localhost:3000}")
    private String allowedOrigins;

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOrigins(List.of(allowedOrigins.split(",")));
        config.setAllowCredentials(true);
        config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(List.of("*"));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return new CorsFilter(source);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new SessionMdcInterceptor()).addPathPatterns("/api/sessions/**");
    }

    // ─── Language-model clients ─────────────────────────────────────────

    @Bean
    @ConditionalOnProperty(prefix = "interview.ai.providers.ollama", name = "base-url")
    public OllamaLlmClient ollamaLlmClient(AiProperties aiProperties) {
        AiProperties.ProviderSpec spec = aiProperties.getProviders().get("ollama");
        return new OllamaLlmClient(webClient(spec.getBaseUrl()), aiProperties.getRequestTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "interview.ai.providers.openai", name = "base-url")
    public OpenAiLlmClient openAiLlmClient(AiProperties aiProperties) {
        AiProperties.ProviderSpec spec = aiProperties.getProviders().get("openai");
        return new OpenAiLlmClient(webClient(spec.getBaseUrl()), spec.getApiKey(), aiProperties.getRequestTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "interview.ai.providers.anthropic", name = "base-url")
    public AnthropicLlmClient anthropicLlmClient(AiProperties aiProperties) {
        AiProperties.ProviderSpec spec = aiProperties.getProviders().get("anthropic");
        return new AnthropicLlmClient(webClient(spec.getBaseUrl()), spec.getApiKey(), aiProperties.getRequestTimeout());
    }

    private static WebClient webClient(String baseUrl) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
    }

    // ─── Persistence retry policy ───────────────────────────────────────

    @Bean
    public RetryConfig dataStoreRetryConfig(DataStoreProperties properties) {
        return RetryConfig.custom()
                .maxAttempts(properties.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.getInitialBackoff(), properties.getMultiplier()))
                .retryExceptions(
                        TransientDataAccessException.class,
                        RecoverableDataAccessException.class,
                        DataAccessResourceFailureException.class,
                        CannotCreateTransactionException.class)
                .build();
    }

    @Bean
    public Retry dataStoreRetry(RetryConfig dataStoreRetryConfig) {
        Retry retry = Retry.of("dataStore", dataStoreRetryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying database call (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        return retry;
    }
}
