package com.mockinterview.platform.llm;

/**
 * A single synchronous, blocking call to a language-model provider.
 * <p>
 * Implementations map every failure to an {@code AI_PROVIDER} error and never retry.
 */
public interface LlmClient {

    /** Provider key as used in session configuration, e.g. "anthropic". */
    String provider();

    LlmCompletion generate(String prompt, String model, double temperature, int maxOutputTokens);
}
