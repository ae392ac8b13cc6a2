package com.mockinterview.platform.llm;

import com.mockinterview.platform.config.AiProperties;
import com.mockinterview.platform.exception.ErrorKind;
import com.mockinterview.platform.model.CommunicationMode;
import com.mockinterview.platform.model.SessionConfig;
import com.mockinterview.platform.testutil.FakeLlmClient;
import com.mockinterview.platform.testutil.TestPlatform;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LlmGatewayTest {

    private final AiProperties properties = TestPlatform.aiProperties();

    @Test
    void recognizesOnlyPricedModelsOfRegisteredProviders() {
        LlmGateway gateway = new LlmGateway(List.of(new FakeLlmClient()), properties);

        assertThat(gateway.isRecognized("FAKE", FakeLlmClient.MODEL)).isTrue();
        assertThat(gateway.isRecognized("fake", "unknown")).isFalse();
        assertThat(gateway.isRecognized("openai", "gpt-4o")).isFalse();
        assertThat(gateway.isRecognized(null, FakeLlmClient.MODEL)).isFalse();
    }

    @Test
    void passesProviderSamplingSettings() {
        LlmClient client = mock(LlmClient.class);
        when(client.provider()).thenReturn("fake");
        when(client.generate(anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(new LlmCompletion("ok", 1, 1));
        LlmGateway gateway = new LlmGateway(List.of(client), properties);

        gateway.generate(TestPlatform.config(CommunicationMode.TEXT), "hello");

        verify(client).generate("hello", FakeLlmClient.MODEL, 0.2, 512);
    }

    @Test
    void unknownProviderIsAnAiProviderError() {
        LlmGateway gateway = new LlmGateway(List.of(new FakeLlmClient()), properties);
        SessionConfig config = SessionConfig.builder()
                .enabledModes(Set.of(CommunicationMode.TEXT))
                .aiProvider("openai")
                .aiModel("gpt-4o")
                .build();

        assertThatThrownBy(() -> gateway.generate(config, "hello"))
                .hasFieldOrPropertyWithValue("kind", ErrorKind.AI_PROVIDER)
                .hasFieldOrPropertyWithValue("subsystem", "provider configuration");
    }
}
