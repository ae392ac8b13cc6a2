package com.mockinterview.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mockinterview.platform.testutil.FakeLlmClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class MockInterviewApplicationTests {

    @TestConfiguration
    static class FakeProviderConfig {
        @Bean
        FakeLlmClient fakeLlmClient() {
            return new FakeLlmClient();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private FakeLlmClient fakeLlmClient;

    @BeforeEach
    void resetProvider() {
        fakeLlmClient.reset();
    }

    @Test
    void rootAndHealthRespond() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Mock Interview Platform API is running!"))
                .andExpect(jsonPath("$.communication_modes", hasItem("screen_share")));
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dependencies.database").value("up"))
                .andExpect(jsonPath("$.dependencies.ai_providers", hasItem("fake")));
    }

    @Test
    void textInterviewRunsFromCreationToEvaluation() throws Exception {
        String sessionId = createSession("[\"text\"]");

        mockMvc.perform(post("/api/sessions/{id}/start", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("active"));
        mockMvc.perform(post("/api/sessions/{id}/interview/start", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sequence").value(1))
                .andExpect(jsonPath("$.role").value("interviewer"));
        mockMvc.perform(post("/api/sessions/{id}/responses", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"I would ask about expected traffic first.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sequence").value(3))
                .andExpect(jsonPath("$.content").value(FakeLlmClient.FOLLOW_UP));
        mockMvc.perform(get("/api/sessions/{id}/messages", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[1].role").value("candidate"));

        mockMvc.perform(get("/api/sessions/{id}/usage", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.calls").value(2))
                .andExpect(jsonPath("$.total_tokens", greaterThan(0)));

        mockMvc.perform(post("/api/sessions/{id}/end", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overall_score").value(67.0))
                .andExpect(jsonPath("$.competency_scores['Data Modeling'].confidence_level").value("high"))
                .andExpect(jsonPath("$.went_well[0].description").value("Clarified requirements early"))
                .andExpect(jsonPath("$.improvement_plan.concrete_steps[1].step_number").value(2));

        mockMvc.perform(post("/api/sessions/{id}/end", sessionId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("CONFIGURATION"))
                .andExpect(jsonPath("$.message").value("Session " + sessionId + " has already ended"));

        mockMvc.perform(get("/api/sessions/{id}/evaluation", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value(sessionId))
                .andExpect(jsonPath("$.overall_score").value(67.0));
        mockMvc.perform(get("/api/sessions/{id}/usage/breakdown", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.evaluation_feedback.calls").value(1));
        mockMvc.perform(get("/api/sessions/{id}", sessionId))
                .andExpect(jsonPath("$.status").value("completed"));
    }

    @Test
    void sessionWithoutModesIsRejected() throws Exception {
        long before = countSessions();

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled_modes\": [], \"ai_provider\": \"fake\", \"ai_model\": \"fake-model\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.subsystem").value("session configuration"));

        assertThat(countSessions()).isEqualTo(before);
    }

    @Test
    void unknownModeAndSessionAreBadRequests() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled_modes\": [\"telepathy\"], \"ai_provider\": \"fake\", \"ai_model\": \"fake-model\"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/sessions/{id}", "does-not-exist"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Session does-not-exist not found"));
    }

    @Test
    void whiteboardUploadsAreSequenced() throws Exception {
        String sessionId = createSession("[\"text\", \"whiteboard\"]");
        mockMvc.perform(post("/api/sessions/{id}/start", sessionId)).andExpect(status().isOk());

        for (int i = 1; i <= 2; i++) {
            mockMvc.perform(multipart("/api/sessions/{id}/whiteboard", sessionId)
                            .file(new MockMultipartFile("file", "board.png", "image/png", new byte[]{1, 2, (byte) i})))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.sequence").value(i))
                    .andExpect(jsonPath("$.file_path", endsWith(String.format("snapshot_%03d.png", i))));
        }
        mockMvc.perform(multipart("/api/sessions/{id}/screen", sessionId)
                        .file(new MockMultipartFile("file", "screen.png", "image/png", new byte[]{1})))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/sessions/{id}/modes", sessionId))
                .andExpect(jsonPath("$", containsInAnyOrder("text", "whiteboard")));

        mockMvc.perform(delete("/api/sessions/{id}", sessionId)).andExpect(status().isOk());
        mockMvc.perform(get("/api/sessions/{id}/media", sessionId)).andExpect(status().isBadRequest());
    }

    @Test
    void audioAndVideoUploadsAreStoredUnderTheirKind() throws Exception {
        String sessionId = createSession("[\"audio\", \"video\"]");
        mockMvc.perform(post("/api/sessions/{id}/start", sessionId)).andExpect(status().isOk());

        mockMvc.perform(multipart("/api/sessions/{id}/audio", sessionId)
                        .file(new MockMultipartFile("file", "answer.wav", "audio/wav", new byte[]{1, 2})))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sequence").value(1))
                .andExpect(jsonPath("$.file_path", endsWith("recording_001.wav")));
        mockMvc.perform(multipart("/api/sessions/{id}/video", sessionId)
                        .file(new MockMultipartFile("file", "camera.webm", "video/webm", new byte[]{3})))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.file_path", endsWith("recording_001.webm")));
        mockMvc.perform(get("/api/sessions/{id}/media", sessionId))
                .andExpect(jsonPath("$[*].kind", containsInAnyOrder("audio", "video")));
    }

    @Test
    void providerOutageIsBadGatewayAndSessionStaysActive() throws Exception {
        String sessionId = createSession("[\"text\"]");
        mockMvc.perform(post("/api/sessions/{id}/start", sessionId)).andExpect(status().isOk());
        fakeLlmClient.fail(FakeLlmClient.Step.COMPETENCIES);

        mockMvc.perform(post("/api/sessions/{id}/end", sessionId))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("AI_PROVIDER"));
        mockMvc.perform(get("/api/sessions/{id}", sessionId))
                .andExpect(jsonPath("$.status").value("active"));
        mockMvc.perform(get("/api/sessions/{id}/evaluation", sessionId))
                .andExpect(status().isNotFound());
    }

    private String createSession(String modes) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled_modes\": " + modes
                                + ", \"ai_provider\": \"fake\", \"ai_model\": \"fake-model\", \"duration_minutes\": 45}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("created"))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();
    }

    private long countSessions() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/sessions")).andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("total").asLong();
    }
}
