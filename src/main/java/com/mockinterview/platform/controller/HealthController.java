package com.mockinterview.platform.controller;

import com.mockinterview.platform.llm.LlmGateway;
import com.mockinterview.platform.store.DataStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final DataStore dataStore;
    private final LlmGateway llmGateway;

    @GetMapping({"", "/"})
    public Map<String, String> healthCheck() {
        return Map.of(
                "status", "healthy",
                "service", "Mock Interview Platform API",
                "version", "1.0.0"
        );
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> readinessCheck() {
        boolean databaseUp = dataStore.healthCheck();
        return ResponseEntity
                .status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of(
                        "status", databaseUp ? "ready" : "degraded",
                        "dependencies", Map.of(
                                "database", databaseUp ? "up" : "down",
                                "ai_providers", llmGateway.providers()
                        )
                ));
    }
}
