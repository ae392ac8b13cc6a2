package com.mockinterview.platform.controller;

import com.mockinterview.platform.model.CommunicationMode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
public class RootController {

    @GetMapping("/")
    public Map<String, Object> root() {
        List<String> modes = Arrays.stream(CommunicationMode.values())
                .map(CommunicationMode::value)
                .collect(Collectors.toList());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Mock Interview Platform API is running!");
        body.put("sessions", "/api/sessions");
        body.put("health", "/health");
        body.put("communication_modes", modes);
        return body;
    }
}
