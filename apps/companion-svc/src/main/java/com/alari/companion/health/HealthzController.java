package com.alari.companion.health;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight unauthenticated endpoints for load balancers and humans poking at the service.
 */
@RestController
public class HealthzController {

    static final String SERVICE_NAME = "Alari Companion Service";
    static final String SERVICE_VERSION = "1.0.0";

    @GetMapping(path = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> root() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.put("version", SERVICE_VERSION);
        body.put("status", "running");
        body.put("description", "User authentication, conversation history, goals and chat");
        return body;
    }

    @GetMapping(path = {"/health", "/healthz"}, produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of("status", "UP");
    }
}
