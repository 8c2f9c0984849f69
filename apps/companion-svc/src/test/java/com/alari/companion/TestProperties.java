package com.alari.companion;

import com.alari.companion.config.AlariProperties;
import java.time.Duration;
import java.util.List;

public final class TestProperties {

    public static final String SECRET = "12345678901234567890123456789012";
    public static final String SYSTEM_PROMPT = "You are Alari.";

    private TestProperties() {
    }

    public static AlariProperties withInference(String baseUrl) {
        return withInference(baseUrl, Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    public static AlariProperties withInference(String baseUrl, Duration timeout, Duration streamChunkTimeout) {
        return new AlariProperties(
                new AlariProperties.Security(SECRET, Duration.ofDays(7), "alari-companion"),
                new AlariProperties.Inference(baseUrl, "svc-key", timeout, Duration.ofSeconds(2), streamChunkTimeout),
                new AlariProperties.Chat(SYSTEM_PROMPT, 512, 0.7),
                new AlariProperties.Cors(List.of("http://localhost:3000"))
        );
    }

    public static AlariProperties defaults() {
        return withInference("http://localhost:8001");
    }
}
