package com.alari.companion.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "alari")
public record AlariProperties(
        Security security,
        Inference inference,
        Chat chat,
        Cors cors
) {

    @ConstructorBinding
    public AlariProperties {
        if (security == null) {
            throw new IllegalArgumentException("security configuration must be provided");
        }
        if (inference == null) {
            throw new IllegalArgumentException("inference configuration must be provided");
        }
        if (chat == null) {
            throw new IllegalArgumentException("chat configuration must be provided");
        }
        // cors may be null; handled via accessor method
    }

    public Cors cors() {
        return cors != null ? cors : new Cors(null);
    }

    public record Security(String jwtSecret, Duration tokenTtl, String issuer) {
        public Security {
            if (jwtSecret == null || jwtSecret.isBlank()) {
                throw new IllegalArgumentException("jwtSecret must be provided");
            }
            if (jwtSecret.getBytes(StandardCharsets.UTF_8).length < 32) { // HS256 needs at least 256-bit secret
                throw new IllegalArgumentException("jwtSecret must be at least 32 bytes");
            }
            if (tokenTtl == null) {
                tokenTtl = Duration.ofDays(7);
            }
            if (tokenTtl.isNegative() || tokenTtl.isZero()) {
                throw new IllegalArgumentException("tokenTtl must be positive");
            }
            if (issuer == null || issuer.isBlank()) {
                issuer = "alari-companion";
            }
        }
    }

    public record Inference(
            String baseUrl,
            String apiKey,
            Duration timeout,
            Duration connectTimeout,
            Duration streamChunkTimeout
    ) {
        public Inference {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl must be provided");
            }
            if (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
            if (apiKey == null || apiKey.isBlank()) {
                throw new IllegalArgumentException("apiKey must be provided");
            }
            if (timeout == null) {
                timeout = Duration.ofSeconds(120);
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(10);
            }
            if (streamChunkTimeout == null) {
                streamChunkTimeout = Duration.ofSeconds(180);
            }
        }
    }

    public record Chat(String systemPrompt, Integer defaultMaxTokens, Double defaultTemperature) {
        public Chat {
            if (systemPrompt == null || systemPrompt.isBlank()) {
                throw new IllegalArgumentException("systemPrompt must be provided");
            }
            if (defaultMaxTokens == null) {
                defaultMaxTokens = 512;
            }
            if (defaultMaxTokens <= 0) {
                throw new IllegalArgumentException("defaultMaxTokens must be positive");
            }
            if (defaultTemperature == null) {
                defaultTemperature = 0.7;
            }
            if (defaultTemperature < 0.0 || defaultTemperature > 2.0) {
                throw new IllegalArgumentException("defaultTemperature must be within [0, 2]");
            }
        }
    }

    public record Cors(List<String> allowedOrigins) {
        public Cors {
            allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty() ? List.of("*") : List.copyOf(allowedOrigins);
        }
    }
}
