package com.alari.companion.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final AlariProperties props;

    public StartupDiagnostics(AlariProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        // Structural info only, never secrets.
        var security = props.security();
        log.info("Startup diagnostics: issuer='{}', tokenTtl={}, jwtSecretLength={}",
                security.issuer(), security.tokenTtl(), security.jwtSecret().length());

        var inference = props.inference();
        log.info("Inference config: baseUrl='{}', apiKey='{}', timeout={}, streamChunkTimeout={}",
                inference.baseUrl(), redact(inference.apiKey()), inference.timeout(), inference.streamChunkTimeout());

        var chat = props.chat();
        log.info("Chat config: defaultMaxTokens={}, defaultTemperature={}, systemPromptChars={}, corsOrigins={}",
                chat.defaultMaxTokens(), chat.defaultTemperature(), chat.systemPrompt().length(), props.cors().allowedOrigins());
    }

    static String redact(String secret) {
        if (secret == null || secret.isBlank()) {
            return "<none>";
        }
        return secret.length() > 4 ? "***" + secret.substring(secret.length() - 4) : "***";
    }
}
