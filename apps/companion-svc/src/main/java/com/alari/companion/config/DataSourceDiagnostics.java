package com.alari.companion.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Early sanity check of the JDBC URL so a misconfigured DATABASE_URL fails fast with a clear
 * message instead of a generic pool error later.
 */
@Component
@Profile("!test")
public class DataSourceDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(DataSourceDiagnostics.class);

    @Value("${spring.datasource.url:}")
    private String jdbcUrl;

    @Value("${spring.datasource.username:}")
    private String username;

    @PostConstruct
    void validate() {
        String redactedUser = username == null || username.isBlank() ? "<none>" : username;
        log.info("DataSource diagnostics: url='{}' user='{}'", safe(jdbcUrl), redactedUser);
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalStateException("spring.datasource.url is blank (ensure DATABASE_URL is set)");
        }
        if (jdbcUrl.startsWith("postgresql://") || jdbcUrl.startsWith("postgres://")) {
            throw new IllegalStateException("DATABASE_URL must be a JDBC url, e.g. 'jdbc:" + safe(jdbcUrl) + "'");
        }
        if (!jdbcUrl.startsWith("jdbc:postgresql://")) {
            throw new IllegalStateException("spring.datasource.url must start with 'jdbc:postgresql://' (actual='" + safe(jdbcUrl) + "')");
        }
        if (!jdbcUrl.contains("sslmode=")) {
            log.warn("JDBC url has no sslmode parameter; consider '?sslmode=require' for production");
        }
    }

    static String safe(String url) {
        if (url == null) return null;
        return url.replaceAll("(?i)(password=)[^&]+", "$1***")
                .replaceAll("://([^:/@]+):[^@]+@", "://$1:***@");
    }
}
