package com.alari.companion.config;

import jakarta.annotation.PostConstruct;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Optional bootstrap that applies the schema when the database has not been initialized yet
 * (users table missing). Enable with ALARI_DB_BOOTSTRAP=true.
 */
@Component
public class DatabaseBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);

    static final String SCHEMA_RESOURCE = "db/bootstrap/schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource,
                             @Value("${alari.db.bootstrap-enabled:false}") boolean enabled) {
        this.dataSource = dataSource;
        this.enabled = enabled;
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (alari.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (usersTableExists(conn)) {
                log.info("DB bootstrap skipped: schema already present (users table exists)");
                return;
            }
            log.warn("DB bootstrap starting: applying {}", SCHEMA_RESOURCE);
            int applied = 0;
            for (String stmt : splitStatements(loadSchemaSql())) {
                String trimmed = stmt.trim();
                if (trimmed.isEmpty()) continue;
                try (Statement s = conn.createStatement()) {
                    s.execute(trimmed);
                    applied++;
                } catch (Exception ex) {
                    log.error("Failed executing bootstrap statement: {}", trimmed, ex);
                    throw ex;
                }
            }
            log.info("DB bootstrap completed: {} statements applied", applied);
        } catch (Exception e) {
            // startup continues; /db/health reports the missing tables
            log.error("DB bootstrap failed (application will continue to start)", e);
        }
    }

    private boolean usersTableExists(Connection conn) {
        try {
            DatabaseMetaData meta = conn.getMetaData();
            String name = meta.storesUpperCaseIdentifiers() ? "USERS" : "users";
            try (ResultSet rs = meta.getTables(conn.getCatalog(), conn.getSchema(), name, null)) {
                return rs.next();
            }
        } catch (Exception e) {
            log.warn("Could not check for existing tables: {}", e.getMessage());
            return false;
        }
    }

    private String loadSchemaSql() throws Exception {
        ClassPathResource res = new ClassPathResource(SCHEMA_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }

    // schema.sql holds no procedural blocks, so a plain split on ';' is enough
    static List<String> splitStatements(String sql) {
        return Arrays.stream(sql.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .filter(s -> !s.toLowerCase(Locale.ROOT).startsWith("--"))
                .toList();
    }
}
