package com.alari.companion.health;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational view of the database: reachability, expected tables and their columns.
 * Reads JDBC metadata directly so it works before (or without) the JPA schema being valid.
 */
@RestController
@RequestMapping(path = "/db", produces = MediaType.APPLICATION_JSON_VALUE)
public class DatabaseHealthController {
    private static final Logger log = LoggerFactory.getLogger(DatabaseHealthController.class);

    static final Map<String, List<String>> EXPECTED_SCHEMA = expectedSchema();

    private final DataSource dataSource;

    public DatabaseHealthController(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", System.currentTimeMillis());
        Map<String, Object> checks = new LinkedHashMap<>();
        body.put("checks", checks);

        try (Connection conn = dataSource.getConnection()) {
            long start = System.nanoTime();
            try (Statement st = conn.createStatement()) {
                st.execute("SELECT 1");
            }
            double elapsedMs = Math.round((System.nanoTime() - start) / 10_000.0) / 100.0;
            checks.put("connection", Map.of("status", "ok", "response_time_ms", elapsedMs));

            Set<String> existing = tableNames(conn);
            List<String> missing = EXPECTED_SCHEMA.keySet().stream().filter(t -> !existing.contains(t)).toList();
            List<String> present = EXPECTED_SCHEMA.keySet().stream().filter(existing::contains).toList();
            if (missing.isEmpty()) {
                checks.put("tables", Map.of("status", "ok", "count", present.size(), "tables", present));
            } else {
                checks.put("tables", Map.of("status", "error", "missing_tables", missing, "existing_tables", present));
                body.put("status", "unhealthy");
            }

            Map<String, Long> rowCounts = new LinkedHashMap<>();
            for (String table : EXPECTED_SCHEMA.keySet()) {
                if (existing.contains(table)) {
                    // table names come from the fixed expected list, never from input
                    try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
                        rowCounts.put(table, rs.next() ? rs.getLong(1) : 0L);
                    }
                }
            }
            checks.put("table_stats", Map.of("status", "ok", "row_counts", rowCounts));
        } catch (SQLException | RuntimeException ex) {
            log.warn("Database health check failed: {}", ex.getMessage());
            body.put("status", "unhealthy");
            body.put("error", String.valueOf(ex.getMessage()));
        }

        HttpStatus status = "healthy".equals(body.get("status")) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(body);
    }

    /** Every base table in the current schema with its column definitions. */
    @GetMapping("/tables")
    public ResponseEntity<Map<String, Object>> tables() {
        Map<String, Object> tables = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection()) {
            for (String table : baseTableNames(conn)) {
                List<Map<String, Object>> columns = columnDetails(conn, table);
                Map<String, Object> tableInfo = new LinkedHashMap<>();
                tableInfo.put("columns", columns);
                tableInfo.put("column_count", columns.size());
                tables.put(table, tableInfo);
            }
        } catch (SQLException ex) {
            log.warn("Table listing failed: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", String.valueOf(ex.getMessage())));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total_tables", tables.size());
        body.put("tables", tables);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/verify-schema")
    public ResponseEntity<Map<String, Object>> verifySchema() {
        Map<String, Object> results = new LinkedHashMap<>();
        boolean allValid = true;
        try (Connection conn = dataSource.getConnection()) {
            Set<String> existing = tableNames(conn);
            for (Map.Entry<String, List<String>> entry : EXPECTED_SCHEMA.entrySet()) {
                String table = entry.getKey();
                if (!existing.contains(table)) {
                    results.put(table, Map.of("exists", false, "status", "missing"));
                    allValid = false;
                    continue;
                }
                Set<String> actual = columnNames(conn, table);
                List<String> missing = entry.getValue().stream().filter(c -> !actual.contains(c)).toList();
                List<String> extra = actual.stream().filter(c -> !entry.getValue().contains(c)).toList();
                boolean valid = missing.isEmpty();
                allValid &= valid;
                Map<String, Object> tableResult = new LinkedHashMap<>();
                tableResult.put("exists", true);
                tableResult.put("status", valid ? "ok" : "incomplete");
                tableResult.put("expected_columns", entry.getValue());
                tableResult.put("actual_columns", new ArrayList<>(actual));
                tableResult.put("missing_columns", missing);
                tableResult.put("extra_columns", extra);
                results.put(table, tableResult);
            }
        } catch (SQLException ex) {
            log.warn("Schema verification failed: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("schema_valid", false, "error", String.valueOf(ex.getMessage())));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("schema_valid", allValid);
        body.put("tables", results);
        return ResponseEntity.ok(body);
    }

    // every relation visible in the current schema (indexes and sequences included on some drivers)
    private static Set<String> tableNames(Connection conn) throws SQLException {
        Set<String> names = new LinkedHashSet<>();
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet rs = meta.getTables(conn.getCatalog(), conn.getSchema(), "%", null)) {
            while (rs.next()) {
                names.add(rs.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    private static List<String> baseTableNames(Connection conn) throws SQLException {
        List<String> names = new ArrayList<>();
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet rs = meta.getTables(conn.getCatalog(), conn.getSchema(), "%", null)) {
            while (rs.next()) {
                // PostgreSQL reports TABLE, H2 reports BASE TABLE
                String type = rs.getString("TABLE_TYPE");
                if ("TABLE".equalsIgnoreCase(type) || "BASE TABLE".equalsIgnoreCase(type)) {
                    names.add(rs.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
                }
            }
        }
        names.sort(null);
        return names;
    }

    private static List<Map<String, Object>> columnDetails(Connection conn, String table) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        String stored = meta.storesUpperCaseIdentifiers() ? table.toUpperCase(Locale.ROOT) : table;
        List<Map<String, Object>> columns = new ArrayList<>();
        try (ResultSet rs = meta.getColumns(conn.getCatalog(), conn.getSchema(), stored, "%")) {
            while (rs.next()) {
                Map<String, Object> column = new LinkedHashMap<>();
                column.put("name", rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                column.put("type", rs.getString("TYPE_NAME"));
                column.put("nullable", rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls);
                column.put("default", rs.getString("COLUMN_DEF"));
                columns.add(column);
            }
        }
        return columns;
    }

    private static Set<String> columnNames(Connection conn, String table) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        String stored = meta.storesUpperCaseIdentifiers() ? table.toUpperCase(Locale.ROOT) : table;
        Set<String> names = new LinkedHashSet<>();
        try (ResultSet rs = meta.getColumns(conn.getCatalog(), conn.getSchema(), stored, "%")) {
            while (rs.next()) {
                names.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    private static Map<String, List<String>> expectedSchema() {
        Map<String, List<String>> schema = new LinkedHashMap<>();
        schema.put("users", List.of("id", "email", "hashed_password", "user_name", "created_at"));
        schema.put("conversations", List.of("id", "user_id", "session_id", "title", "created_at", "updated_at"));
        schema.put("messages", List.of("id", "conversation_id", "role", "content", "keywords", "created_at"));
        schema.put("goals", List.of("id", "user_id", "title", "description", "target_date", "status",
                "streak_count", "created_at", "updated_at"));
        schema.put("goal_check_ins", List.of("id", "goal_id", "check_in_date", "progress_note", "completed"));
        return schema;
    }
}
