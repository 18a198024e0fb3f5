package com.pennywise.expense.config;

import jakarta.annotation.PostConstruct;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Creates the {@code expenses} table from {@code db/schema.sql} when
 * {@code pennywise.db.bootstrap-enabled=true} and the table is missing.
 * The DDL is idempotent, so running it against an initialized database is harmless.
 */
@Component
public class SchemaBootstrap {
    private static final Logger log = LoggerFactory.getLogger(SchemaBootstrap.class);

    static final String SCHEMA_LOCATION = "db/schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public SchemaBootstrap(DataSource dataSource, PennywiseProperties properties) {
        this.dataSource = dataSource;
        this.enabled = properties.db().bootstrapEnabledFlag();
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("Schema bootstrap disabled (pennywise.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (expensesTableExists(conn)) {
                log.info("Schema bootstrap skipped: expenses table exists");
                return;
            }
            int applied = 0;
            for (String stmt : splitStatements(loadSchemaSql())) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                    applied++;
                }
            }
            log.info("Schema bootstrap completed: {} statements applied", applied);
        } catch (SQLException | IOException e) {
            // the service still starts; requests will report the storage failure
            log.error("Schema bootstrap failed (application will continue to start)", e);
        }
    }

    private boolean expensesTableExists(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement(
                "select 1 from information_schema.tables where lower(table_name) = 'expenses' and lower(table_schema) = 'public'")) {
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.warn("Could not check for existing tables: {}", e.getMessage());
            return false;
        }
    }

    private String loadSchemaSql() throws IOException {
        ClassPathResource res = new ClassPathResource(SCHEMA_LOCATION);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }

    static List<String> splitStatements(String sql) {
        // schema.sql holds plain DDL, no procedural blocks
        return Arrays.stream(sql.split(";"))
                .map(String::trim)
                .filter(stmt -> !stmt.isEmpty())
                .toList();
    }
}
