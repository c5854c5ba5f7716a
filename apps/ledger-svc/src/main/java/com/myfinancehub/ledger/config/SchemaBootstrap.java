package com.myfinancehub.ledger.config;

import jakarta.annotation.PostConstruct;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Applies {@code db/schema.sql} at startup. Every statement in the script is {@code IF NOT EXISTS},
 * so running it against an initialized database is a no-op. Disable with
 * {@code myfinancehub.db.bootstrap-enabled=false} when the schema is managed elsewhere.
 */
@Component
public class SchemaBootstrap {
    private static final Logger log = LoggerFactory.getLogger(SchemaBootstrap.class);

    static final String SCHEMA_LOCATION = "db/schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public SchemaBootstrap(DataSource dataSource,
                           @Value("${myfinancehub.db.bootstrap-enabled:true}") boolean enabled) {
        this.dataSource = dataSource;
        this.enabled = enabled;
    }

    @PostConstruct
    void apply() {
        if (!enabled) {
            log.info("Schema bootstrap disabled (myfinancehub.db.bootstrap-enabled=false)");
            return;
        }
        List<String> statements;
        try {
            statements = splitStatements(loadSchemaSql());
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read " + SCHEMA_LOCATION, ex);
        }
        try (Connection conn = dataSource.getConnection()) {
            int applied = 0;
            for (String stmt : statements) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                    applied++;
                } catch (SQLException ex) {
                    log.error("Failed executing schema statement: {}", stmt, ex);
                    throw ex;
                }
            }
            log.info("Schema bootstrap completed: {} statements applied", applied);
        } catch (SQLException ex) {
            throw new IllegalStateException("Schema bootstrap failed", ex);
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
        // schema.sql holds plain DDL only, no procedural blocks
        return Arrays.stream(sql.split(";"))
                .map(String::trim)
                .filter(stmt -> !stmt.isEmpty())
                .toList();
    }
}
