package com.taxdesk.engine.config;

import jakarta.annotation.PostConstruct;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
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
 * Applies {@code db/nexus-schema.sql} (idempotent DDL) at startup when
 * {@code taxdesk.nexus.bootstrap-schema=true}. Only relevant with the JDBC nexus store.
 */
@Component
public class NexusSchemaBootstrap {

    private static final Logger log = LoggerFactory.getLogger(NexusSchemaBootstrap.class);

    static final String SCHEMA_LOCATION = "db/nexus-schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public NexusSchemaBootstrap(DataSource dataSource, EngineProperties properties) {
        this.dataSource = dataSource;
        this.enabled = properties.nexus().bootstrapSchema();
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("Nexus schema bootstrap disabled (taxdesk.nexus.bootstrap-schema=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            int applied = 0;
            for (String stmt : splitStatements(loadSchemaSql())) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                    applied++;
                }
            }
            log.info("Nexus schema bootstrap completed: {} statements applied", applied);
        } catch (Exception e) {
            // the memory store keeps working; a jdbc store will report the missing table on first use
            log.error("Nexus schema bootstrap failed (application will continue to start)", e);
        }
    }

    static String loadSchemaSql() throws IOException {
        ClassPathResource res = new ClassPathResource(SCHEMA_LOCATION);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines().collect(Collectors.joining("\n"));
        }
    }

    static List<String> splitStatements(String sql) {
        // schema has no procedural blocks, a plain split is enough
        return Arrays.stream(sql.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
