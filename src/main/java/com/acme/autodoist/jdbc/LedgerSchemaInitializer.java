package com.acme.autodoist.jdbc;

import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.data.connection.ConnectionOperations;
import jakarta.inject.Singleton;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the ledger tables from {@code schema.sql} on startup. Statements must be idempotent.
 */
@Singleton
@Requires(property = "autodoist.ledger.init-schema", value = "true", defaultValue = "true")
public class LedgerSchemaInitializer implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(LedgerSchemaInitializer.class);
    static final String SCHEMA_RESOURCE = "schema.sql";

    private final ConnectionOperations<Connection> connectionOps;

    public LedgerSchemaInitializer(ConnectionOperations<Connection> connectionOps) {
        this.connectionOps = connectionOps;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        int applied = connectionOps.executeWrite(status -> apply(status.getConnection()));
        LOG.info("Ledger schema ready ({} statements)", applied);
    }

    static int apply(Connection conn) {
        String sql;
        try (InputStream in = LedgerSchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException(SCHEMA_RESOURCE + " not found on classpath");
            }
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                sql = reader.lines().collect(Collectors.joining("\n"));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + SCHEMA_RESOURCE, e);
        }

        int applied = 0;
        try (var stmt = conn.createStatement()) {
            for (String statement : sql.split(";")) {
                if (!statement.isBlank()) {
                    stmt.execute(statement.trim());
                    applied++;
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize ledger schema", e);
        }
        return applied;
    }
}
