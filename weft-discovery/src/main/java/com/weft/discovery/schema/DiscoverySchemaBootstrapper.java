package com.weft.discovery.schema;

import com.weft.discovery.store.DiscoveryConnectionProvider;
import com.weft.discovery.store.DiscoveryStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Single responsibility: load and execute the discovery schema script (weft_plugin_metadata,
 * weft_goal_mapping). Runs at most once per instance; the script itself is idempotent.
 */
public final class DiscoverySchemaBootstrapper {

    public static final String SCHEMA_RESOURCE = "schema/weft-discovery.sql";
    private static final Logger log = LoggerFactory.getLogger(DiscoverySchemaBootstrapper.class);

    private final DiscoveryConnectionProvider connectionProvider;
    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public DiscoverySchemaBootstrapper(DiscoveryConnectionProvider connectionProvider) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    }

    /**
     * Creates the discovery tables and indexes if they do not exist.
     *
     * @throws DiscoveryStoreException if the script cannot be loaded or a statement fails
     */
    public void ensureSchema() {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Discovery schema already initialized; skipping");
            return;
        }
        String sql = loadSchemaScript();
        String[] statements = sql.split(";");
        int total = 0;
        for (String raw : statements) {
            if (!stripComments(raw).isEmpty()) total++;
        }
        log.info("Discovery schema: executing {} statement(s) from {}", total, SCHEMA_RESOURCE);
        try (Connection c = connectionProvider.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String raw : statements) {
                String stmt = stripComments(raw);
                if (stmt.isEmpty()) continue;
                index++;
                String preview = stmt.length() > 60 ? stmt.substring(0, 60) + "..." : stmt;
                try {
                    st.execute(stmt);
                    log.debug("Discovery schema: statement {}/{} ok: {}", index, total, preview);
                } catch (SQLException e) {
                    log.error("Discovery schema: statement {}/{} failed. SQL: {} | Error: {} | SQLState: {}",
                            index, total, preview, e.getMessage(), e.getSQLState(), e);
                    throw new DiscoveryStoreException("ensureSchema",
                            "Discovery schema execution failed at statement " + index + ": " + e.getMessage(), e);
                }
            }
            log.info("Discovery schema: {} statement(s) executed; tables weft_plugin_metadata, weft_goal_mapping are ready", total);
        } catch (SQLException e) {
            schemaInitialized.set(false);
            log.error("Discovery schema: connection failed error={} SQLState={}", e.getMessage(), e.getSQLState(), e);
            throw new DiscoveryStoreException("ensureSchema", "Discovery schema execution failed: " + e.getMessage(), e);
        }
    }

    private static String stripComments(String raw) {
        return raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim();
    }

    private static String loadSchemaScript() {
        try (InputStream in = DiscoverySchemaBootstrapper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new DiscoveryStoreException("ensureSchema", "Schema resource not found: " + SCHEMA_RESOURCE, null);
            }
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))
                    .lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            log.error("Discovery schema load failed: resource={}, error={}", SCHEMA_RESOURCE, e.getMessage(), e);
            throw new DiscoveryStoreException("ensureSchema", "Discovery schema load failed: " + e.getMessage(), e);
        }
    }
}
