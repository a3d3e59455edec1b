package com.weft.discovery.store;

import com.weft.config.WeftConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Single responsibility: open JDBC connections to the discovery database
 * ({@code WEFT_DB_URL}, embedded H2 file database by default).
 */
public final class JdbcDiscoveryConnectionProvider implements DiscoveryConnectionProvider {

    private final String url;
    private final String user;
    private final String password;

    public JdbcDiscoveryConnectionProvider(WeftConfig config) {
        Objects.requireNonNull(config, "WeftConfig");
        this.url = config.getDbUrl();
        this.user = config.getDbUser();
        this.password = config.getDbPassword() != null ? config.getDbPassword() : "";
    }

    @Override
    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    public String getUrl() {
        return url;
    }
}
