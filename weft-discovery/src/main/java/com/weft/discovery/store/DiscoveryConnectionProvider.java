package com.weft.discovery.store;

import java.sql.Connection;
import java.sql.SQLException;

/** Source of JDBC connections for the discovery store and its schema bootstrap. */
@FunctionalInterface
public interface DiscoveryConnectionProvider {
    Connection getConnection() throws SQLException;
}
