package org.migrata.cli.service;

import org.migrata.cli.ConnectionOptions;
import org.migrata.migration.DialectResolver;
import org.migrata.migration.spi.Dialect;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens the JDBC connection described by the resolved settings.
 */
public class ConnectionService {

    public Connection open(ConnectionOptions.Settings settings) throws SQLException {
        if (settings.url() == null || settings.url().isBlank()) {
            throw new IllegalArgumentException("No database URL. Use --db-url or set database.url in migrata.yaml");
        }
        return DriverManager.getConnection(settings.url(), settings.username(), settings.password());
    }

    public Dialect dialect(Connection connection, ConnectionOptions.Settings settings) throws SQLException {
        return DialectResolver.resolve(connection, settings.dialect());
    }
}
