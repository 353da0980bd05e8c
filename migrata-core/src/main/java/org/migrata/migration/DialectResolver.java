package org.migrata.migration;

import org.migrata.migration.dialect.h2.H2Dialect;
import org.migrata.migration.dialect.postgres.PostgresDialect;
import org.migrata.migration.spi.Dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Picks the dialect by configured name, or from the connected database's product name.
 */
public final class DialectResolver {

    private DialectResolver() {}

    public static Dialect byName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "postgresql", "postgres" -> new PostgresDialect();
            case "h2" -> new H2Dialect();
            default -> throw new IllegalArgumentException("Unsupported dialect: " + name);
        };
    }

    public static Dialect resolve(Connection connection, String configuredName) throws SQLException {
        if (configuredName != null && !configuredName.isBlank()) {
            return byName(configuredName);
        }
        String product = connection.getMetaData().getDatabaseProductName();
        return byName(product.toLowerCase(Locale.ROOT).contains("postgres") ? PostgresDialect.NAME : product);
    }
}
