package org.migrata.migration.spi;

public interface BaseDialect {

    /**
     * Lower-case dialect name as used in configuration, e.g. {@code postgresql}.
     */
    String name();

    IdentifierPolicy identifierPolicy();

    String quoteIdentifier(String raw);
}
