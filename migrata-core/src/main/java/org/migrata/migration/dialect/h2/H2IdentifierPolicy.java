package org.migrata.migration.dialect.h2;

import org.migrata.migration.spi.IdentifierPolicy;

import java.util.Locale;
import java.util.Set;

/**
 * Assumes the database runs with {@code DATABASE_TO_LOWER=TRUE}, so unquoted names fold to lower case.
 */
class H2IdentifierPolicy implements IdentifierPolicy {
    private static final Set<String> KEYWORDS = Set.of(
            "ALL", "AND", "ANY", "ARRAY", "AS", "BETWEEN", "BOTH", "CASE", "CHECK", "CONSTRAINT",
            "CROSS", "CURRENT_DATE", "CURRENT_TIME", "CURRENT_TIMESTAMP", "CURRENT_USER", "DEFAULT",
            "DISTINCT", "EXCEPT", "EXISTS", "FALSE", "FETCH", "FOR", "FOREIGN", "FROM", "FULL",
            "GROUP", "HAVING", "IF", "IN", "INNER", "INTERSECT", "INTERVAL", "IS", "JOIN", "KEY",
            "LEFT", "LIKE", "LIMIT", "NOT", "NULL", "OFFSET", "ON", "OR", "ORDER", "PRIMARY",
            "REFERENCES", "RIGHT", "ROW", "SELECT", "SET", "TABLE", "TRUE", "UNION", "UNIQUE",
            "USER", "USING", "VALUE", "VALUES", "WHEN", "WHERE", "WITH");

    public int maxLength()          { return 256; }
    public String quote(String raw) { return "\"" + raw.replace("\"", "\"\"") + "\""; }
    public String normalizeCase(String raw) { return raw.toLowerCase(Locale.ROOT); }
    public boolean isKeyword(String raw) { return KEYWORDS.contains(raw.toUpperCase(Locale.ROOT)); }
}
