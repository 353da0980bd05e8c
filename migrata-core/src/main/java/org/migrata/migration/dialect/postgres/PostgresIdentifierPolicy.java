package org.migrata.migration.dialect.postgres;

import org.migrata.migration.spi.IdentifierPolicy;

import java.util.Locale;

class PostgresIdentifierPolicy implements IdentifierPolicy {
    public int maxLength()          { return 63; }
    public String quote(String raw) { return "\"" + raw.replace("\"", "\"\"") + "\""; }
    public String normalizeCase(String raw) { return raw.toLowerCase(Locale.ROOT); }
    public boolean isKeyword(String raw) { return PostgresUtil.isKeyword(raw.toUpperCase(Locale.ROOT)); }
}
