package org.migrata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Referential action fired when a referenced row is deleted.
 */
public enum OnDeleteAction {
    NO_ACTION("NO ACTION"),
    RESTRICT("RESTRICT"),
    CASCADE("CASCADE"),
    SET_NULL("SET NULL"),
    SET_DEFAULT("SET DEFAULT");

    private final String sql;

    OnDeleteAction(String sql) {
        this.sql = sql;
    }

    @JsonValue
    public String sql() {
        return sql;
    }

    /**
     * Accepts both the SQL spelling ({@code "set null"}) and the constant name ({@code "SET_NULL"}).
     * A null or blank value means {@link #NO_ACTION}.
     */
    @JsonCreator
    public static OnDeleteAction parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NO_ACTION;
        }
        String key = raw.trim().toUpperCase(Locale.ROOT).replace('_', ' ').replaceAll("\\s+", " ");
        for (OnDeleteAction action : values()) {
            if (action.sql.equals(key)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown ON DELETE action: " + raw);
    }

    /**
     * Maps {@link java.sql.DatabaseMetaData} {@code DELETE_RULE} codes.
     */
    public static OnDeleteAction fromJdbcRule(int rule) {
        return switch (rule) {
            case java.sql.DatabaseMetaData.importedKeyCascade -> CASCADE;
            case java.sql.DatabaseMetaData.importedKeyRestrict -> RESTRICT;
            case java.sql.DatabaseMetaData.importedKeySetNull -> SET_NULL;
            case java.sql.DatabaseMetaData.importedKeySetDefault -> SET_DEFAULT;
            default -> NO_ACTION;
        };
    }
}
