package org.migrata.model;

/**
 * Live state of one column. {@code dataType} is the dialect-formatted type, e.g. {@code character varying(36)}.
 */
public record ColumnInfo(String name, String dataType, boolean nullable, boolean hasDefault, String defaultValue) {

    public ColumnInfo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
        hasDefault = hasDefault || defaultValue != null;
    }

    public static ColumnInfo of(String name, String dataType, boolean nullable) {
        return new ColumnInfo(name, dataType, nullable, false, null);
    }

    public ColumnInfo withDataType(String newType) {
        return new ColumnInfo(name, newType, nullable, hasDefault, defaultValue);
    }

    public ColumnInfo withDefault(String value) {
        return new ColumnInfo(name, dataType, nullable, value != null, value);
    }
}
