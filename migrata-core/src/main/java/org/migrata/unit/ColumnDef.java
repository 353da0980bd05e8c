package org.migrata.unit;

/**
 * Column declaration inside {@link EnsureTable}. Columns are nullable unless stated otherwise.
 */
public record ColumnDef(String name, String type, Boolean nullable, String defaultValue) {

    public ColumnDef {
        Specs.require(name, "name", "column");
        Specs.require(type, "type", "column " + name);
        nullable = nullable == null ? Boolean.TRUE : nullable;
    }

    public static ColumnDef of(String name, String type) {
        return new ColumnDef(name, type, true, null);
    }

    public static ColumnDef notNull(String name, String type) {
        return new ColumnDef(name, type, false, null);
    }
}
