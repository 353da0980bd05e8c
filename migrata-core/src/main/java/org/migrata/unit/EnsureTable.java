package org.migrata.unit;

import java.util.List;

public record EnsureTable(String name, List<ColumnDef> columns, List<String> primaryKey,
                          List<UniqueDef> uniques, List<CheckDef> checks) implements OperationSpec {

    public EnsureTable {
        Specs.require(name, "name", "ensureTable");
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("ensureTable " + name + ": at least one column is required");
        }
        primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
        uniques = uniques == null ? List.of() : List.copyOf(uniques);
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public EnsureTable(String name, List<ColumnDef> columns, List<String> primaryKey) {
        this(name, columns, primaryKey, null, null);
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitEnsureTable(this);
    }

    @Override
    public String table() {
        return name;
    }

    @Override
    public String describe() {
        return "EnsureTable " + name;
    }
}
