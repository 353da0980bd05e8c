package org.migrata.unit;

import java.util.List;

public record EnsureIndex(String table, String name, List<String> columns, boolean unique) implements OperationSpec {

    public EnsureIndex {
        Specs.require(table, "table", "ensureIndex");
        Specs.require(name, "name", "ensureIndex");
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("ensureIndex " + name + ": 'columns' is required");
        }
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitEnsureIndex(this);
    }

    @Override
    public String describe() {
        return "EnsureIndex " + name + " on " + table + " " + columns;
    }
}
