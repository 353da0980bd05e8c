package org.migrata.unit;

import org.migrata.model.OnDeleteAction;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Single-column foreign key. {@code name} is optional; the dialect's naming rule fills it in.
 */
public record EnsureForeignKey(String table, String column, String refTable, String refColumn,
                               OnDeleteAction onDelete, String name) implements OperationSpec {

    public EnsureForeignKey {
        Specs.require(table, "table", "ensureForeignKey");
        Specs.require(column, "column", "ensureForeignKey");
        Specs.require(refTable, "refTable", "ensureForeignKey");
        Specs.require(refColumn, "refColumn", "ensureForeignKey");
        onDelete = onDelete == null ? OnDeleteAction.NO_ACTION : onDelete;
    }

    public EnsureForeignKey(String table, String column, String refTable, String refColumn, OnDeleteAction onDelete) {
        this(table, column, refTable, refColumn, onDelete, null);
    }

    @Override
    public Set<String> referencedTables() {
        return new LinkedHashSet<>(List.of(table, refTable));
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitEnsureForeignKey(this);
    }

    @Override
    public String describe() {
        return "EnsureForeignKey " + (name != null ? name + " " : "") + table + "." + column
                + " -> " + refTable + "." + refColumn + " ON DELETE " + onDelete.sql();
    }
}
