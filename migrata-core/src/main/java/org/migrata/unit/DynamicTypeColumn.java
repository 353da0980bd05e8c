package org.migrata.unit;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Adds {@code table.column} with whatever type {@code sourceTable.sourceColumn} has at planning time.
 */
public record DynamicTypeColumn(String table, String column, String sourceTable, String sourceColumn)
        implements OperationSpec {

    public DynamicTypeColumn {
        Specs.require(table, "table", "dynamicTypeColumn");
        Specs.require(column, "column", "dynamicTypeColumn");
        Specs.require(sourceTable, "sourceTable", "dynamicTypeColumn");
        Specs.require(sourceColumn, "sourceColumn", "dynamicTypeColumn");
    }

    @Override
    public Set<String> referencedTables() {
        return new LinkedHashSet<>(List.of(table, sourceTable));
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitDynamicTypeColumn(this);
    }

    @Override
    public String describe() {
        return "DynamicTypeColumn " + table + "." + column + " typed as " + sourceTable + "." + sourceColumn;
    }
}
