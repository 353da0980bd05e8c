package org.migrata.plan;

import org.migrata.model.ColumnInfo;
import org.migrata.model.ConstraintInfo;
import org.migrata.model.IndexInfo;
import org.migrata.model.SchemaSnapshot;
import org.migrata.model.TableInfo;
import org.migrata.model.TriggerInfo;

import java.util.List;
import java.util.Optional;

/**
 * The snapshot with the effects of already-planned steps layered on, so that a later step
 * sees what an earlier step of the same unit creates.
 */
public class ProjectedSchema {

    private SchemaSnapshot current;

    public ProjectedSchema(SchemaSnapshot start) {
        this.current = start;
    }

    public SchemaSnapshot snapshot() {
        return current;
    }

    public Optional<TableInfo> table(String name) {
        return current.table(name);
    }

    public Optional<ColumnInfo> column(String table, String column) {
        return current.column(table, column);
    }

    public boolean hasFunction(String name) {
        return current.hasFunction(name);
    }

    public List<ConstraintInfo> inboundForeignKeys(String table, String column) {
        return current.inboundForeignKeys(table, column);
    }

    public void putTable(TableInfo table) {
        current = current.withTable(table);
    }

    public void addColumn(String table, ColumnInfo column) {
        putTable(require(table).withColumn(column));
    }

    public void changeColumnType(String table, String column, String newType) {
        TableInfo t = require(table);
        putTable(t.withColumn(requireColumn(t, column).withDataType(newType)));
    }

    public void setColumnDefault(String table, String column, String defaultValue) {
        TableInfo t = require(table);
        putTable(t.withColumn(requireColumn(t, column).withDefault(defaultValue)));
    }

    public void addConstraint(String table, ConstraintInfo constraint) {
        putTable(require(table).withConstraint(constraint));
    }

    public void dropConstraint(String table, String constraintName) {
        putTable(require(table).withoutConstraint(constraintName));
    }

    public void addIndex(String table, IndexInfo index) {
        putTable(require(table).withIndex(index));
    }

    public void addTrigger(String table, TriggerInfo trigger) {
        putTable(require(table).withTrigger(trigger));
    }

    public void addFunction(String name) {
        current = current.withFunction(name);
    }

    private TableInfo require(String table) {
        return current.table(table)
                .orElseThrow(() -> new IllegalStateException("Projected table missing: " + table));
    }

    private static ColumnInfo requireColumn(TableInfo table, String column) {
        return table.column(column)
                .orElseThrow(() -> new IllegalStateException("Projected column missing: " + table.getName() + "." + column));
    }
}
