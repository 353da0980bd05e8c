package org.migrata.unit;

/**
 * Changes a column's type in place.
 *
 * @param conversionExpr value-preserving expression over the old column; the dialect default is used when absent
 * @param defaultValue   default to install after the change, replacing one that no longer fits the new type
 */
public record AlterColumnType(String table, String column, String newType, String conversionExpr, String defaultValue)
        implements OperationSpec {

    public AlterColumnType {
        Specs.require(table, "table", "alterColumnType");
        Specs.require(column, "column", "alterColumnType");
        Specs.require(newType, "newType", "alterColumnType");
    }

    public AlterColumnType(String table, String column, String newType) {
        this(table, column, newType, null, null);
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitAlterColumnType(this);
    }

    @Override
    public String describe() {
        return "AlterColumnType " + table + "." + column + " -> " + newType;
    }
}
