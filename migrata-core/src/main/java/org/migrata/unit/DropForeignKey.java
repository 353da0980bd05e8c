package org.migrata.unit;

public record DropForeignKey(String table, String constraintName) implements OperationSpec {

    public DropForeignKey {
        Specs.require(table, "table", "dropForeignKey");
        Specs.require(constraintName, "constraintName", "dropForeignKey");
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitDropForeignKey(this);
    }

    @Override
    public String describe() {
        return "DropForeignKey " + constraintName + " on " + table;
    }
}
