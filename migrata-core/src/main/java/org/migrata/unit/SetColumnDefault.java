package org.migrata.unit;

public record SetColumnDefault(String table, String column, String defaultValue) implements OperationSpec {

    public SetColumnDefault {
        Specs.require(table, "table", "setColumnDefault");
        Specs.require(column, "column", "setColumnDefault");
        Specs.require(defaultValue, "defaultValue", "setColumnDefault");
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitSetColumnDefault(this);
    }

    @Override
    public String describe() {
        return "SetColumnDefault " + table + "." + column + " = " + defaultValue;
    }
}
