package org.migrata.unit;

public record EnsureColumn(String table, String column, String type, String defaultValue, Boolean nullable)
        implements OperationSpec {

    public EnsureColumn {
        Specs.require(table, "table", "ensureColumn");
        Specs.require(column, "column", "ensureColumn");
        Specs.require(type, "type", "ensureColumn");
        nullable = nullable == null ? Boolean.TRUE : nullable;
    }

    public ColumnDef toColumnDef() {
        return new ColumnDef(column, type, nullable, defaultValue);
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitEnsureColumn(this);
    }

    @Override
    public String describe() {
        return "EnsureColumn " + table + "." + column + " " + type;
    }
}
