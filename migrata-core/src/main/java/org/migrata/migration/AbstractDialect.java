package org.migrata.migration;

import org.migrata.migration.spi.ConversionSafety;
import org.migrata.migration.spi.Dialect;
import org.migrata.migration.spi.IdentifierPolicy;
import org.migrata.model.OnDeleteAction;
import org.migrata.unit.CheckDef;
import org.migrata.unit.ColumnDef;
import org.migrata.unit.EnsureTable;
import org.migrata.unit.UniqueDef;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Standard-SQL rendering shared by the bundled dialects. Subclasses supply the identifier policy,
 * the conversion table and their type spellings.
 */
public abstract class AbstractDialect implements Dialect {
    protected IdentifierPolicy identifierPolicy;
    protected ConversionRules conversionRules;

    protected AbstractDialect() {
        this.identifierPolicy = initializeIdentifierPolicy();
        this.conversionRules = initializeConversionRules();
    }

    protected abstract IdentifierPolicy initializeIdentifierPolicy();
    protected abstract ConversionRules initializeConversionRules();

    /**
     * Maps a lower-case base type name onto this dialect's canonical spelling.
     */
    protected abstract String canonicalBase(String base);

    @Override
    public IdentifierPolicy identifierPolicy() {
        return identifierPolicy;
    }

    @Override
    public String quoteIdentifier(String raw) {
        return identifierPolicy.quote(identifierPolicy.normalizeCase(raw));
    }

    // TypeDialect

    @Override
    public String normalizeType(String declaredType) {
        SqlType parsed = SqlType.parse(declaredType);
        return canonicalize(parsed.withBase(canonicalBase(parsed.base()))).toString();
    }

    /**
     * Drops modifiers that only restate the dialect's default, e.g. the maximum varchar length.
     */
    protected SqlType canonicalize(SqlType type) {
        return type;
    }

    @Override
    public ConversionSafety conversionSafety(String fromType, String toType) {
        return conversionRules.evaluate(SqlType.parse(normalizeType(fromType)), SqlType.parse(normalizeType(toType)));
    }

    @Override
    public boolean comparableTypes(String a, String b) {
        return conversionRules.comparable(SqlType.parse(normalizeType(a)), SqlType.parse(normalizeType(b)));
    }

    @Override
    public String defaultConversionExpression(String quotedColumn, String fromType, String toType) {
        if (!supportsConversionExpression()) {
            return null;
        }
        SqlType from = SqlType.parse(normalizeType(fromType));
        SqlType to = SqlType.parse(normalizeType(toType));
        return conversionRules.expression(from, to, quotedColumn).orElse(quotedColumn + "::" + toType);
    }

    // DdlDialect

    @Override
    public String getCreateTableSql(EnsureTable table) {
        List<String> parts = new ArrayList<>();
        for (ColumnDef c : table.columns()) {
            parts.add(columnDefinition(c));
        }
        if (!table.primaryKey().isEmpty()) {
            parts.add("PRIMARY KEY (" + quoteAll(table.primaryKey()) + ")");
        }
        for (UniqueDef u : table.uniques()) {
            String name = u.name() != null ? u.name()
                    : IdentifierUtil.uniqueName(identifierPolicy, table.name(), u.columns());
            parts.add("CONSTRAINT " + quoteIdentifier(name) + " UNIQUE (" + quoteAll(u.columns()) + ")");
        }
        int checkNo = 0;
        for (CheckDef ch : table.checks()) {
            checkNo++;
            String name = ch.name() != null ? ch.name()
                    : IdentifierUtil.checkName(identifierPolicy, table.name(), checkNo);
            parts.add("CONSTRAINT " + quoteIdentifier(name) + " CHECK (" + ch.expression() + ")");
        }
        return "CREATE TABLE " + quoteIdentifier(table.name()) + " (\n    "
                + String.join(",\n    ", parts) + "\n)";
    }

    @Override
    public String getAddColumnSql(String table, ColumnDef column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD COLUMN " + columnDefinition(column);
    }

    @Override
    public String getAlterColumnTypeSql(String table, String column, String newType, String conversionExpr) {
        String sql = "ALTER TABLE " + quoteIdentifier(table) + " ALTER COLUMN " + quoteIdentifier(column)
                + " SET DATA TYPE " + newType;
        if (conversionExpr != null && supportsConversionExpression()) {
            sql += " USING " + conversionExpr;
        }
        return sql;
    }

    @Override
    public String getSetDefaultSql(String table, String column, String defaultValue) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ALTER COLUMN " + quoteIdentifier(column)
                + " SET DEFAULT " + defaultValue;
    }

    @Override
    public String getDropDefaultSql(String table, String column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ALTER COLUMN " + quoteIdentifier(column) + " DROP DEFAULT";
    }

    @Override
    public String getCreateIndexSql(String table, String indexName, List<String> columns, boolean unique) {
        return "CREATE " + (unique ? "UNIQUE " : "") + "INDEX " + quoteIdentifier(indexName)
                + " ON " + quoteIdentifier(table) + " (" + quoteAll(columns) + ")";
    }

    @Override
    public String getAddForeignKeySql(String table, String constraintName, List<String> columns,
                                      String refTable, List<String> refColumns, OnDeleteAction onDelete) {
        String sql = "ALTER TABLE " + quoteIdentifier(table) + " ADD CONSTRAINT " + quoteIdentifier(constraintName)
                + " FOREIGN KEY (" + quoteAll(columns) + ") REFERENCES " + quoteIdentifier(refTable)
                + " (" + quoteAll(refColumns) + ")";
        if (onDelete != null && onDelete != OnDeleteAction.NO_ACTION) {
            sql += " ON DELETE " + onDelete.sql();
        }
        return sql;
    }

    @Override
    public String getDropConstraintSql(String table, String constraintName) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP CONSTRAINT " + quoteIdentifier(constraintName);
    }

    @Override
    public String getUpdateSql(String table, String assignment, String predicate) {
        return "UPDATE " + quoteIdentifier(table) + " SET " + assignment + " WHERE " + predicate;
    }

    @Override
    public String getClearColumnSql(String table, String column) {
        return "UPDATE " + quoteIdentifier(table) + " SET " + quoteIdentifier(column) + " = NULL";
    }

    @Override
    public String getDeleteAllSql(String table) {
        return "DELETE FROM " + quoteIdentifier(table);
    }

    protected String columnDefinition(ColumnDef c) {
        StringBuilder sb = new StringBuilder(quoteIdentifier(c.name())).append(' ').append(c.type());
        if (c.defaultValue() != null) {
            sb.append(" DEFAULT ").append(c.defaultValue());
        }
        if (!c.nullable()) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }

    protected String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }
}
