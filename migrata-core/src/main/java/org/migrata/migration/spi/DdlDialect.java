package org.migrata.migration.spi;

import org.migrata.model.OnDeleteAction;
import org.migrata.unit.ColumnDef;
import org.migrata.unit.EnsureFunction;
import org.migrata.unit.EnsureTable;
import org.migrata.unit.EnsureTrigger;

import java.util.List;

/**
 * Renders single statements, without a trailing semicolon, ready for {@link java.sql.Statement#execute}.
 */
public interface DdlDialect {

    String getCreateTableSql(EnsureTable table);

    String getAddColumnSql(String table, ColumnDef column);

    String getAlterColumnTypeSql(String table, String column, String newType, String conversionExpr);

    String getSetDefaultSql(String table, String column, String defaultValue);

    String getDropDefaultSql(String table, String column);

    String getCreateIndexSql(String table, String indexName, List<String> columns, boolean unique);

    String getAddForeignKeySql(String table, String constraintName, List<String> columns,
                               String refTable, List<String> refColumns, OnDeleteAction onDelete);

    String getDropConstraintSql(String table, String constraintName);

    String getUpdateSql(String table, String assignment, String predicate);

    String getClearColumnSql(String table, String column);

    String getDeleteAllSql(String table);

    String getCreateFunctionSql(EnsureFunction function);

    String getCreateTriggerSql(EnsureTrigger trigger);
}
