package org.migrata.introspect;

import lombok.extern.slf4j.Slf4j;
import org.migrata.migration.spi.Dialect;
import org.migrata.model.ColumnInfo;
import org.migrata.model.ConstraintInfo;
import org.migrata.model.IndexInfo;
import org.migrata.model.OnDeleteAction;
import org.migrata.model.SchemaSnapshot;
import org.migrata.model.TableInfo;
import org.migrata.model.TriggerInfo;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads the live catalog through {@link DatabaseMetaData}, plus information_schema for unique and check constraints,
 * triggers and routines.
 * Nothing is cached: every call goes to the database.
 */
@Slf4j
public class JdbcSchemaIntrospector implements SchemaIntrospector {

    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};
    // PostgreSQL 18 exposes NOT NULL as named check constraints
    private static final String NOT_NULL_SUFFIX = "_not_null";

    private final Connection connection;
    private final Dialect dialect;
    private final String schema;

    /**
     * @param schema schema to read; the connection's current schema when null
     */
    public JdbcSchemaIntrospector(Connection connection, Dialect dialect, String schema) {
        this.connection = connection;
        this.dialect = dialect;
        this.schema = schema;
    }

    @Override
    public SchemaSnapshot snapshot(Set<String> tables, Set<String> functions) {
        try {
            DatabaseMetaData meta = connection.getMetaData();
            String effectiveSchema = schema != null ? schema : connection.getSchema();

            Map<String, TableInfo> loaded = new LinkedHashMap<>();
            Set<String> outbound = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>(tables);

            while (!queue.isEmpty()) {
                String requested = queue.poll();
                String key = requested.toLowerCase(Locale.ROOT);
                if (loaded.containsKey(key)) {
                    continue;
                }
                Optional<String> liveName = findTable(meta, effectiveSchema, requested);
                if (liveName.isEmpty()) {
                    continue;
                }
                TableInfo table = loadTable(meta, effectiveSchema, liveName.get());
                loaded.put(key, table);
                table.foreignKeys().forEach(fk -> outbound.add(fk.referencedTable()));
                queue.addAll(referencingTables(meta, effectiveSchema, liveName.get()));
            }

            for (String referenced : outbound) {
                String key = referenced.toLowerCase(Locale.ROOT);
                if (loaded.containsKey(key)) {
                    continue;
                }
                Optional<String> liveName = findTable(meta, effectiveSchema, referenced);
                if (liveName.isPresent()) {
                    loaded.put(key, loadTable(meta, effectiveSchema, liveName.get()));
                }
            }

            List<String> existingFunctions = new ArrayList<>();
            for (String function : functions) {
                if (functionExists(effectiveSchema, function)) {
                    existingFunctions.add(function);
                }
            }

            log.debug("Introspected {} table(s) and {} function(s) in schema {} for request {}",
                    loaded.size(), existingFunctions.size(), effectiveSchema, tables);
            return SchemaSnapshot.of(loaded.values(), existingFunctions);
        } catch (SQLException e) {
            throw new IntrospectionException("Failed to read catalog for tables " + tables + ": " + e.getMessage(), e);
        }
    }

    private Optional<String> findTable(DatabaseMetaData meta, String schemaName, String table) throws SQLException {
        String wanted = dialect.identifierPolicy().normalizeCase(table);
        String escape = meta.getSearchStringEscape();
        String pattern = escape == null ? wanted : wanted.replace("_", escape + "_").replace("%", escape + "%");
        try (ResultSet rs = meta.getTables(null, schemaName, pattern, TABLE_TYPES)) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (name.equalsIgnoreCase(table)) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    private TableInfo loadTable(DatabaseMetaData meta, String schemaName, String table) throws SQLException {
        TableInfo.Builder builder = TableInfo.builder(table);

        try (ResultSet rs = meta.getColumns(null, schemaName, escape(meta, table), null)) {
            while (rs.next()) {
                if (!table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                String type = dialect.formatIntrospectedType(
                        rs.getString("TYPE_NAME"), rs.getInt("COLUMN_SIZE"), rs.getInt("DECIMAL_DIGITS"));
                String def = rs.getString("COLUMN_DEF");
                builder.column(new ColumnInfo(
                        rs.getString("COLUMN_NAME"),
                        type,
                        rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls,
                        def != null,
                        def));
            }
        }

        Map<Short, String> pk = new TreeMap<>();
        try (ResultSet rs = meta.getPrimaryKeys(null, schemaName, table)) {
            while (rs.next()) {
                pk.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        builder.primaryKey(new ArrayList<>(pk.values()));

        readForeignKeys(meta, schemaName, table).forEach(builder::constraint);
        readUniqueAndCheckConstraints(schemaName, table).forEach(builder::constraint);
        readTriggers(schemaName, table).forEach(builder::trigger);

        Map<String, IndexInfo> indexes = new LinkedHashMap<>();
        Map<String, Map<Short, String>> indexColumns = new LinkedHashMap<>();
        try (ResultSet rs = meta.getIndexInfo(null, schemaName, table, false, true)) {
            while (rs.next()) {
                String name = rs.getString("INDEX_NAME");
                String column = rs.getString("COLUMN_NAME");
                if (name == null || column == null) {
                    continue;
                }
                boolean unique = !rs.getBoolean("NON_UNIQUE");
                indexes.putIfAbsent(name, new IndexInfo(name, table, List.of(), unique));
                indexColumns.computeIfAbsent(name, k -> new TreeMap<>()).put(rs.getShort("ORDINAL_POSITION"), column);
            }
        }
        indexes.forEach((name, idx) -> builder.index(
                new IndexInfo(name, table, new ArrayList<>(indexColumns.get(name).values()), idx.unique())));

        return builder.build();
    }

    private List<ConstraintInfo> readForeignKeys(DatabaseMetaData meta, String schemaName, String table)
            throws SQLException {
        Map<String, ForeignKeyRows> byName = new LinkedHashMap<>();
        try (ResultSet rs = meta.getImportedKeys(null, schemaName, table)) {
            while (rs.next()) {
                String column = rs.getString("FKCOLUMN_NAME");
                String name = rs.getString("FK_NAME");
                if (name == null) {
                    name = table + "_" + column + "_fkey";
                }
                ForeignKeyRows rows = byName.computeIfAbsent(name, n -> new ForeignKeyRows());
                rows.referencedTable = rs.getString("PKTABLE_NAME");
                rows.deleteRule = rs.getInt("DELETE_RULE");
                rows.columns.put(rs.getShort("KEY_SEQ"), column);
                rows.referencedColumns.put(rs.getShort("KEY_SEQ"), rs.getString("PKCOLUMN_NAME"));
            }
        }
        List<ConstraintInfo> result = new ArrayList<>();
        byName.forEach((name, rows) -> result.add(ConstraintInfo.foreignKey(
                name, table,
                new ArrayList<>(rows.columns.values()),
                rows.referencedTable,
                new ArrayList<>(rows.referencedColumns.values()),
                OnDeleteAction.fromJdbcRule(rows.deleteRule))));
        return result;
    }

    private List<ConstraintInfo> readUniqueAndCheckConstraints(String schemaName, String table) throws SQLException {
        Set<String> uniqueNames = new LinkedHashSet<>();
        List<ConstraintInfo> result = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(CatalogQueries.UNIQUE_AND_CHECK_CONSTRAINTS)) {
            ps.setString(1, schemaName);
            ps.setString(2, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String name = rs.getString(1);
                    if (!"CHECK".equalsIgnoreCase(rs.getString(2))) {
                        uniqueNames.add(name);
                    } else if (!name.toLowerCase(Locale.ROOT).endsWith(NOT_NULL_SUFFIX)) {
                        result.add(ConstraintInfo.check(name, table, rs.getString(3)));
                    }
                }
            }
        }
        for (String name : uniqueNames) {
            result.add(ConstraintInfo.unique(name, table, constraintColumns(schemaName, table, name)));
        }
        return result;
    }

    private List<String> constraintColumns(String schemaName, String table, String constraint) throws SQLException {
        List<String> columns = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(CatalogQueries.CONSTRAINT_COLUMNS)) {
            ps.setString(1, schemaName);
            ps.setString(2, table);
            ps.setString(3, constraint);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(rs.getString(1));
                }
            }
        }
        return columns;
    }

    private List<TriggerInfo> readTriggers(String schemaName, String table) throws SQLException {
        List<TriggerInfo> result = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(CatalogQueries.TRIGGERS)) {
            ps.setString(1, schemaName);
            ps.setString(2, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new TriggerInfo(rs.getString(1), table));
                }
            }
        }
        return result;
    }

    private boolean functionExists(String schemaName, String function) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(CatalogQueries.ROUTINE_EXISTS)) {
            ps.setString(1, schemaName);
            ps.setString(2, function);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        }
    }

    private List<String> referencingTables(DatabaseMetaData meta, String schemaName, String table) throws SQLException {
        Set<String> result = new LinkedHashSet<>();
        try (ResultSet rs = meta.getExportedKeys(null, schemaName, table)) {
            while (rs.next()) {
                result.add(rs.getString("FKTABLE_NAME"));
            }
        }
        return new ArrayList<>(result);
    }

    private static String escape(DatabaseMetaData meta, String name) throws SQLException {
        String escape = meta.getSearchStringEscape();
        return escape == null ? name : name.replace("_", escape + "_").replace("%", escape + "%");
    }

    private static final class ForeignKeyRows {
        private String referencedTable;
        private int deleteRule;
        private final Map<Short, String> columns = new TreeMap<>();
        private final Map<Short, String> referencedColumns = new TreeMap<>();
    }
}
