package org.migrata.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable picture of the live tables and routines captured for one planning pass.
 * Table and function lookups ignore case.
 */
public final class SchemaSnapshot {

    private static final SchemaSnapshot EMPTY = new SchemaSnapshot(Map.of(), Set.of());

    private final Map<String, TableInfo> tables;
    private final Set<String> functions;

    private SchemaSnapshot(Map<String, TableInfo> tables, Set<String> functions) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
        this.functions = Collections.unmodifiableSet(new TreeSet<>(functions));
    }

    public static SchemaSnapshot empty() {
        return EMPTY;
    }

    public static SchemaSnapshot of(Collection<TableInfo> tables) {
        return of(tables, Set.of());
    }

    /**
     * @param functions names of the routines that exist in the schema
     */
    public static SchemaSnapshot of(Collection<TableInfo> tables, Collection<String> functions) {
        Map<String, TableInfo> map = new LinkedHashMap<>();
        for (TableInfo t : tables) {
            map.put(TableInfo.key(t.getName()), t);
        }
        Set<String> names = new TreeSet<>();
        functions.forEach(f -> names.add(TableInfo.key(f)));
        return new SchemaSnapshot(map, names);
    }

    public static SchemaSnapshot of(TableInfo... tables) {
        return of(List.of(tables));
    }

    public Collection<TableInfo> getTables() {
        return tables.values();
    }

    public Optional<TableInfo> table(String name) {
        return Optional.ofNullable(tables.get(TableInfo.key(name)));
    }

    public boolean hasTable(String name) {
        return tables.containsKey(TableInfo.key(name));
    }

    public Set<String> getFunctions() {
        return functions;
    }

    public boolean hasFunction(String name) {
        return functions.contains(TableInfo.key(name));
    }

    public Optional<ColumnInfo> column(String table, String column) {
        return table(table).flatMap(t -> t.column(column));
    }

    /**
     * Foreign keys in any captured table that point at {@code table.column}.
     */
    public List<ConstraintInfo> inboundForeignKeys(String table, String column) {
        List<ConstraintInfo> result = new ArrayList<>();
        for (TableInfo t : tables.values()) {
            for (ConstraintInfo fk : t.foreignKeys()) {
                if (fk.references(table, column)) {
                    result.add(fk);
                }
            }
        }
        return result;
    }

    public SchemaSnapshot withTable(TableInfo table) {
        Map<String, TableInfo> copy = new LinkedHashMap<>(tables);
        copy.put(TableInfo.key(table.getName()), table);
        return new SchemaSnapshot(copy, functions);
    }

    public SchemaSnapshot withFunction(String name) {
        Set<String> copy = new TreeSet<>(functions);
        copy.add(TableInfo.key(name));
        return new SchemaSnapshot(tables, copy);
    }

    /**
     * Layers {@code other} on top of this snapshot: its tables replace same-named ones here,
     * its functions are added.
     */
    public SchemaSnapshot overlay(SchemaSnapshot other) {
        if (other == null || (other.tables.isEmpty() && other.functions.isEmpty())) {
            return this;
        }
        Map<String, TableInfo> copy = new LinkedHashMap<>(tables);
        copy.putAll(other.tables);
        Set<String> names = new TreeSet<>(functions);
        names.addAll(other.functions);
        return new SchemaSnapshot(copy, names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaSnapshot that)) return false;
        return describe().equals(that.describe());
    }

    @Override
    public int hashCode() {
        return describe().hashCode();
    }

    /**
     * Canonical text used for equality: tables with their columns, constraints, primary keys, indexes and
     * triggers, then functions, all in name order.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        tables.keySet().stream().sorted().forEach(k -> {
            TableInfo t = tables.get(k);
            sb.append(k).append(" pk=").append(t.getPrimaryKey().stream().map(TableInfo::key).toList()).append('\n');
            t.getColumns().stream()
                    .sorted((a, b) -> TableInfo.key(a.name()).compareTo(TableInfo.key(b.name())))
                    .forEach(c -> sb.append("  ").append(TableInfo.key(c.name())).append(' ').append(c.dataType())
                            .append(c.nullable() ? " null" : " not null")
                            .append(c.hasDefault() ? " default " + c.defaultValue() : "").append('\n'));
            t.getConstraints().stream()
                    .sorted((a, b) -> TableInfo.key(a.name()).compareTo(TableInfo.key(b.name())))
                    .forEach(c -> sb.append("  constraint ").append(TableInfo.key(c.name())).append(' ')
                            .append(c.definition().toLowerCase(java.util.Locale.ROOT)).append('\n'));
            t.getIndexes().stream()
                    .sorted((a, b) -> TableInfo.key(a.name()).compareTo(TableInfo.key(b.name())))
                    .forEach(i -> sb.append("  index ").append(TableInfo.key(i.name())).append(i.unique() ? " unique " : " ")
                            .append(i.columns().stream().map(TableInfo::key).toList()).append('\n'));
            t.getTriggers().stream()
                    .map(tr -> TableInfo.key(tr.name()))
                    .sorted()
                    .forEach(name -> sb.append("  trigger ").append(name).append('\n'));
        });
        functions.forEach(f -> sb.append("function ").append(f).append('\n'));
        return sb.toString();
    }

    @Override
    public String toString() {
        return "SchemaSnapshot{" + tables.keySet() + (functions.isEmpty() ? "" : ", functions=" + functions) + "}";
    }
}
