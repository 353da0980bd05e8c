package org.migrata.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Live structure of one table. Lookups by column, constraint, index and trigger name ignore case.
 * Instances are immutable; the {@code with*} methods return modified copies.
 */
public final class TableInfo {

    private final String name;
    private final Map<String, ColumnInfo> columns;
    private final Map<String, ConstraintInfo> constraints;
    private final Map<String, IndexInfo> indexes;
    private final Map<String, TriggerInfo> triggers;
    private final List<String> primaryKey;

    private TableInfo(String name,
                      Map<String, ColumnInfo> columns,
                      Map<String, ConstraintInfo> constraints,
                      Map<String, IndexInfo> indexes,
                      Map<String, TriggerInfo> triggers,
                      List<String> primaryKey) {
        this.name = name;
        this.columns = Collections.unmodifiableMap(columns);
        this.constraints = Collections.unmodifiableMap(constraints);
        this.indexes = Collections.unmodifiableMap(indexes);
        this.triggers = Collections.unmodifiableMap(triggers);
        this.primaryKey = List.copyOf(primaryKey);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Collection<ColumnInfo> getColumns() {
        return columns.values();
    }

    public Collection<ConstraintInfo> getConstraints() {
        return constraints.values();
    }

    public Collection<IndexInfo> getIndexes() {
        return indexes.values();
    }

    public Collection<TriggerInfo> getTriggers() {
        return triggers.values();
    }

    public List<String> getPrimaryKey() {
        return primaryKey;
    }

    public Optional<ColumnInfo> column(String columnName) {
        return Optional.ofNullable(columns.get(key(columnName)));
    }

    public boolean hasColumn(String columnName) {
        return columns.containsKey(key(columnName));
    }

    public Optional<ConstraintInfo> constraint(String constraintName) {
        return Optional.ofNullable(constraints.get(key(constraintName)));
    }

    public boolean hasConstraint(String constraintName) {
        return constraints.containsKey(key(constraintName));
    }

    public Optional<IndexInfo> index(String indexName) {
        return Optional.ofNullable(indexes.get(key(indexName)));
    }

    public boolean hasTrigger(String triggerName) {
        return triggers.containsKey(key(triggerName));
    }

    public List<ConstraintInfo> foreignKeys() {
        return constraints.values().stream().filter(ConstraintInfo::isForeignKey).toList();
    }

    public boolean isPrimaryKeyColumn(String columnName) {
        return primaryKey.stream().anyMatch(c -> c.equalsIgnoreCase(columnName));
    }

    public TableInfo withColumn(ColumnInfo column) {
        return toBuilder().column(column).build();
    }

    public TableInfo withConstraint(ConstraintInfo constraint) {
        return toBuilder().constraint(constraint).build();
    }

    public TableInfo withoutConstraint(String constraintName) {
        Builder b = toBuilder();
        b.constraints.remove(key(constraintName));
        return b.build();
    }

    public TableInfo withIndex(IndexInfo index) {
        return toBuilder().index(index).build();
    }

    public TableInfo withTrigger(TriggerInfo trigger) {
        return toBuilder().trigger(trigger).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(name);
        b.columns.putAll(columns);
        b.constraints.putAll(constraints);
        b.indexes.putAll(indexes);
        b.triggers.putAll(triggers);
        b.primaryKey.addAll(primaryKey);
        return b;
    }

    @Override
    public String toString() {
        return "TableInfo{" + name + ", columns=" + columns.values() + ", constraints=" + constraints.values() + "}";
    }

    static String key(String identifier) {
        return identifier == null ? "" : identifier.toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final String name;
        private final Map<String, ColumnInfo> columns = new LinkedHashMap<>();
        private final Map<String, ConstraintInfo> constraints = new LinkedHashMap<>();
        private final Map<String, IndexInfo> indexes = new LinkedHashMap<>();
        private final Map<String, TriggerInfo> triggers = new LinkedHashMap<>();
        private final List<String> primaryKey = new ArrayList<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Table name must not be blank");
            }
            this.name = name;
        }

        public Builder column(ColumnInfo column) {
            columns.put(key(column.name()), column);
            return this;
        }

        public Builder constraint(ConstraintInfo constraint) {
            constraints.put(key(constraint.name()), constraint);
            return this;
        }

        public Builder index(IndexInfo index) {
            indexes.put(key(index.name()), index);
            return this;
        }

        public Builder trigger(TriggerInfo trigger) {
            triggers.put(key(trigger.name()), trigger);
            return this;
        }

        public Builder primaryKey(List<String> columnNames) {
            primaryKey.clear();
            primaryKey.addAll(columnNames);
            return this;
        }

        public TableInfo build() {
            return new TableInfo(name, new LinkedHashMap<>(columns), new LinkedHashMap<>(constraints),
                    new LinkedHashMap<>(indexes), new LinkedHashMap<>(triggers), primaryKey);
        }
    }
}
