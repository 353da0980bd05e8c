package org.migrata.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A named table constraint. Foreign keys carry their structured columns and referenced side,
 * checks carry their clause; {@link #definition()} renders a dialect-neutral description of either.
 */
public record ConstraintInfo(
        String name,
        ConstraintKind kind,
        String table,
        List<String> columns,
        String referencedTable,
        List<String> referencedColumns,
        OnDeleteAction onDelete,
        String checkClause
) {

    public ConstraintInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        columns = columns == null ? List.of() : List.copyOf(columns);
        referencedColumns = referencedColumns == null ? List.of() : List.copyOf(referencedColumns);
        if (kind == ConstraintKind.FOREIGN_KEY && onDelete == null) {
            onDelete = OnDeleteAction.NO_ACTION;
        }
    }

    public static ConstraintInfo foreignKey(String name, String table, List<String> columns,
                                            String referencedTable, List<String> referencedColumns,
                                            OnDeleteAction onDelete) {
        return new ConstraintInfo(name, ConstraintKind.FOREIGN_KEY, table, columns,
                referencedTable, referencedColumns, onDelete, null);
    }

    public static ConstraintInfo unique(String name, String table, List<String> columns) {
        return new ConstraintInfo(name, ConstraintKind.UNIQUE, table, columns, null, null, null, null);
    }

    public static ConstraintInfo check(String name, String table, String clause) {
        return new ConstraintInfo(name, ConstraintKind.CHECK, table, null, null, null, null, clause);
    }

    public boolean isForeignKey() {
        return kind == ConstraintKind.FOREIGN_KEY;
    }

    public String definition() {
        return switch (kind) {
            case FOREIGN_KEY -> "FOREIGN KEY (" + String.join(", ", columns) + ") REFERENCES "
                    + referencedTable + " (" + String.join(", ", referencedColumns) + ") ON DELETE " + onDelete.sql();
            case UNIQUE -> "UNIQUE (" + String.join(", ", columns) + ")";
            case CHECK -> "CHECK (" + checkClause + ")";
        };
    }

    /**
     * True when this constraint's owning side lists {@code column} of {@code table}.
     */
    public boolean constrains(String table, String column) {
        return this.table != null && this.table.equalsIgnoreCase(table) && containsIgnoreCase(columns, column);
    }

    /**
     * True when this foreign key points at {@code column} of {@code table}.
     */
    public boolean references(String table, String column) {
        return isForeignKey()
                && referencedTable != null && referencedTable.equalsIgnoreCase(table)
                && containsIgnoreCase(referencedColumns, column);
    }

    /**
     * Same kind and same structure, ignoring the constraint name and identifier case.
     */
    public boolean isEquivalentTo(ConstraintInfo other) {
        if (other == null || kind != other.kind) {
            return false;
        }
        return switch (kind) {
            case FOREIGN_KEY -> lower(columns).equals(lower(other.columns))
                    && referencedTable.equalsIgnoreCase(other.referencedTable)
                    && lower(referencedColumns).equals(lower(other.referencedColumns))
                    && onDelete == other.onDelete;
            case UNIQUE -> lower(columns).equals(lower(other.columns));
            case CHECK -> Objects.equals(squash(checkClause), squash(other.checkClause));
        };
    }

    private static boolean containsIgnoreCase(List<String> values, String needle) {
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(needle));
    }

    private static List<String> lower(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(java.util.Locale.ROOT)).collect(Collectors.toList());
    }

    private static String squash(String clause) {
        return clause == null ? null
                : clause.replaceAll("[\\s()\"]", "").toLowerCase(java.util.Locale.ROOT);
    }
}
