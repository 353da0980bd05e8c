package org.migrata.unit;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered list of guarded operations applied atomically.
 * Units are ordered by {@code id}; a run requires strictly increasing ids.
 */
public record MigrationUnit(long id, String description, List<OperationSpec> operations, boolean destructiveAllowed) {

    public MigrationUnit {
        operations = operations == null ? List.of() : List.copyOf(operations);
        description = description == null ? "" : description;
    }

    public MigrationUnit(long id, String description, List<OperationSpec> operations) {
        this(id, description, operations, false);
    }

    /**
     * Every table the unit's operations mention, in first-mention order.
     */
    public Set<String> referencedTables() {
        Set<String> tables = new LinkedHashSet<>();
        operations.forEach(op -> tables.addAll(op.referencedTables()));
        return tables;
    }

    /**
     * Every routine the unit's operations mention, in first-mention order.
     */
    public Set<String> referencedFunctions() {
        Set<String> functions = new LinkedHashSet<>();
        operations.forEach(op -> functions.addAll(op.referencedFunctions()));
        return functions;
    }
}
