package org.migrata.unit;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Set;

/**
 * One guarded operation of a {@link MigrationUnit}. Each variant carries enough structure
 * for the planner to decide applicability from a live snapshot, without parsing DDL text.
 * In unit files the variant is selected by the {@code op} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EnsureTable.class, name = "ensureTable"),
        @JsonSubTypes.Type(value = EnsureColumn.class, name = "ensureColumn"),
        @JsonSubTypes.Type(value = AlterColumnType.class, name = "alterColumnType"),
        @JsonSubTypes.Type(value = EnsureIndex.class, name = "ensureIndex"),
        @JsonSubTypes.Type(value = EnsureForeignKey.class, name = "ensureForeignKey"),
        @JsonSubTypes.Type(value = DropForeignKey.class, name = "dropForeignKey"),
        @JsonSubTypes.Type(value = Backfill.class, name = "backfill"),
        @JsonSubTypes.Type(value = DynamicTypeColumn.class, name = "dynamicTypeColumn"),
        @JsonSubTypes.Type(value = SetColumnDefault.class, name = "setColumnDefault"),
        @JsonSubTypes.Type(value = EnsureFunction.class, name = "ensureFunction"),
        @JsonSubTypes.Type(value = EnsureTrigger.class, name = "ensureTrigger")
})
public interface OperationSpec {

    <R> R accept(OperationVisitor<R> visitor);

    /**
     * The table this operation changes; null for schema-level objects such as functions.
     */
    String table();

    /**
     * Every table whose live state the planner needs to classify this operation.
     */
    default Set<String> referencedTables() {
        return Set.of(table());
    }

    /**
     * Routines whose existence the planner needs to classify this operation.
     */
    default Set<String> referencedFunctions() {
        return Set.of();
    }

    /**
     * Short human-readable identity, used in plans and error reports.
     */
    String describe();

    /**
     * Structural operations change the schema; data operations (backfills) run after them.
     */
    default boolean structural() {
        return true;
    }
}
