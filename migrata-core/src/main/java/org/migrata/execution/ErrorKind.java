package org.migrata.execution;

public enum ErrorKind {
    /** Catalog unreachable or unreadable. Fatal for the unit, nothing was mutated. */
    INTROSPECTION_FAILED,
    /** A dynamic-type column's donor could not be resolved. Nothing was mutated. */
    TYPE_DETECTION_FAILED,
    /** A destructive step was planned without authorization. Nothing was mutated. */
    DESTRUCTIVE_CHANGE_BLOCKED,
    /** An operation referenced objects that neither exist nor are created earlier in the unit. */
    PLANNING_FAILED,
    /** A statement violated a database-enforced constraint. The unit was rolled back. */
    CONSTRAINT_VIOLATION,
    /** The connection cancelled a statement. The unit was rolled back and can be retried. */
    EXECUTION_TIMEOUT,
    /** Any other statement failure. The unit was rolled back. */
    EXECUTION_FAILED
}
