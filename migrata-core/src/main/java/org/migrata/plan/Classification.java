package org.migrata.plan;

public enum Classification {
    /** Already satisfied by the live schema; no database interaction. */
    SKIP,
    /** Safe to execute. */
    APPLY,
    /** Loses data; executes only when both the unit and the caller authorize it. */
    DESTRUCTIVE
}
