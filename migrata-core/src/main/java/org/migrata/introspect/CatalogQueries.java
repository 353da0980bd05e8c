package org.migrata.introspect;

/**
 * information_schema queries for what {@link java.sql.DatabaseMetaData} does not expose:
 * named unique and check constraints, triggers and routines. Both PostgreSQL and H2 2.x answer them.
 */
final class CatalogQueries {
    private CatalogQueries() {}

    static final String UNIQUE_AND_CHECK_CONSTRAINTS = """
            SELECT tc.constraint_name,
                   tc.constraint_type,
                   cc.check_clause
            FROM information_schema.table_constraints tc
            LEFT JOIN information_schema.check_constraints cc
              ON cc.constraint_schema = tc.constraint_schema
             AND cc.constraint_name = tc.constraint_name
            WHERE tc.table_schema = ?
              AND tc.table_name = ?
              AND tc.constraint_type IN ('UNIQUE', 'CHECK')
            ORDER BY tc.constraint_name
            """;

    static final String CONSTRAINT_COLUMNS = """
            SELECT kcu.column_name
            FROM information_schema.key_column_usage kcu
            WHERE kcu.table_schema = ?
              AND kcu.table_name = ?
              AND kcu.constraint_name = ?
            ORDER BY kcu.ordinal_position
            """;

    static final String TRIGGERS = """
            SELECT DISTINCT t.trigger_name
            FROM information_schema.triggers t
            WHERE t.event_object_schema = ?
              AND t.event_object_table = ?
            ORDER BY t.trigger_name
            """;

    static final String ROUTINE_EXISTS = """
            SELECT COUNT(*)
            FROM information_schema.routines r
            WHERE r.routine_schema = ?
              AND LOWER(r.routine_name) = LOWER(?)
            """;
}
