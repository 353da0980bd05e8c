package org.migrata.introspect;

import org.migrata.model.SchemaSnapshot;

import java.util.Set;

public interface SchemaIntrospector {

    /**
     * Reads the live catalog for {@code tables}. Tables that do not exist are absent from the result.
     * The result also holds every table with a foreign key into the requested ones (transitively)
     * and the tables those reference directly.
     *
     * @throws IntrospectionException when the catalog cannot be read
     */
    default SchemaSnapshot snapshot(Set<String> tables) {
        return snapshot(tables, Set.of());
    }

    /**
     * Same as {@link #snapshot(Set)}, and also records which of {@code functions} exist in the schema.
     *
     * @throws IntrospectionException when the catalog cannot be read
     */
    SchemaSnapshot snapshot(Set<String> tables, Set<String> functions);
}
