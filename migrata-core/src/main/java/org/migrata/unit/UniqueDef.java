package org.migrata.unit;

import java.util.List;

public record UniqueDef(String name, List<String> columns) {

    public UniqueDef {
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("unique: 'columns' is required");
        }
    }
}
