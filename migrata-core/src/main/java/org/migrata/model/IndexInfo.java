package org.migrata.model;

import java.util.List;

public record IndexInfo(String name, String table, List<String> columns, boolean unique) {

    public IndexInfo {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
