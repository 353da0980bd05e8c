package org.migrata.unit;

final class Specs {

    private Specs() {}

    static String require(String value, String field, String op) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(op + ": '" + field + "' is required");
        }
        return value;
    }
}
