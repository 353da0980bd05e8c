package org.migrata.model;

public enum ConstraintKind {
    FOREIGN_KEY,
    UNIQUE,
    CHECK
}
