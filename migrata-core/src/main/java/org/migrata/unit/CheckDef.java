package org.migrata.unit;

public record CheckDef(String name, String expression) {

    public CheckDef {
        Specs.require(expression, "expression", "check");
    }
}
