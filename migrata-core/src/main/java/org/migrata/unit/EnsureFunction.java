package org.migrata.unit;

import java.util.Set;

/**
 * Schema-level routine, created only when no routine of that name exists. An existing routine is never
 * replaced, whatever its body. {@code body} is handed to the dialect verbatim: procedural source for
 * PostgreSQL, Java source for H2.
 */
public record EnsureFunction(String name, String returns, String language, String body) implements OperationSpec {

    public EnsureFunction {
        Specs.require(name, "name", "ensureFunction");
        Specs.require(body, "body", "ensureFunction");
        returns = returns == null || returns.isBlank() ? "trigger" : returns;
        language = language == null || language.isBlank() ? "plpgsql" : language;
    }

    public EnsureFunction(String name, String body) {
        this(name, null, null, body);
    }

    /**
     * Functions belong to the schema, not to a table.
     */
    @Override
    public String table() {
        return null;
    }

    @Override
    public Set<String> referencedTables() {
        return Set.of();
    }

    @Override
    public Set<String> referencedFunctions() {
        return Set.of(name);
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitEnsureFunction(this);
    }

    @Override
    public String describe() {
        return "EnsureFunction " + name + "() RETURNS " + returns;
    }
}
