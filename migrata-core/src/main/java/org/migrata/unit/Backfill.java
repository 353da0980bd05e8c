package org.migrata.unit;

/**
 * Set-based data correction: {@code UPDATE table SET assignment WHERE predicate}.
 * The predicate is mandatory and must stop matching once the assignment has been applied.
 */
public record Backfill(String table, String predicate, String assignment) implements OperationSpec {

    public Backfill {
        Specs.require(table, "table", "backfill");
        Specs.require(predicate, "predicate", "backfill");
        Specs.require(assignment, "assignment", "backfill");
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitBackfill(this);
    }

    @Override
    public boolean structural() {
        return false;
    }

    @Override
    public String describe() {
        return "Backfill " + table + " SET " + assignment + " WHERE " + predicate;
    }
}
