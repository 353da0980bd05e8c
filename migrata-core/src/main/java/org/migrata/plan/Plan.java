package org.migrata.plan;

import lombok.Getter;
import org.migrata.model.SchemaSnapshot;

import java.util.List;

/**
 * Ordered, classified steps for one unit: structural steps in declared order,
 * then foreign keys recreated after a destructive change, then backfills.
 */
@Getter
public class Plan {

    private final long unitId;
    private final String description;
    private final List<PlannedStep> steps;
    /** Schema as it will look once every executable step has run. */
    private final SchemaSnapshot projected;

    public Plan(long unitId, String description, List<PlannedStep> steps, SchemaSnapshot projected) {
        this.unitId = unitId;
        this.description = description;
        this.steps = List.copyOf(steps);
        this.projected = projected;
    }

    public boolean hasDestructive() {
        return steps.stream().anyMatch(s -> s.getClassification() == Classification.DESTRUCTIVE);
    }

    public List<PlannedStep> destructiveSteps() {
        return steps.stream().filter(s -> s.getClassification() == Classification.DESTRUCTIVE).toList();
    }

    public List<PlannedStep> executableSteps() {
        return steps.stream().filter(PlannedStep::isExecutable).toList();
    }

    public long count(Classification classification) {
        return steps.stream().filter(s -> s.getClassification() == classification).count();
    }
}
