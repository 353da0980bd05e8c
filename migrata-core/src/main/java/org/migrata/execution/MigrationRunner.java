package org.migrata.execution;

import lombok.extern.slf4j.Slf4j;
import org.migrata.history.ExecutionHistory;
import org.migrata.model.SchemaSnapshot;
import org.migrata.plan.Plan;
import org.migrata.unit.MigrationUnit;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies units in id order, one transaction each, and stops at the first unit that aborts.
 */
@Slf4j
public class MigrationRunner {

    private final ExecutionEngine engine;
    private final ExecutionHistory history;

    public MigrationRunner(ExecutionEngine engine) {
        this(engine, ExecutionHistory.none());
    }

    public MigrationRunner(ExecutionEngine engine, ExecutionHistory history) {
        this.engine = engine;
        this.history = history;
    }

    /**
     * @return one result per attempted unit; the last one is aborted when the run stopped early
     */
    public List<ExecutionResult> apply(List<MigrationUnit> units, boolean allowDestructive) {
        requireIncreasingIds(units);
        List<ExecutionResult> results = new ArrayList<>();
        for (MigrationUnit unit : units) {
            ExecutionResult result = engine.apply(unit, allowDestructive);
            results.add(result);
            recordQuietly(result);
            if (result.isAborted()) {
                log.warn("Stopping at unit {}; {} later unit(s) not attempted",
                        unit.id(), units.size() - results.size());
                break;
            }
        }
        return results;
    }

    /**
     * Dry run over the whole list. Each unit is planned against the live schema plus the projection
     * left by the units before it.
     */
    public List<Plan> plan(List<MigrationUnit> units) {
        requireIncreasingIds(units);
        List<Plan> plans = new ArrayList<>();
        SchemaSnapshot assumed = SchemaSnapshot.empty();
        for (MigrationUnit unit : units) {
            Plan plan;
            try {
                plan = engine.plan(unit, assumed);
            } catch (MigrataException e) {
                throw new MigrataException(e.getKind(), "Unit " + unit.id() + ": " + e.getMessage(), e);
            }
            plans.add(plan);
            assumed = assumed.overlay(plan.getProjected());
        }
        return plans;
    }

    private void recordQuietly(ExecutionResult result) {
        try {
            history.record(result);
        } catch (IOException e) {
            log.warn("Could not record history for unit {}: {}", result.getUnitId(), e.getMessage());
        }
    }

    static void requireIncreasingIds(List<MigrationUnit> units) {
        for (int i = 1; i < units.size(); i++) {
            if (units.get(i).id() <= units.get(i - 1).id()) {
                throw new IllegalArgumentException("Unit ids must be strictly increasing: "
                        + units.get(i - 1).id() + " is followed by " + units.get(i).id());
            }
        }
    }
}
