package org.migrata.output;

import org.migrata.plan.Classification;
import org.migrata.plan.Plan;
import org.migrata.plan.PlannedStep;
import org.migrata.plan.StepOrigin;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Renders plans for people: a classified step listing, or the SQL script that {@code apply} would run.
 */
public class PlanFormatter {

    private final Clock clock;

    public PlanFormatter() {
        this(Clock.systemDefaultZone());
    }

    public PlanFormatter(Clock clock) {
        this.clock = clock;
    }

    public String formatText(Plan plan) {
        StringBuilder sb = new StringBuilder();
        sb.append("Unit ").append(plan.getUnitId());
        if (!plan.getDescription().isEmpty()) {
            sb.append(": ").append(plan.getDescription());
        }
        sb.append('\n');
        for (PlannedStep step : plan.getSteps()) {
            sb.append(String.format("  %-11s %s%s%n", step.getClassification(), step.getOperation().describe(),
                    step.getOrigin() == StepOrigin.DERIVED ? " (derived)" : ""));
            if (step.getRationale() != null && !step.getRationale().isEmpty()) {
                sb.append("              ").append(step.getRationale()).append('\n');
            }
        }
        sb.append(String.format("  %d to apply, %d destructive, %d skipped%n",
                plan.count(Classification.APPLY),
                plan.count(Classification.DESTRUCTIVE),
                plan.count(Classification.SKIP)));
        return sb.toString();
    }

    /**
     * SQL script for every executable step, in execution order. Backfills are included although
     * {@code apply} counts them only when they touch rows.
     */
    public String formatSql(Plan plan) {
        StringBuilder sb = new StringBuilder(header(plan)).append('\n');
        for (PlannedStep step : plan.executableSteps()) {
            sb.append("-- ").append(step.getClassification()).append(": ").append(step.getOperation().describe())
                    .append('\n');
            for (String statement : step.getStatements()) {
                sb.append(statement).append(";\n");
            }
        }
        return sb.toString();
    }

    /**
     * Writes {@code unit-<id>.sql} into {@code outputDir}.
     */
    public Path writeSql(Plan plan, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve("unit-" + plan.getUnitId() + ".sql");
        Files.writeString(file, formatSql(plan));
        return file;
    }

    private String header(Plan plan) {
        return String.format("""
            -- migrata plan
            -- migrata:unit=%d
            -- migrata:description=%s
            -- migrata:destructive=%s
            -- migrata:generated=%s
            """,
            plan.getUnitId(),
            plan.getDescription(),
            plan.hasDestructive(),
            LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        );
    }
}
