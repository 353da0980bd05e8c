package org.migrata.execution;

import lombok.extern.slf4j.Slf4j;
import org.migrata.introspect.JdbcSchemaIntrospector;
import org.migrata.introspect.SchemaIntrospector;
import org.migrata.migration.spi.Dialect;
import org.migrata.model.SchemaSnapshot;
import org.migrata.plan.Classification;
import org.migrata.plan.OperationPlanner;
import org.migrata.plan.Plan;
import org.migrata.plan.PlannedStep;
import org.migrata.unit.Backfill;
import org.migrata.unit.MigrationUnit;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

/**
 * Plans a unit against a fresh snapshot and applies it in one transaction.
 *
 * <p>Destructive steps run only when both the unit and the caller authorize them; otherwise the unit
 * is aborted before any statement is sent. Any statement failure rolls back the whole unit.
 */
@Slf4j
public class ExecutionEngine {

    private final Connection connection;
    private final SchemaIntrospector introspector;
    private final OperationPlanner planner;
    private final BackfillExecutor backfillExecutor;
    private final int statementTimeoutSeconds;
    private final Clock clock;

    public ExecutionEngine(Connection connection, Dialect dialect, String schema, int statementTimeoutSeconds) {
        this(connection,
                new JdbcSchemaIntrospector(connection, dialect, schema),
                new OperationPlanner(dialect),
                new BackfillExecutor(dialect, statementTimeoutSeconds),
                statementTimeoutSeconds,
                Clock.systemDefaultZone());
    }

    public ExecutionEngine(Connection connection,
                           SchemaIntrospector introspector,
                           OperationPlanner planner,
                           BackfillExecutor backfillExecutor,
                           int statementTimeoutSeconds,
                           Clock clock) {
        this.connection = connection;
        this.introspector = introspector;
        this.planner = planner;
        this.backfillExecutor = backfillExecutor;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
        this.clock = clock;
    }

    /**
     * Dry run: classifies the unit against the live schema without executing anything.
     */
    public Plan plan(MigrationUnit unit) {
        return plan(unit, null);
    }

    /**
     * Dry run against the live schema with {@code assumed} layered on top, e.g. the projection left by
     * earlier units of the same dry run.
     */
    public Plan plan(MigrationUnit unit, SchemaSnapshot assumed) {
        SchemaSnapshot snapshot = introspector.snapshot(unit.referencedTables(), unit.referencedFunctions());
        return planner.plan(unit, assumed == null ? snapshot : snapshot.overlay(assumed));
    }

    public ExecutionResult apply(MigrationUnit unit, boolean allowDestructive) {
        String executedAt = LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);

        Plan plan;
        try {
            plan = plan(unit);
        } catch (MigrataException e) {
            log.error("Unit {} could not be planned: {}", unit.id(), e.getMessage());
            return aborted(unit, executedAt, 0, ErrorInfo.builder().kind(e.getKind()).message(e.getMessage()).build());
        }

        if (plan.hasDestructive() && !(unit.destructiveAllowed() && allowDestructive)) {
            String steps = plan.destructiveSteps().stream()
                    .map(s -> s.getOperation().describe())
                    .collect(Collectors.joining("; "));
            String reason = !unit.destructiveAllowed()
                    ? "unit does not allow destructive changes" : "caller did not allow destructive changes";
            log.warn("Unit {} blocked ({}): {}", unit.id(), reason, steps);
            return aborted(unit, executedAt, (int) plan.count(Classification.SKIP), ErrorInfo.builder()
                    .kind(ErrorKind.DESTRUCTIVE_CHANGE_BLOCKED)
                    .message("Destructive change blocked, " + reason + ": " + steps)
                    .failingStep(plan.destructiveSteps().get(0).getOperation().describe())
                    .build());
        }

        if (plan.executableSteps().isEmpty()) {
            log.info("Unit {} is already applied ({} step(s) skipped)", unit.id(), plan.getSteps().size());
            return ExecutionResult.builder()
                    .unitId(unit.id())
                    .description(unit.description())
                    .skippedCount(plan.getSteps().size())
                    .executedAt(executedAt)
                    .build();
        }

        try {
            return execute(unit, plan, executedAt);
        } catch (SQLException e) {
            // autocommit could not be read or switched; nothing was executed
            log.error("Unit {} could not open a transaction: {}", unit.id(), e.getMessage());
            return aborted(unit, executedAt, 0, ErrorInfo.builder()
                    .kind(SqlErrorClassifier.classify(e))
                    .message(e.getMessage())
                    .sqlState(e.getSQLState())
                    .build());
        }
    }

    private ExecutionResult execute(MigrationUnit unit, Plan plan, String executedAt) throws SQLException {
        boolean oldAutoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        int applied = 0;
        int skipped = 0;
        long rows = 0;
        PlannedStep current = null;
        try {
            for (PlannedStep step : plan.getSteps()) {
                if (!step.isExecutable()) {
                    skipped++;
                    continue;
                }
                current = step;
                if (step.isBackfill()) {
                    int updated = backfillExecutor.execute(connection, (Backfill) step.getOperation());
                    rows += updated;
                    if (updated > 0) {
                        applied++;
                    } else {
                        skipped++;
                    }
                } else {
                    for (String sql : step.getStatements()) {
                        executeStatement(sql);
                    }
                    applied++;
                }
            }
            connection.commit();
            log.info("Unit {} committed: {} applied, {} skipped, {} row(s) backfilled", unit.id(), applied, skipped, rows);
            return ExecutionResult.builder()
                    .unitId(unit.id())
                    .description(unit.description())
                    .appliedCount(applied)
                    .skippedCount(skipped)
                    .rowsAffected(rows)
                    .executedAt(executedAt)
                    .build();
        } catch (SQLException e) {
            rollback(unit, e);
            ErrorKind kind = SqlErrorClassifier.classify(e);
            String failing = current != null ? current.getOperation().describe() : null;
            log.error("Unit {} rolled back, {} failed with {}: {}", unit.id(), failing, kind, e.getMessage());
            return aborted(unit, executedAt, (int) plan.count(Classification.SKIP), ErrorInfo.builder()
                    .kind(kind)
                    .message(e.getMessage())
                    .failingStep(failing)
                    .sqlState(e.getSQLState())
                    .build());
        } catch (RuntimeException e) {
            // restoring autocommit would commit the open transaction
            rollback(unit, e);
            ErrorKind kind = e instanceof MigrataException m ? m.getKind() : ErrorKind.EXECUTION_FAILED;
            String failing = current != null ? current.getOperation().describe() : null;
            log.error("Unit {} rolled back after unexpected failure in {}", unit.id(), failing, e);
            return aborted(unit, executedAt, (int) plan.count(Classification.SKIP), ErrorInfo.builder()
                    .kind(kind)
                    .message(String.valueOf(e.getMessage()))
                    .failingStep(failing)
                    .build());
        } finally {
            restoreAutoCommit(oldAutoCommit);
        }
    }

    private void executeStatement(String sql) throws SQLException {
        log.debug("Executing: {}", sql);
        try (Statement statement = connection.createStatement()) {
            if (statementTimeoutSeconds > 0) {
                statement.setQueryTimeout(statementTimeoutSeconds);
            }
            statement.execute(sql);
        }
    }

    private void rollback(MigrationUnit unit, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            log.error("Rollback of unit {} failed: {}", unit.id(), rollbackFailure.getMessage());
        }
    }

    private void restoreAutoCommit(boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Could not restore autocommit={}: {}", autoCommit, e.getMessage());
        }
    }

    private static ExecutionResult aborted(MigrationUnit unit, String executedAt, int skipped, ErrorInfo error) {
        return ExecutionResult.builder()
                .unitId(unit.id())
                .description(unit.description())
                .skippedCount(skipped)
                .aborted(true)
                .error(error)
                .executedAt(executedAt)
                .build();
    }
}
