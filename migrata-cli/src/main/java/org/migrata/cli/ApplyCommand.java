package org.migrata.cli;

import org.migrata.cli.service.ConnectionService;
import org.migrata.cli.service.MigrationUnitLoader;
import org.migrata.execution.ErrorInfo;
import org.migrata.execution.ExecutionEngine;
import org.migrata.execution.ExecutionResult;
import org.migrata.execution.MigrationRunner;
import org.migrata.history.JsonFileExecutionHistory;
import org.migrata.migration.spi.Dialect;
import org.migrata.unit.MigrationUnit;
import picocli.CommandLine;

import java.sql.Connection;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Applies the selected units in id order, one transaction per unit.
 */
@CommandLine.Command(
        name = "apply",
        mixinStandardHelpOptions = true,
        description = "선택한 유닛을 순서대로 적용합니다. 유닛마다 하나의 트랜잭션으로 실행됩니다."
)
public class ApplyCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private ConnectionOptions options = new ConnectionOptions();

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "유닛 범위 (N, N..M, N.., ..M)")
    private String range;

    @CommandLine.Option(names = "--allow-destructive",
            description = "데이터 손실이 있는 변경을 허용합니다. 유닛에도 destructiveAllowed가 필요합니다.")
    private boolean allowDestructive;

    @Override
    public Integer call() {
        try {
            ConnectionOptions.Settings settings = options.resolve();
            List<MigrationUnit> units = UnitRange.parse(range)
                    .filter(new MigrationUnitLoader().loadAll(settings.migrationsDir()));
            if (units.isEmpty()) {
                System.out.println("No migration units found in " + settings.migrationsDir());
                return ExitCodes.OK;
            }

            ConnectionService connections = new ConnectionService();
            List<ExecutionResult> results;
            try (Connection connection = connections.open(settings)) {
                Dialect dialect = connections.dialect(connection, settings);
                ExecutionEngine engine = new ExecutionEngine(connection, dialect, settings.schema(),
                        settings.statementTimeoutSeconds());
                results = new MigrationRunner(engine, new JsonFileExecutionHistory(settings.historyDir()))
                        .apply(units, allowDestructive);
            }

            results.forEach(ApplyCommand::print);
            ExecutionResult last = results.get(results.size() - 1);
            if (last.isBlocked()) {
                System.err.println("\n   To proceed, mark the unit destructiveAllowed and use --allow-destructive.");
                return ExitCodes.DESTRUCTIVE_BLOCKED;
            }
            return last.isAborted() ? ExitCodes.ERROR : ExitCodes.OK;
        } catch (Exception e) {
            System.err.println("Apply failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }

    private static void print(ExecutionResult result) {
        if (!result.isAborted()) {
            System.out.printf("Unit %d applied: %d applied, %d skipped, %d row(s) backfilled%n",
                    result.getUnitId(), result.getAppliedCount(), result.getSkippedCount(), result.getRowsAffected());
            return;
        }
        ErrorInfo error = result.getError();
        System.err.printf("Unit %d aborted (%s): %s%n", result.getUnitId(), error.getKind(), error.getMessage());
        if (error.getFailingStep() != null) {
            System.err.println("   - failing step: " + error.getFailingStep());
        }
    }
}
