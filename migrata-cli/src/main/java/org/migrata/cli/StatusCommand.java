package org.migrata.cli;

import org.migrata.cli.service.MigrationUnitLoader;
import org.migrata.execution.ExecutionResult;
import org.migrata.history.ExecutionHistory;
import org.migrata.history.JsonFileExecutionHistory;
import org.migrata.unit.MigrationUnit;
import picocli.CommandLine;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Lists known units with the last recorded outcome of each. Reads history only, never the database.
 */
@CommandLine.Command(
        name = "status",
        mixinStandardHelpOptions = true,
        description = "유닛별 마지막 실행 결과를 보여줍니다. (참고용 이력이며 계획에는 사용되지 않습니다)"
)
public class StatusCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private ConnectionOptions options = new ConnectionOptions();

    @Override
    public Integer call() {
        try {
            ConnectionOptions.Settings settings = options.resolve();
            List<MigrationUnit> units = new MigrationUnitLoader().loadAll(settings.migrationsDir());
            ExecutionHistory history = new JsonFileExecutionHistory(settings.historyDir());

            if (units.isEmpty()) {
                System.out.println("No migration units found in " + settings.migrationsDir());
                return ExitCodes.OK;
            }
            for (MigrationUnit unit : units) {
                Optional<ExecutionResult> last = history.find(unit.id());
                System.out.printf("%6d  %-10s %s%n", unit.id(), last.map(StatusCommand::state).orElse("pending"),
                        unit.description());
                last.ifPresent(r -> System.out.println("        last run " + r.getExecutedAt()));
            }
            return ExitCodes.OK;
        } catch (Exception e) {
            System.err.println("Status failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }

    private static String state(ExecutionResult result) {
        if (result.isBlocked()) {
            return "blocked";
        }
        return result.isAborted() ? "failed" : "applied";
    }
}
