package org.migrata.cli;

import org.migrata.cli.service.ConnectionService;
import org.migrata.cli.service.MigrationUnitLoader;
import org.migrata.execution.ExecutionEngine;
import org.migrata.execution.MigrataException;
import org.migrata.execution.MigrationRunner;
import org.migrata.migration.spi.Dialect;
import org.migrata.output.PlanFormatter;
import org.migrata.plan.Plan;
import org.migrata.unit.MigrationUnit;
import picocli.CommandLine;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Dry run: classifies every step of the selected units against the live schema without changing it.
 */
@CommandLine.Command(
        name = "plan",
        mixinStandardHelpOptions = true,
        description = "선택한 유닛을 라이브 스키마와 비교해 실행 계획을 출력합니다. DB는 변경하지 않습니다."
)
public class PlanCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private ConnectionOptions options = new ConnectionOptions();

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "유닛 범위 (N, N..M, N.., ..M)")
    private String range;

    @CommandLine.Option(names = "--out", description = "유닛별 SQL 스크립트(unit-<id>.sql) 저장 위치")
    private Path outputDir;

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
            try (Connection connection = connections.open(settings)) {
                Dialect dialect = connections.dialect(connection, settings);
                ExecutionEngine engine = new ExecutionEngine(connection, dialect, settings.schema(),
                        settings.statementTimeoutSeconds());
                List<Plan> plans = new MigrationRunner(engine).plan(units);

                PlanFormatter formatter = new PlanFormatter();
                for (Plan plan : plans) {
                    System.out.print(formatter.formatText(plan));
                    if (outputDir != null) {
                        formatter.writeSql(plan, outputDir);
                    }
                }
                if (outputDir != null) {
                    System.out.println("SQL scripts written to " + outputDir);
                }
                if (plans.stream().anyMatch(Plan::hasDestructive)) {
                    System.out.println("⚠️ Destructive steps present; apply needs --allow-destructive and a unit that allows them.");
                }
            }
            return ExitCodes.OK;
        } catch (MigrataException e) {
            System.err.println("Planning failed (" + e.getKind() + "): " + e.getMessage());
            return ExitCodes.ERROR;
        } catch (Exception e) {
            System.err.println("Planning failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
