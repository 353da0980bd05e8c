package org.migrata.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for migrata.
 * Plans and applies ordered migration units against a live database.
 */
@CommandLine.Command(
        name = "migrata",
        mixinStandardHelpOptions = true,
        version = "migrata 0.1.0",
        description = "라이브 스키마를 기준으로 마이그레이션 유닛을 계획하고 적용하는 툴",
        subcommands = {
                PlanCommand.class,
                ApplyCommand.class,
                StatusCommand.class
        }
)
public class MigrataCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MigrataCli()).execute(args);
        System.exit(exitCode);
    }
}
