package org.migrata.cli;

import org.migrata.config.ConfigurationLoader;
import org.migrata.options.MigrataOptions;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Map;

/**
 * Options shared by the commands. Values given on the command line win over {@code migrata.yaml}.
 */
public class ConnectionOptions {

    @CommandLine.Option(names = "--db-url", description = "JDBC URL")
    String url;
    @CommandLine.Option(names = "--db-user", description = "DB 사용자")
    String username;
    @CommandLine.Option(names = "--db-password", description = "DB 비밀번호", interactive = true, arity = "0..1")
    String password;
    @CommandLine.Option(names = "--schema", description = "대상 스키마 (기본값: 커넥션의 현재 스키마)")
    String schema;
    @CommandLine.Option(names = {"-d", "--dialect"}, description = "DB 방언(postgresql, h2). 생략 시 커넥션에서 감지")
    String dialect;
    @CommandLine.Option(names = {"-m", "--migrations"}, description = "마이그레이션 유닛 파일 폴더")
    Path migrationsDir;
    @CommandLine.Option(names = "--history", description = "실행 이력 저장 폴더")
    Path historyDir;
    @CommandLine.Option(names = "--statement-timeout", description = "구문별 타임아웃(초), 0이면 제한 없음")
    Integer statementTimeoutSeconds;
    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    String profile;

    /**
     * Merges the command line with the active configuration profile.
     */
    public Settings resolve() {
        return resolve(new ConfigurationLoader());
    }

    Settings resolve(ConfigurationLoader loader) {
        Map<String, String> config = loader.loadConfiguration(profile);
        return new Settings(
                firstNonBlank(url, config.get(MigrataOptions.Database.URL_KEY)),
                firstNonBlank(username, config.get(MigrataOptions.Database.USERNAME_KEY)),
                firstNonBlank(password, config.get(MigrataOptions.Database.PASSWORD_KEY)),
                firstNonBlank(schema, config.get(MigrataOptions.Database.SCHEMA_KEY)),
                firstNonBlank(dialect, config.get(MigrataOptions.Database.DIALECT_KEY)),
                migrationsDir != null ? migrationsDir
                        : Path.of(config.getOrDefault(MigrataOptions.Paths.MIGRATIONS_DIR_KEY,
                        MigrataOptions.Paths.MIGRATIONS_DIR_DEFAULT)),
                historyDir != null ? historyDir
                        : Path.of(config.getOrDefault(MigrataOptions.Paths.HISTORY_DIR_KEY,
                        MigrataOptions.Paths.HISTORY_DIR_DEFAULT)),
                statementTimeoutSeconds != null ? statementTimeoutSeconds : parseTimeout(config));
    }

    private static int parseTimeout(Map<String, String> config) {
        String value = config.get(MigrataOptions.Execution.STATEMENT_TIMEOUT_KEY);
        if (value == null) {
            return MigrataOptions.Execution.STATEMENT_TIMEOUT_DEFAULT;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            System.err.println("Warning: Invalid statement timeout in configuration: " + value +
                    ". Using default: " + MigrataOptions.Execution.STATEMENT_TIMEOUT_DEFAULT);
            return MigrataOptions.Execution.STATEMENT_TIMEOUT_DEFAULT;
        }
    }

    private static String firstNonBlank(String cli, String configured) {
        return cli != null && !cli.isBlank() ? cli : configured;
    }

    public record Settings(String url,
                           String username,
                           String password,
                           String schema,
                           String dialect,
                           Path migrationsDir,
                           Path historyDir,
                           int statementTimeoutSeconds) {

        @Override
        public String toString() {
            return "Settings{url=" + url + ", username=" + username + ", schema=" + schema
                    + ", dialect=" + dialect + ", migrationsDir=" + migrationsDir + "}";
        }
    }
}
