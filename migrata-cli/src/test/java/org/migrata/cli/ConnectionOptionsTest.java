package org.migrata.cli;

import org.migrata.config.ConfigurationLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionOptionsTest {

    @TempDir
    Path tmp;

    private ConnectionOptions parse(String... args) {
        ConnectionOptions options = new ConnectionOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }

    @Test
    @DisplayName("CLI 값이 설정 파일보다 우선한다")
    void commandLineWinsOverConfiguration() throws IOException {
        // given
        Files.writeString(tmp.resolve("migrata.yaml"), """
                profiles:
                  ci:
                    database:
                      url: jdbc:h2:mem:ci
                      username: ci
                      password: hunter2
                    migrations:
                      directory: db/units
                    execution:
                      statementTimeoutSeconds: 15
                """);
        ConnectionOptions options = parse("--profile", "ci", "--db-user", "admin", "--statement-timeout", "3");

        // when
        ConnectionOptions.Settings settings = options.resolve(new ConfigurationLoader(tmp));

        // then
        assertThat(settings.url()).isEqualTo("jdbc:h2:mem:ci");
        assertThat(settings.username()).isEqualTo("admin");
        assertThat(settings.password()).isEqualTo("hunter2");
        assertThat(settings.migrationsDir()).isEqualTo(Path.of("db/units"));
        assertThat(settings.statementTimeoutSeconds()).isEqualTo(3);
        assertThat(settings.toString()).doesNotContain("hunter2");
    }

    @Test
    void defaultsWithoutConfiguration() {
        ConnectionOptions.Settings settings = parse("--profile", "dev").resolve(new ConfigurationLoader(tmp));

        assertThat(settings.url()).isNull();
        assertThat(settings.migrationsDir()).isEqualTo(Path.of("migrations"));
        assertThat(settings.historyDir()).isEqualTo(Path.of(".migrata/history"));
        assertThat(settings.statementTimeoutSeconds()).isZero();
    }
}
