package org.migrata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.migrata.options.MigrataOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = MigrataOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = MigrataOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = MigrataOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    // 테스트 용
    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<MigrataConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 migrata.yaml을 찾습니다.
     */
    private Optional<MigrataConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    log.debug("Loading configuration from {}", configFile);
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), MigrataConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(MigrataConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var db = profileConfig.getDatabase();
        if (db != null) {
            putIfPresent(configMap, MigrataOptions.Database.URL_KEY, db.getUrl());
            putIfPresent(configMap, MigrataOptions.Database.USERNAME_KEY, db.getUsername());
            putIfPresent(configMap, MigrataOptions.Database.PASSWORD_KEY, db.getPassword());
            putIfPresent(configMap, MigrataOptions.Database.SCHEMA_KEY, db.getSchema());
            putIfPresent(configMap, MigrataOptions.Database.DIALECT_KEY, db.getDialect());
        }

        var migrations = profileConfig.getMigrations();
        if (migrations != null) {
            putIfPresent(configMap, MigrataOptions.Paths.MIGRATIONS_DIR_KEY, migrations.getDirectory());
            putIfPresent(configMap, MigrataOptions.Paths.HISTORY_DIR_KEY, migrations.getHistoryDirectory());
        }

        var execution = profileConfig.getExecution();
        if (execution != null && execution.getStatementTimeoutSeconds() != null) {
            configMap.put(MigrataOptions.Execution.STATEMENT_TIMEOUT_KEY,
                    String.valueOf(execution.getStatementTimeoutSeconds()));
        }

        return configMap;
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                MigrataOptions.Paths.MIGRATIONS_DIR_KEY, MigrataOptions.Paths.MIGRATIONS_DIR_DEFAULT,
                MigrataOptions.Paths.HISTORY_DIR_KEY, MigrataOptions.Paths.HISTORY_DIR_DEFAULT,
                MigrataOptions.Execution.STATEMENT_TIMEOUT_KEY,
                String.valueOf(MigrataOptions.Execution.STATEMENT_TIMEOUT_DEFAULT)
        );
    }
}
