package org.migrata.options;

/**
 * Defines configuration option constants used throughout migrata.
 * The CLI and the configuration loader share the same keys.
 */
public final class MigrataOptions {

    private MigrataOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "MIGRATA_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "migrata.yaml";
    }

    /**
     * Database connection settings.
     */
    public static final class Database {
        private Database() {}

        public static final String URL_KEY = "migrata.database.url";
        public static final String USERNAME_KEY = "migrata.database.username";
        public static final String PASSWORD_KEY = "migrata.database.password";
        public static final String SCHEMA_KEY = "migrata.database.schema";

        /**
         * Explicit dialect name (postgresql, h2). Auto-detected from the connection when absent.
         */
        public static final String DIALECT_KEY = "migrata.database.dialect";
    }

    /**
     * Execution settings.
     */
    public static final class Execution {
        private Execution() {}

        /**
         * Per-statement timeout in seconds. 0 means the driver default (no timeout).
         */
        public static final String STATEMENT_TIMEOUT_KEY = "migrata.execution.statementTimeoutSeconds";
        public static final int STATEMENT_TIMEOUT_DEFAULT = 0;
    }

    /**
     * File locations.
     */
    public static final class Paths {
        private Paths() {}

        public static final String MIGRATIONS_DIR_KEY = "migrata.migrations.directory";
        public static final String MIGRATIONS_DIR_DEFAULT = "migrations";

        public static final String HISTORY_DIR_KEY = "migrata.history.directory";
        public static final String HISTORY_DIR_DEFAULT = ".migrata/history";
    }
}
