package org.migrata.execution;

import lombok.extern.slf4j.Slf4j;
import org.migrata.migration.spi.Dialect;
import org.migrata.unit.Backfill;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Runs a backfill as one set-based UPDATE in the caller's transaction.
 */
@Slf4j
public class BackfillExecutor {

    private final Dialect dialect;
    private final int statementTimeoutSeconds;

    public BackfillExecutor(Dialect dialect, int statementTimeoutSeconds) {
        this.dialect = dialect;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }

    /**
     * @return number of rows updated; zero once the backfill has converged
     */
    public int execute(Connection connection, Backfill backfill) throws SQLException {
        String sql = dialect.getUpdateSql(backfill.table(), backfill.assignment(), backfill.predicate());
        try (Statement statement = connection.createStatement()) {
            if (statementTimeoutSeconds > 0) {
                statement.setQueryTimeout(statementTimeoutSeconds);
            }
            int rows = statement.executeUpdate(sql);
            log.info("Backfill {} updated {} row(s)", backfill.table(), rows);
            return rows;
        }
    }
}
