package org.migrata.execution;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTimeoutException;

/**
 * Maps a statement failure onto an {@link ErrorKind}.
 */
public final class SqlErrorClassifier {

    // query_canceled, used by PostgreSQL and H2 for statement timeouts
    static final String QUERY_CANCELED = "57014";
    // integrity constraint violation class
    static final String INTEGRITY_CLASS = "23";

    private SqlErrorClassifier() {}

    public static ErrorKind classify(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLTimeoutException) {
                return ErrorKind.EXECUTION_TIMEOUT;
            }
            if (t instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (QUERY_CANCELED.equals(state)) {
                    return ErrorKind.EXECUTION_TIMEOUT;
                }
                if (sql instanceof SQLIntegrityConstraintViolationException
                        || (state != null && state.startsWith(INTEGRITY_CLASS))) {
                    return ErrorKind.CONSTRAINT_VIOLATION;
                }
            }
        }
        return ErrorKind.EXECUTION_FAILED;
    }
}
