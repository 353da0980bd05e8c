package org.migrata.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class SqlErrorClassifierTest {

    @Test
    void timeouts() {
        assertThat(SqlErrorClassifier.classify(new SQLTimeoutException("timeout")))
                .isEqualTo(ErrorKind.EXECUTION_TIMEOUT);
        assertThat(SqlErrorClassifier.classify(new SQLException("canceling statement", "57014")))
                .isEqualTo(ErrorKind.EXECUTION_TIMEOUT);
    }

    @Test
    @DisplayName("SQLState 23 클래스는 제약조건 위반")
    void constraintViolations() {
        assertThat(SqlErrorClassifier.classify(new SQLException("duplicate key", "23505")))
                .isEqualTo(ErrorKind.CONSTRAINT_VIOLATION);
        assertThat(SqlErrorClassifier.classify(new SQLIntegrityConstraintViolationException("fk")))
                .isEqualTo(ErrorKind.CONSTRAINT_VIOLATION);
    }

    @Test
    void causeChainIsSearched() {
        SQLException wrapped = new SQLException("batch failed", "XX000",
                new SQLException("not null", "23502"));

        assertThat(SqlErrorClassifier.classify(wrapped)).isEqualTo(ErrorKind.CONSTRAINT_VIOLATION);
    }

    @Test
    void everythingElseIsExecutionFailure() {
        assertThat(SqlErrorClassifier.classify(new SQLException("syntax error", "42601")))
                .isEqualTo(ErrorKind.EXECUTION_FAILED);
        assertThat(SqlErrorClassifier.classify(new SQLException("no state")))
                .isEqualTo(ErrorKind.EXECUTION_FAILED);
    }
}
