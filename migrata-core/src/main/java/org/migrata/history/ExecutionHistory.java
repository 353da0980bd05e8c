package org.migrata.history;

import org.migrata.execution.ExecutionResult;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Informational record of the last result per unit. Planning never reads it.
 */
public interface ExecutionHistory {

    void record(ExecutionResult result) throws IOException;

    Optional<ExecutionResult> find(long unitId) throws IOException;

    List<ExecutionResult> findAll() throws IOException;

    static ExecutionHistory none() {
        return new ExecutionHistory() {
            @Override
            public void record(ExecutionResult result) {
            }

            @Override
            public Optional<ExecutionResult> find(long unitId) {
                return Optional.empty();
            }

            @Override
            public List<ExecutionResult> findAll() {
                return List.of();
            }
        };
    }
}
