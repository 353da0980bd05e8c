package org.migrata.execution;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of applying one unit. A backfill that touched no rows counts as skipped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResult {
    private long unitId;
    private String description;
    private int appliedCount;
    private int skippedCount;
    private long rowsAffected;
    private boolean aborted;
    private ErrorInfo error;
    private String executedAt;

    @JsonIgnore
    public boolean isBlocked() {
        return aborted && error != null && error.getKind() == ErrorKind.DESTRUCTIVE_CHANGE_BLOCKED;
    }
}
