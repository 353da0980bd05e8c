package org.migrata.execution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorInfo {
    private ErrorKind kind;
    private String message;
    /** Identity of the step that failed, when the failure belongs to one. */
    private String failingStep;
    private String sqlState;
}
