package org.migrata.execution;

import lombok.Getter;

/**
 * Base class for failures that abort a unit before or during execution.
 */
@Getter
public class MigrataException extends RuntimeException {

    private final ErrorKind kind;

    public MigrataException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MigrataException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
