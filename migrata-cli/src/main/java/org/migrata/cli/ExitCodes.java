package org.migrata.cli;

/**
 * Process exit codes. 2 stays picocli's usage error.
 */
public final class ExitCodes {

    private ExitCodes() {}

    public static final int OK = 0;
    public static final int ERROR = 1;
    public static final int DESTRUCTIVE_BLOCKED = 3;
}
