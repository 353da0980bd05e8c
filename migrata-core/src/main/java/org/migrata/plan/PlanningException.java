package org.migrata.plan;

import org.migrata.execution.ErrorKind;
import org.migrata.execution.MigrataException;

/**
 * An operation cannot be classified against the projected schema.
 */
public class PlanningException extends MigrataException {

    public PlanningException(String message) {
        super(ErrorKind.PLANNING_FAILED, message);
    }

    protected PlanningException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
