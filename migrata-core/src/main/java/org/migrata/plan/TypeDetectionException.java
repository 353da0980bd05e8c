package org.migrata.plan;

import org.migrata.execution.ErrorKind;

/**
 * The donor column of a dynamic-type column does not exist at planning time.
 */
public class TypeDetectionException extends PlanningException {

    public TypeDetectionException(String message) {
        super(ErrorKind.TYPE_DETECTION_FAILED, message);
    }
}
