package org.migrata.introspect;

import org.migrata.execution.ErrorKind;
import org.migrata.execution.MigrataException;

public class IntrospectionException extends MigrataException {

    public IntrospectionException(String message, Throwable cause) {
        super(ErrorKind.INTROSPECTION_FAILED, message, cause);
    }
}
