package org.migrata.support;

import org.h2.api.Trigger;

import java.sql.Connection;

/**
 * H2 row trigger for {@code accounts(id, kind)}: every updated row gets kind {@code touched}.
 */
public class TouchKindTrigger implements Trigger {

    @Override
    public void fire(Connection conn, Object[] oldRow, Object[] newRow) {
        newRow[1] = "touched";
    }
}
