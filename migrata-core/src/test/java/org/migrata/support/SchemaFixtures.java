package org.migrata.support;

import org.migrata.model.ColumnInfo;
import org.migrata.model.ConstraintInfo;
import org.migrata.model.OnDeleteAction;
import org.migrata.model.TableInfo;

import java.util.List;

/**
 * Accounts schema in PostgreSQL spelling: {@code sessions} and {@code grants} reference {@code accounts.id},
 * {@code grant_notes} references {@code grants.account_id}.
 */
public final class SchemaFixtures {

    private SchemaFixtures() {}

    public static TableInfo accounts() {
        return TableInfo.builder("accounts")
                .column(ColumnInfo.of("id", "text", false))
                .column(ColumnInfo.of("kind", "text", true))
                .primaryKey(List.of("id"))
                .build();
    }

    public static TableInfo sessions() {
        return TableInfo.builder("sessions")
                .column(ColumnInfo.of("id", "bigint", false))
                .column(ColumnInfo.of("account_id", "text", true))
                .primaryKey(List.of("id"))
                .constraint(ConstraintInfo.foreignKey("sessions_account_id_fkey", "sessions", List.of("account_id"),
                        "accounts", List.of("id"), OnDeleteAction.CASCADE))
                .build();
    }

    public static TableInfo grants() {
        return TableInfo.builder("grants")
                .column(ColumnInfo.of("id", "bigint", false))
                .column(new ColumnInfo("account_id", "text", false, true, "''::text"))
                .primaryKey(List.of("id"))
                .constraint(ConstraintInfo.foreignKey("grants_account_id_fkey", "grants", List.of("account_id"),
                        "accounts", List.of("id"), OnDeleteAction.NO_ACTION))
                .build();
    }

    public static TableInfo grantNotes() {
        return TableInfo.builder("grant_notes")
                .column(ColumnInfo.of("id", "bigint", false))
                .column(ColumnInfo.of("grant_account", "text", true))
                .primaryKey(List.of("id"))
                .constraint(ConstraintInfo.foreignKey("grant_notes_grant_account_fkey", "grant_notes",
                        List.of("grant_account"), "grants", List.of("account_id"), OnDeleteAction.SET_NULL))
                .build();
    }
}
