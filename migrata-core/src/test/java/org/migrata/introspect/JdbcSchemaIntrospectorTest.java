package org.migrata.introspect;

import org.migrata.execution.ErrorKind;
import org.migrata.migration.dialect.h2.H2Dialect;
import org.migrata.model.ColumnInfo;
import org.migrata.model.ConstraintInfo;
import org.migrata.model.ConstraintKind;
import org.migrata.model.OnDeleteAction;
import org.migrata.model.SchemaSnapshot;
import org.migrata.model.TableInfo;
import org.migrata.model.TriggerInfo;
import org.migrata.support.H2Database;
import org.migrata.support.TouchKindTrigger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcSchemaIntrospectorTest {

    private Connection connection;
    private JdbcSchemaIntrospector introspector;

    @BeforeEach
    void setUp() throws SQLException {
        connection = H2Database.open();
        H2Database.execute(connection,
                """
                CREATE TABLE accounts (
                    id varchar(36) NOT NULL PRIMARY KEY,
                    kind varchar(20) DEFAULT 'basic',
                    email varchar(100),
                    CONSTRAINT accounts_email_key UNIQUE (email),
                    CONSTRAINT accounts_kind_check CHECK (kind <> '')
                )""",
                """
                CREATE TABLE sessions (
                    id bigint PRIMARY KEY,
                    account_id varchar(36),
                    CONSTRAINT sessions_account_id_fkey FOREIGN KEY (account_id) REFERENCES accounts (id) ON DELETE CASCADE
                )""",
                """
                CREATE TABLE audit (
                    id bigint PRIMARY KEY,
                    session_id bigint,
                    CONSTRAINT audit_session_id_fkey FOREIGN KEY (session_id) REFERENCES sessions (id)
                )""",
                "CREATE INDEX sessions_account_idx ON sessions (account_id)",
                "CREATE TABLE unrelated (id int)");
        introspector = new JdbcSchemaIntrospector(connection, new H2Dialect(), null);
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (!connection.isClosed()) {
            H2Database.execute(connection, "DROP ALL OBJECTS");
            connection.close();
        }
    }

    @Test
    @DisplayName("요청한 테이블과 그것을 참조하는 테이블을 전이적으로 읽는다")
    void capturesInboundReferenceClosure() {
        // when
        SchemaSnapshot snapshot = introspector.snapshot(Set.of("ACCOUNTS"));

        // then
        assertThat(snapshot.getTables()).extracting(TableInfo::getName)
                .containsExactlyInAnyOrder("accounts", "sessions", "audit");
        assertThat(snapshot.inboundForeignKeys("accounts", "id"))
                .extracting(ConstraintInfo::name)
                .containsExactly("sessions_account_id_fkey");
    }

    @Test
    void readsOutboundReferencedTables() {
        SchemaSnapshot snapshot = introspector.snapshot(Set.of("audit"));

        assertThat(snapshot.hasTable("sessions")).isTrue();
        assertThat(snapshot.hasTable("unrelated")).isFalse();
    }

    @Test
    @DisplayName("컬럼 타입, NULL 허용, 기본값, 기본키를 읽는다")
    void readsColumns() {
        // when
        TableInfo accounts = introspector.snapshot(Set.of("accounts")).table("accounts").orElseThrow();

        // then
        assertThat(accounts.column("id")).contains(ColumnInfo.of("id", "character varying(36)", false));
        ColumnInfo kind = accounts.column("kind").orElseThrow();
        assertThat(kind.nullable()).isTrue();
        assertThat(kind.hasDefault()).isTrue();
        assertThat(kind.defaultValue()).contains("basic");
        assertThat(accounts.getPrimaryKey()).containsExactly("id");
    }

    @Test
    void readsConstraintsAndIndexes() {
        // when
        SchemaSnapshot snapshot = introspector.snapshot(Set.of("accounts"));
        TableInfo accounts = snapshot.table("accounts").orElseThrow();
        TableInfo sessions = snapshot.table("sessions").orElseThrow();

        // then
        ConstraintInfo fk = sessions.constraint("sessions_account_id_fkey").orElseThrow();
        assertThat(fk.columns()).containsExactly("account_id");
        assertThat(fk.referencedTable()).isEqualTo("accounts");
        assertThat(fk.referencedColumns()).containsExactly("id");
        assertThat(fk.onDelete()).isEqualTo(OnDeleteAction.CASCADE);

        assertThat(accounts.constraint("accounts_email_key"))
                .hasValueSatisfying(c -> {
                    assertThat(c.kind()).isEqualTo(ConstraintKind.UNIQUE);
                    assertThat(c.columns()).containsExactly("email");
                });
        assertThat(accounts.constraint("accounts_kind_check"))
                .hasValueSatisfying(c -> assertThat(c.checkClause()).contains("kind"));
        assertThat(sessions.index("sessions_account_idx"))
                .hasValueSatisfying(i -> assertThat(i.columns()).containsExactly("account_id"));
    }

    @Test
    void missingTablesAreAbsent() {
        assertThat(introspector.snapshot(Set.of("ghost")).getTables()).isEmpty();
    }

    @Test
    @DisplayName("카탈로그를 읽을 수 없으면 IntrospectionException")
    void failureIsReportedAsIntrospectionError() throws SQLException {
        // given
        connection.close();

        // when & then
        assertThatThrownBy(() -> introspector.snapshot(Set.of("accounts")))
                .isInstanceOf(IntrospectionException.class)
                .hasFieldOrPropertyWithValue("kind", ErrorKind.INTROSPECTION_FAILED)
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    void explicitSchemaIsHonoured() throws SQLException {
        H2Database.execute(connection,
                "CREATE SCHEMA other",
                "CREATE TABLE other.accounts (id uuid PRIMARY KEY)");

        SchemaSnapshot snapshot = new JdbcSchemaIntrospector(connection, new H2Dialect(), "other")
                .snapshot(Set.of("accounts"));

        assertThat(snapshot.column("accounts", "id")).map(ColumnInfo::dataType).contains("uuid");
        assertThat(snapshot.getTables()).hasSize(1);
        assertThat(List.copyOf(snapshot.getTables()).get(0).getColumns()).hasSize(1);
    }

    @Test
    @DisplayName("테이블의 트리거와 요청한 함수 중 존재하는 것만 읽는다")
    void capturesTriggersAndRequestedFunctions() throws SQLException {
        // given
        H2Database.execute(connection,
                "CREATE TRIGGER trg_touch_accounts BEFORE UPDATE ON accounts FOR EACH ROW CALL '"
                        + TouchKindTrigger.class.getName() + "'",
                "CREATE ALIAS current_millis FOR 'java.lang.System.currentTimeMillis'");

        // when
        SchemaSnapshot snapshot = introspector.snapshot(Set.of("accounts"), Set.of("CURRENT_MILLIS", "absent_fn"));

        // then
        assertThat(snapshot.table("accounts").orElseThrow().getTriggers())
                .extracting(TriggerInfo::name)
                .containsExactly("trg_touch_accounts");
        assertThat(snapshot.table("sessions").orElseThrow().getTriggers()).isEmpty();
        assertThat(snapshot.hasFunction("current_millis")).isTrue();
        assertThat(snapshot.hasFunction("absent_fn")).isFalse();
    }
}
