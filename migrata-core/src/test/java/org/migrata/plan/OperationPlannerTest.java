package org.migrata.plan;

import org.migrata.execution.ErrorKind;
import org.migrata.migration.dialect.postgres.PostgresDialect;
import org.migrata.model.ColumnInfo;
import org.migrata.model.IndexInfo;
import org.migrata.model.OnDeleteAction;
import org.migrata.model.SchemaSnapshot;
import org.migrata.model.TableInfo;
import org.migrata.model.TriggerInfo;
import org.migrata.support.SchemaFixtures;
import org.migrata.unit.AlterColumnType;
import org.migrata.unit.Backfill;
import org.migrata.unit.ColumnDef;
import org.migrata.unit.DropForeignKey;
import org.migrata.unit.DynamicTypeColumn;
import org.migrata.unit.EnsureColumn;
import org.migrata.unit.EnsureForeignKey;
import org.migrata.unit.EnsureFunction;
import org.migrata.unit.EnsureIndex;
import org.migrata.unit.EnsureTable;
import org.migrata.unit.EnsureTrigger;
import org.migrata.unit.MigrationUnit;
import org.migrata.unit.OperationSpec;
import org.migrata.unit.SetColumnDefault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationPlannerTest {

    private OperationPlanner planner;
    private SchemaSnapshot live;

    @BeforeEach
    void setUp() {
        planner = new OperationPlanner(new PostgresDialect());
        live = SchemaSnapshot.of(SchemaFixtures.accounts(), SchemaFixtures.sessions());
    }

    private Plan plan(OperationSpec... ops) {
        return planner.plan(new MigrationUnit(1, "test", List.of(ops)), live);
    }

    private static List<Classification> classifications(Plan plan) {
        return plan.getSteps().stream().map(PlannedStep::getClassification).toList();
    }

    @Nested
    @DisplayName("EnsureTable")
    class EnsureTableOp {

        @Test
        @DisplayName("없는 테이블은 생성하고 이후 단계가 볼 수 있도록 투영한다")
        void createsMissingTableAndProjectsIt() {
            // given
            EnsureTable audit = new EnsureTable("audit",
                    List.of(ColumnDef.notNull("id", "bigint"), ColumnDef.of("note", "varchar(200)")),
                    List.of("id"));

            // when
            Plan plan = plan(audit, new EnsureColumn("audit", "note", "varchar(200)", null, null));

            // then
            assertThat(classifications(plan)).containsExactly(Classification.APPLY, Classification.SKIP);
            assertThat(plan.getSteps().get(0).getStatements().get(0)).startsWith("CREATE TABLE \"audit\"");
            assertThat(plan.getProjected().column("audit", "note"))
                    .map(ColumnInfo::dataType).contains("character varying(200)");
        }

        @Test
        @DisplayName("이미 있는 테이블은 건너뛰고 빠진 컬럼만 추가한다")
        void existingTableAddsOnlyMissingColumns() {
            // given
            EnsureTable accounts = new EnsureTable("accounts",
                    List.of(ColumnDef.notNull("id", "text"), ColumnDef.of("kind", "text"), ColumnDef.of("region", "text")),
                    List.of("id"));

            // when
            Plan plan = plan(accounts);

            // then
            assertThat(classifications(plan)).containsExactly(Classification.SKIP, Classification.APPLY);
            PlannedStep derived = plan.getSteps().get(1);
            assertThat(derived.getOrigin()).isEqualTo(StepOrigin.DERIVED);
            assertThat(derived.getStatements()).containsExactly("ALTER TABLE \"accounts\" ADD COLUMN \"region\" text");
        }

        @Test
        void undeclaredPrimaryKeyColumnFails() {
            EnsureTable broken = new EnsureTable("audit", List.of(ColumnDef.of("note", "text")), List.of("id"));

            assertThatThrownBy(() -> plan(broken))
                    .isInstanceOf(PlanningException.class)
                    .hasMessageContaining("primary key column id");
        }
    }

    @Nested
    @DisplayName("EnsureColumn")
    class EnsureColumnOp {

        @Test
        void addsMissingColumnWithDefault() {
            Plan plan = plan(new EnsureColumn("accounts", "verified", "boolean", "false", null));

            assertThat(classifications(plan)).containsExactly(Classification.APPLY);
            assertThat(plan.getSteps().get(0).getStatements())
                    .containsExactly("ALTER TABLE \"accounts\" ADD COLUMN \"verified\" boolean DEFAULT false");
        }

        @Test
        @DisplayName("타입이 다른 기존 컬럼은 변경하지 않고 사유만 남긴다")
        void existingColumnOfOtherTypeIsReportedNotChanged() {
            Plan plan = plan(new EnsureColumn("accounts", "kind", "varchar(10)", null, null));

            assertThat(classifications(plan)).containsExactly(Classification.SKIP);
            assertThat(plan.getSteps().get(0).getRationale()).contains("column exists as text");
        }

        @Test
        void missingTableFails() {
            assertThatThrownBy(() -> plan(new EnsureColumn("nowhere", "x", "text", null, null)))
                    .isInstanceOf(PlanningException.class)
                    .hasMessageContaining("table nowhere does not exist");
        }
    }

    @Nested
    @DisplayName("AlterColumnType")
    class AlterColumnTypeOp {

        @Test
        void identicalTypeIsSkipped() {
            Plan plan = plan(new AlterColumnType("sessions", "id", "int8"));

            assertThat(classifications(plan)).containsExactly(Classification.SKIP);
        }

        @Test
        @DisplayName("무손실 변환은 FK를 건드리지 않고 바로 적용한다")
        void losslessChangeIsApplied() {
            Plan plan = plan(new AlterColumnType("sessions", "id", "numeric", null, "0"));

            assertThat(classifications(plan)).containsExactly(Classification.APPLY);
            assertThat(plan.getSteps().get(0).getStatements()).containsExactly(
                    "ALTER TABLE \"sessions\" ALTER COLUMN \"id\" SET DATA TYPE numeric USING \"id\"::numeric",
                    "ALTER TABLE \"sessions\" ALTER COLUMN \"id\" SET DEFAULT 0");
            assertThat(plan.getProjected().column("sessions", "id")).map(ColumnInfo::dataType).contains("numeric");
        }

        @Test
        @DisplayName("손실 변환은 DESTRUCTIVE이며 FK 재생성은 구조 단계 뒤, 백필 앞에 온다")
        void lossyChangeOrdersStepsAroundTheUnit() {
            // when
            Plan plan = plan(
                    new AlterColumnType("accounts", "id", "uuid"),
                    new Backfill("accounts", "kind IS NULL", "kind = 'basic'"),
                    new EnsureColumn("sessions", "note", "text", null, null));

            // then
            assertThat(plan.getSteps()).extracting(s -> s.getOperation().describe()).containsExactly(
                    "DropForeignKey sessions_account_id_fkey on sessions",
                    "AlterColumnType accounts.id -> uuid",
                    "AlterColumnType sessions.account_id -> uuid",
                    "EnsureColumn sessions.note text",
                    "EnsureForeignKey sessions_account_id_fkey sessions.account_id -> accounts.id ON DELETE CASCADE",
                    "Backfill accounts SET kind = 'basic' WHERE kind IS NULL");
            assertThat(plan.hasDestructive()).isTrue();
            assertThat(plan.destructiveSteps()).hasSize(2);
        }

        @Test
        @DisplayName("같은 유닛에서 명시적으로 삭제한 FK는 재생성하지 않는다")
        void declaredDropCancelsRecreation() {
            Plan plan = plan(
                    new AlterColumnType("accounts", "id", "uuid"),
                    new DropForeignKey("sessions", "sessions_account_id_fkey"));

            assertThat(plan.getSteps()).noneMatch(s -> s.getOperation() instanceof EnsureForeignKey);
            assertThat(plan.getSteps().get(plan.getSteps().size() - 1).getClassification())
                    .isEqualTo(Classification.SKIP);
            assertThat(plan.getProjected().table("sessions").orElseThrow().foreignKeys()).isEmpty();
        }

        @Test
        void missingColumnFails() {
            assertThatThrownBy(() -> plan(new AlterColumnType("accounts", "nope", "uuid")))
                    .isInstanceOf(PlanningException.class)
                    .hasMessageContaining("accounts.nope");
        }
    }

    @Nested
    @DisplayName("Foreign keys and indexes")
    class Constraints {

        @Test
        void existingForeignKeyByNameIsSkipped() {
            Plan plan = plan(new EnsureForeignKey("sessions", "account_id", "accounts", "id",
                    OnDeleteAction.CASCADE, "sessions_account_id_fkey"));

            assertThat(classifications(plan)).containsExactly(Classification.SKIP);
        }

        @Test
        @DisplayName("이름이 달라도 구조가 같은 FK가 있으면 건너뛴다")
        void equivalentForeignKeyIsSkipped() {
            Plan plan = plan(new EnsureForeignKey("sessions", "account_id", "accounts", "id",
                    OnDeleteAction.CASCADE, "fk_other_name"));

            assertThat(classifications(plan)).containsExactly(Classification.SKIP);
            assertThat(plan.getSteps().get(0).getRationale()).contains("sessions_account_id_fkey");
        }

        @Test
        void newForeignKeyGetsGeneratedName() {
            live = live.withTable(SchemaFixtures.accounts().withColumn(ColumnInfo.of("owner_id", "text", true)));

            Plan plan = plan(new EnsureForeignKey("accounts", "owner_id", "accounts", "id", null));

            assertThat(classifications(plan)).containsExactly(Classification.APPLY);
            assertThat(plan.getSteps().get(0).getStatements()).containsExactly(
                    "ALTER TABLE \"accounts\" ADD CONSTRAINT \"accounts_owner_id_fkey\" FOREIGN KEY (\"owner_id\") "
                            + "REFERENCES \"accounts\" (\"id\")");
        }

        @Test
        void foreignKeyTypeMismatchFails() {
            assertThatThrownBy(() -> plan(new EnsureForeignKey("sessions", "id", "accounts", "id", null)))
                    .isInstanceOf(PlanningException.class)
                    .hasMessageContaining("cannot reference type text");
        }

        @Test
        @DisplayName("길이나 정수 폭만 다른 타입끼리는 FK를 허용한다")
        void comparableTypesMayReferenceEachOther() {
            // given
            live = SchemaSnapshot.of(
                    TableInfo.builder("tenants")
                            .column(ColumnInfo.of("code", "character varying(64)", false))
                            .column(ColumnInfo.of("seq", "bigint", false))
                            .primaryKey(List.of("code"))
                            .build(),
                    TableInfo.builder("members")
                            .column(ColumnInfo.of("id", "bigint", false))
                            .column(ColumnInfo.of("tenant_code", "character varying(36)", true))
                            .column(ColumnInfo.of("tenant_seq", "integer", true))
                            .primaryKey(List.of("id"))
                            .build());

            // when
            Plan plan = plan(
                    new EnsureForeignKey("members", "tenant_code", "tenants", "code", null),
                    new EnsureForeignKey("members", "tenant_seq", "tenants", "seq", null));

            // then
            assertThat(classifications(plan)).containsExactly(Classification.APPLY, Classification.APPLY);
        }

        @Test
        void absentForeignKeyDropIsSkipped() {
            Plan plan = plan(new DropForeignKey("sessions", "no_such_fkey"));

            assertThat(classifications(plan)).containsExactly(Classification.SKIP);
        }

        @Test
        void indexes() {
            live = live.withTable(SchemaFixtures.sessions()
                    .withIndex(new IndexInfo("sessions_account_idx", "sessions", List.of("account_id"), false)));

            Plan plan = plan(
                    new EnsureIndex("sessions", "sessions_account_idx", List.of("account_id"), false),
                    new EnsureIndex("accounts", "accounts_kind_idx", List.of("kind"), true));

            assertThat(classifications(plan)).containsExactly(Classification.SKIP, Classification.APPLY);
            assertThat(plan.getSteps().get(1).getStatements())
                    .containsExactly("CREATE UNIQUE INDEX \"accounts_kind_idx\" ON \"accounts\" (\"kind\")");
        }
    }

    @Nested
    @DisplayName("DynamicTypeColumn")
    class DynamicType {

        @Test
        @DisplayName("기증 컬럼의 현재 타입으로 컬럼을 만든다")
        void usesDonorType() {
            live = live.withTable(TableInfo.builder("accounts")
                    .column(ColumnInfo.of("id", "uuid", false)).primaryKey(List.of("id")).build());

            Plan plan = plan(new DynamicTypeColumn("sessions", "owner", "accounts", "id"));

            assertThat(plan.getSteps().get(0).getStatements())
                    .containsExactly("ALTER TABLE \"sessions\" ADD COLUMN \"owner\" uuid");
            assertThat(plan.getProjected().column("sessions", "owner")).map(ColumnInfo::dataType).contains("uuid");
        }

        @Test
        @DisplayName("기증 컬럼이 없으면 기본 타입으로 대체하지 않고 실패한다")
        void missingDonorFails() {
            assertThatThrownBy(() -> plan(new DynamicTypeColumn("sessions", "owner", "accounts", "missing")))
                    .isInstanceOf(TypeDetectionException.class)
                    .hasFieldOrPropertyWithValue("kind", ErrorKind.TYPE_DETECTION_FAILED);
        }

        @Test
        void existingColumnIsSkipped() {
            Plan plan = plan(new DynamicTypeColumn("sessions", "account_id", "accounts", "id"));

            assertThat(classifications(plan)).containsExactly(Classification.SKIP);
            assertThat(plan.getSteps().get(0).getRationale()).isEqualTo("column exists");
        }
    }

    @Nested
    @DisplayName("SetColumnDefault")
    class SetDefault {

        @Test
        @DisplayName("캐스트만 다른 기본값은 같은 값으로 본다")
        void castOnlyDifferenceIsSkipped() {
            live = live.withTable(SchemaFixtures.accounts()
                    .withColumn(new ColumnInfo("kind", "text", true, true, "'basic'::text")));

            Plan plan = plan(new SetColumnDefault("accounts", "kind", "'basic'"));

            assertThat(classifications(plan)).containsExactly(Classification.SKIP);
        }

        @Test
        void differentDefaultIsApplied() {
            Plan plan = plan(new SetColumnDefault("accounts", "kind", "'basic'"));

            assertThat(classifications(plan)).containsExactly(Classification.APPLY);
            assertThat(plan.getProjected().column("accounts", "kind")).map(ColumnInfo::defaultValue).contains("'basic'");
        }

        @Test
        void normalizeDefault() {
            assertThat(OperationPlanner.normalizeDefault("('basic'::character varying)")).isEqualTo("'basic'");
            assertThat(OperationPlanner.normalizeDefault("FALSE")).isEqualTo("false");
            assertThat(OperationPlanner.normalizeDefault("'x'::character varying(10)")).isEqualTo("'x'");
            assertThat(OperationPlanner.normalizeDefault(null)).isNull();
        }
    }

    @Test
    @DisplayName("자신의 투영 스키마에 대해 다시 계획하면 백필 외에는 모두 SKIP이다")
    void planningAgainstOwnProjectionIsAllSkip() {
        // given
        MigrationUnit unit = new MigrationUnit(7, "accounts v2", List.of(
                new EnsureTable("audit", List.of(ColumnDef.notNull("id", "bigint"), ColumnDef.of("account_id", "text")),
                        List.of("id")),
                new EnsureForeignKey("audit", "account_id", "accounts", "id", OnDeleteAction.CASCADE),
                new EnsureColumn("accounts", "verified", "boolean", "false", false),
                new EnsureIndex("audit", "audit_account_idx", List.of("account_id"), false),
                new AlterColumnType("sessions", "id", "numeric"),
                new SetColumnDefault("accounts", "kind", "'basic'"),
                new Backfill("accounts", "kind = 'trusted' AND verified = false", "verified = true")));
        Plan first = planner.plan(unit, live);

        // when
        Plan second = planner.plan(unit, first.getProjected());

        // then
        assertThat(first.executableSteps()).hasSize(7);
        assertThat(second.getSteps())
                .filteredOn(PlannedStep::isExecutable)
                .allMatch(PlannedStep::isBackfill);
        assertThat(second.getProjected()).isEqualTo(first.getProjected());
    }

    @Nested
    @DisplayName("EnsureFunction / EnsureTrigger")
    class RoutineOps {

        private static final String BODY = "begin new.updated_at = now(); return new; end;";

        private final EnsureFunction touch = new EnsureFunction("touch_updated_at", BODY);
        private final EnsureTrigger trigger = new EnsureTrigger("accounts", "trg_touch_accounts", "before",
                List.of("update"), "touch_updated_at");

        @Test
        @DisplayName("없는 함수와 트리거는 생성하고, 같은 유닛 안에서는 생성된 것으로 본다")
        void createsMissingFunctionAndTrigger() {
            // when
            Plan plan = plan(touch, trigger, touch, trigger);

            // then
            assertThat(classifications(plan)).containsExactly(
                    Classification.APPLY, Classification.APPLY, Classification.SKIP, Classification.SKIP);
            assertThat(plan.getSteps().get(0).getStatements()).containsExactly(
                    "CREATE FUNCTION \"touch_updated_at\"() RETURNS trigger AS $$" + BODY + "$$ LANGUAGE plpgsql");
            assertThat(plan.getSteps().get(1).getStatements()).containsExactly(
                    "CREATE TRIGGER \"trg_touch_accounts\" BEFORE UPDATE ON \"accounts\" "
                            + "FOR EACH ROW EXECUTE FUNCTION \"touch_updated_at\"()");
            assertThat(plan.getProjected().hasFunction("touch_updated_at")).isTrue();
            assertThat(plan.getProjected().table("accounts").orElseThrow().hasTrigger("trg_touch_accounts")).isTrue();
        }

        @Test
        @DisplayName("이미 있는 함수와 트리거는 본문을 비교하지 않고 건너뛴다")
        void existingFunctionAndTriggerAreSkipped() {
            // given
            live = live.withFunction("TOUCH_UPDATED_AT")
                    .withTable(SchemaFixtures.accounts().withTrigger(new TriggerInfo("trg_touch_accounts", "accounts")));

            // when
            Plan plan = plan(new EnsureFunction("touch_updated_at", "begin return old; end;"), trigger);

            // then
            assertThat(classifications(plan)).containsExactly(Classification.SKIP, Classification.SKIP);
            assertThat(plan.getSteps()).allMatch(s -> s.getStatements().isEmpty());
        }

        @Test
        void triggerOnMissingTableFails() {
            assertThatThrownBy(() -> plan(new EnsureTrigger("reminders", "trg_x", null, List.of("insert"), "f")))
                    .isInstanceOf(PlanningException.class)
                    .hasMessageContaining("table reminders does not exist");
        }

        @Test
        void bodyWithDollarQuotesGetsATaggedQuote() {
            Plan plan = plan(new EnsureFunction("f", "begin raise notice $$x$$; return new; end;"));

            assertThat(plan.getSteps().get(0).getStatements().get(0))
                    .startsWith("CREATE FUNCTION \"f\"() RETURNS trigger AS $migrata$begin")
                    .endsWith("$migrata$ LANGUAGE plpgsql");
        }
    }
}
