package org.migrata.execution;

import org.migrata.history.ExecutionHistory;
import org.migrata.model.SchemaSnapshot;
import org.migrata.plan.Plan;
import org.migrata.plan.PlanningException;
import org.migrata.support.SchemaFixtures;
import org.migrata.unit.Backfill;
import org.migrata.unit.MigrationUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MigrationRunnerTest {

    @Mock
    private ExecutionEngine engine;
    @Mock
    private ExecutionHistory history;

    private static MigrationUnit unit(long id) {
        return new MigrationUnit(id, "unit " + id, List.of(new Backfill("accounts", "kind IS NULL", "kind = 'basic'")));
    }

    private static ExecutionResult ok(long id) {
        return ExecutionResult.builder().unitId(id).appliedCount(1).build();
    }

    @Test
    @DisplayName("유닛 id는 엄격히 증가해야 한다")
    void rejectsNonIncreasingIds() {
        List<MigrationUnit> units = List.of(unit(1), unit(3), unit(3));

        assertThatThrownBy(() -> new MigrationRunner(engine, history).apply(units, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unit ids must be strictly increasing: 3 is followed by 3");
        verifyNoInteractions(engine, history);
    }

    @Test
    void appliesEveryUnitAndRecordsHistory() throws IOException {
        // given
        when(engine.apply(any(), eq(false))).thenAnswer(inv -> ok(inv.<MigrationUnit>getArgument(0).id()));

        // when
        List<ExecutionResult> results = new MigrationRunner(engine, history).apply(List.of(unit(1), unit(2)), false);

        // then
        assertThat(results).extracting(ExecutionResult::getUnitId).containsExactly(1L, 2L);
        verify(history, times(2)).record(any());
    }

    @Test
    @DisplayName("중단된 유닛 이후의 유닛은 시도하지 않는다")
    void stopsAtFirstAbortedUnit() {
        // given
        MigrationUnit second = unit(2);
        when(engine.apply(any(), anyBoolean())).thenReturn(ok(1));
        when(engine.apply(second, true)).thenReturn(ExecutionResult.builder()
                .unitId(2)
                .aborted(true)
                .error(ErrorInfo.builder().kind(ErrorKind.CONSTRAINT_VIOLATION).build())
                .build());

        // when
        List<ExecutionResult> results = new MigrationRunner(engine).apply(List.of(unit(1), second, unit(3)), true);

        // then
        assertThat(results).hasSize(2);
        assertThat(results.get(1).isAborted()).isTrue();
        verify(engine, times(2)).apply(any(), eq(true));
    }

    @Test
    @DisplayName("이력 기록 실패는 실행을 멈추지 않는다")
    void historyFailureIsNotFatal() throws IOException {
        when(engine.apply(any(), anyBoolean())).thenAnswer(inv -> ok(inv.<MigrationUnit>getArgument(0).id()));
        doThrow(new IOException("disk full")).when(history).record(any());

        List<ExecutionResult> results = new MigrationRunner(engine, history).apply(List.of(unit(1), unit(2)), false);

        assertThat(results).hasSize(2);
    }

    @Test
    @DisplayName("드라이런은 앞선 유닛의 투영 스키마를 다음 유닛에 넘긴다")
    void planChainsProjections() {
        // given
        MigrationUnit first = unit(1);
        MigrationUnit second = unit(2);
        SchemaSnapshot projected = SchemaSnapshot.of(SchemaFixtures.accounts());
        when(engine.plan(first, SchemaSnapshot.empty()))
                .thenReturn(new Plan(1, "", List.of(), projected));
        when(engine.plan(second, projected))
                .thenReturn(new Plan(2, "", List.of(), projected));

        // when
        List<Plan> plans = new MigrationRunner(engine).plan(List.of(first, second));

        // then
        assertThat(plans).extracting(Plan::getUnitId).containsExactly(1L, 2L);
        verify(engine).plan(second, projected);
    }

    @Test
    void planFailureNamesTheUnit() {
        when(engine.plan(any(), any())).thenThrow(new PlanningException("Composite foreign key fk on t"));

        assertThatThrownBy(() -> new MigrationRunner(engine).plan(List.of(unit(5))))
                .isInstanceOf(MigrataException.class)
                .hasMessage("Unit 5: Composite foreign key fk on t")
                .hasFieldOrPropertyWithValue("kind", ErrorKind.PLANNING_FAILED);
    }
}
