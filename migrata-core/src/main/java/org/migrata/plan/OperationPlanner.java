package org.migrata.plan;

import lombok.extern.slf4j.Slf4j;
import org.migrata.migration.IdentifierUtil;
import org.migrata.migration.spi.ConversionSafety;
import org.migrata.migration.spi.Dialect;
import org.migrata.model.ColumnInfo;
import org.migrata.model.ConstraintInfo;
import org.migrata.model.IndexInfo;
import org.migrata.model.SchemaSnapshot;
import org.migrata.model.TableInfo;
import org.migrata.model.TriggerInfo;
import org.migrata.unit.AlterColumnType;
import org.migrata.unit.Backfill;
import org.migrata.unit.CheckDef;
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
import org.migrata.unit.OperationVisitor;
import org.migrata.unit.SetColumnDefault;
import org.migrata.unit.UniqueDef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies every operation of a unit against a snapshot. Classification is side-effect free:
 * the planner never touches the database, so a plan can be rendered as a dry run.
 */
@Slf4j
public class OperationPlanner {

    private final Dialect dialect;
    private final ForeignKeyLifecycleManager lifecycleManager;

    public OperationPlanner(Dialect dialect) {
        this(dialect, new ForeignKeyLifecycleManager(dialect));
    }

    public OperationPlanner(Dialect dialect, ForeignKeyLifecycleManager lifecycleManager) {
        this.dialect = dialect;
        this.lifecycleManager = lifecycleManager;
    }

    /**
     * @throws PlanningException      when an operation references objects that neither exist nor are created earlier
     * @throws TypeDetectionException when a dynamic-type column's donor cannot be resolved
     */
    public Plan plan(MigrationUnit unit, SchemaSnapshot snapshot) {
        StepCollector collector = new StepCollector(new ProjectedSchema(snapshot));
        for (OperationSpec op : unit.operations()) {
            op.accept(collector);
        }

        List<PlannedStep> steps = new ArrayList<>(collector.structural);
        steps.addAll(collector.recreates.values());
        steps.addAll(collector.backfills);

        Plan plan = new Plan(unit.id(), unit.description(), steps, collector.schema.snapshot());
        log.debug("Planned unit {}: {} apply, {} destructive, {} skip", unit.id(),
                plan.count(Classification.APPLY), plan.count(Classification.DESTRUCTIVE), plan.count(Classification.SKIP));
        return plan;
    }

    private final class StepCollector implements OperationVisitor<Void> {
        private final ProjectedSchema schema;
        private final List<PlannedStep> structural = new ArrayList<>();
        private final List<PlannedStep> backfills = new ArrayList<>();
        // keyed by "table.constraint" so a later declared drop can cancel a pending recreation
        private final Map<String, PlannedStep> recreates = new LinkedHashMap<>();

        private StepCollector(ProjectedSchema schema) {
            this.schema = schema;
        }

        @Override
        public Void visitEnsureTable(EnsureTable op) {
            var existing = schema.table(op.name());
            if (existing.isPresent()) {
                structural.add(skip(op, "table exists"));
                for (ColumnDef c : op.columns()) {
                    if (!existing.get().hasColumn(c.name())) {
                        structural.add(PlannedStep.builder()
                                .operation(new EnsureColumn(op.name(), c.name(), c.type(), c.defaultValue(), c.nullable()))
                                .classification(Classification.APPLY)
                                .rationale("declared by " + op.describe() + " but missing from the live table")
                                .statement(dialect.getAddColumnSql(op.name(), c))
                                .origin(StepOrigin.DERIVED)
                                .build());
                        schema.addColumn(op.name(), columnInfo(c));
                    }
                }
                return null;
            }

            for (String pk : op.primaryKey()) {
                if (op.columns().stream().noneMatch(c -> c.name().equalsIgnoreCase(pk))) {
                    throw new PlanningException(op.describe() + ": primary key column " + pk + " is not declared");
                }
            }
            TableInfo.Builder table = TableInfo.builder(op.name()).primaryKey(op.primaryKey());
            op.columns().forEach(c -> table.column(columnInfo(c)));
            for (UniqueDef u : op.uniques()) {
                String name = u.name() != null ? u.name()
                        : IdentifierUtil.uniqueName(dialect.identifierPolicy(), op.name(), u.columns());
                table.constraint(ConstraintInfo.unique(name, op.name(), u.columns()));
            }
            int ordinal = 0;
            for (CheckDef ch : op.checks()) {
                ordinal++;
                String name = ch.name() != null ? ch.name()
                        : IdentifierUtil.checkName(dialect.identifierPolicy(), op.name(), ordinal);
                table.constraint(ConstraintInfo.check(name, op.name(), ch.expression()));
            }
            structural.add(apply(op, "table does not exist", dialect.getCreateTableSql(op)));
            schema.putTable(table.build());
            return null;
        }

        @Override
        public Void visitEnsureColumn(EnsureColumn op) {
            TableInfo table = requireTable(op, op.table());
            var existing = table.column(op.column());
            if (existing.isPresent()) {
                structural.add(skipExistingColumn(op, existing.get(), op.type()));
                return null;
            }
            structural.add(apply(op, "column does not exist", dialect.getAddColumnSql(op.table(), op.toColumnDef())));
            schema.addColumn(op.table(), columnInfo(op.toColumnDef()));
            return null;
        }

        @Override
        public Void visitAlterColumnType(AlterColumnType op) {
            TableInfo table = requireTable(op, op.table());
            ColumnInfo current = requireColumn(op, table, op.column());
            ConversionSafety safety = dialect.conversionSafety(current.dataType(), op.newType());

            switch (safety) {
                case IDENTICAL -> structural.add(skip(op, "column already has type " + current.dataType()));
                case LOSSLESS -> {
                    String expr = op.conversionExpr() != null ? op.conversionExpr()
                            : dialect.defaultConversionExpression(
                                    dialect.quoteIdentifier(op.column()), current.dataType(), op.newType());
                    PlannedStep.PlannedStepBuilder step = PlannedStep.builder()
                            .operation(op)
                            .classification(Classification.APPLY)
                            .rationale("lossless conversion from " + current.dataType() + " to " + op.newType())
                            .statement(dialect.getAlterColumnTypeSql(op.table(), op.column(), op.newType(), expr));
                    schema.changeColumnType(op.table(), op.column(), dialect.normalizeType(op.newType()));
                    if (op.defaultValue() != null) {
                        step.statement(dialect.getSetDefaultSql(op.table(), op.column(), op.defaultValue()));
                        schema.setColumnDefault(op.table(), op.column(), op.defaultValue());
                    }
                    structural.add(step.build());
                }
                case LOSSY -> {
                    var sequence = lifecycleManager.plan(op, current, schema);
                    structural.addAll(sequence.drops());
                    structural.addAll(sequence.conversions());
                    for (PlannedStep recreate : sequence.recreates()) {
                        recreates.put(constraintKey(recreate.getOperation().table(),
                                ((EnsureForeignKey) recreate.getOperation()).name()), recreate);
                    }
                }
            }
            return null;
        }

        @Override
        public Void visitEnsureIndex(EnsureIndex op) {
            TableInfo table = requireTable(op, op.table());
            op.columns().forEach(c -> requireColumn(op, table, c));
            var existing = table.index(op.name());
            if (existing.isPresent()) {
                boolean sameShape = lower(existing.get().columns()).equals(lower(op.columns()))
                        && existing.get().unique() == op.unique();
                structural.add(skip(op, sameShape ? "index exists"
                        : "index exists with columns " + existing.get().columns() + "; left unchanged"));
                return null;
            }
            structural.add(apply(op, "index does not exist",
                    dialect.getCreateIndexSql(op.table(), op.name(), op.columns(), op.unique())));
            schema.addIndex(op.table(), new IndexInfo(op.name(), table.getName(), op.columns(), op.unique()));
            return null;
        }

        @Override
        public Void visitEnsureForeignKey(EnsureForeignKey op) {
            TableInfo table = requireTable(op, op.table());
            ColumnInfo column = requireColumn(op, table, op.column());
            TableInfo refTable = requireTable(op, op.refTable());
            ColumnInfo refColumn = requireColumn(op, refTable, op.refColumn());
            if (!dialect.comparableTypes(column.dataType(), refColumn.dataType())) {
                throw new PlanningException(op.describe() + ": column type " + column.dataType()
                        + " cannot reference type " + refColumn.dataType());
            }

            String name = op.name() != null ? op.name()
                    : IdentifierUtil.foreignKeyName(dialect.identifierPolicy(), op.table(), op.column());
            ConstraintInfo wanted = ConstraintInfo.foreignKey(name, op.table(), List.of(op.column()),
                    op.refTable(), List.of(op.refColumn()), op.onDelete());

            if (table.hasConstraint(name)) {
                structural.add(skip(op, "constraint " + name + " exists"));
                return null;
            }
            var equivalent = table.foreignKeys().stream().filter(wanted::isEquivalentTo).findFirst();
            if (equivalent.isPresent()) {
                structural.add(skip(op, "equivalent constraint " + equivalent.get().name() + " exists"));
                return null;
            }
            structural.add(apply(op, "constraint does not exist", dialect.getAddForeignKeySql(op.table(), name,
                    wanted.columns(), op.refTable(), wanted.referencedColumns(), op.onDelete())));
            schema.addConstraint(op.table(), wanted);
            return null;
        }

        @Override
        public Void visitDropForeignKey(DropForeignKey op) {
            if (recreates.remove(constraintKey(op.table(), op.constraintName())) != null) {
                schema.dropConstraint(op.table(), op.constraintName());
                structural.add(skip(op, "already dropped around an earlier type change; not recreated"));
                return null;
            }
            var table = schema.table(op.table());
            if (table.isEmpty() || !table.get().hasConstraint(op.constraintName())) {
                structural.add(skip(op, "constraint does not exist"));
                return null;
            }
            structural.add(apply(op, "constraint exists",
                    dialect.getDropConstraintSql(op.table(), op.constraintName())));
            schema.dropConstraint(op.table(), op.constraintName());
            return null;
        }

        @Override
        public Void visitBackfill(Backfill op) {
            requireTable(op, op.table());
            backfills.add(PlannedStep.builder()
                    .operation(op)
                    .classification(Classification.APPLY)
                    .rationale("set-based update; converges once the predicate no longer matches")
                    .statement(dialect.getUpdateSql(op.table(), op.assignment(), op.predicate()))
                    .build());
            return null;
        }

        @Override
        public Void visitDynamicTypeColumn(DynamicTypeColumn op) {
            ColumnInfo donor = schema.column(op.sourceTable(), op.sourceColumn())
                    .orElseThrow(() -> new TypeDetectionException(op.describe() + ": donor column "
                            + op.sourceTable() + "." + op.sourceColumn() + " does not exist"));
            if (donor.dataType() == null || donor.dataType().isBlank()) {
                throw new TypeDetectionException(op.describe() + ": donor column has no resolvable type");
            }

            TableInfo table = requireTable(op, op.table());
            var existing = table.column(op.column());
            if (existing.isPresent()) {
                structural.add(skipExistingColumn(op, existing.get(), donor.dataType()));
                return null;
            }
            ColumnDef def = ColumnDef.of(op.column(), donor.dataType());
            structural.add(apply(op, "column does not exist; donor type is " + donor.dataType(),
                    dialect.getAddColumnSql(op.table(), def)));
            schema.addColumn(op.table(), columnInfo(def));
            return null;
        }

        @Override
        public Void visitSetColumnDefault(SetColumnDefault op) {
            TableInfo table = requireTable(op, op.table());
            ColumnInfo column = requireColumn(op, table, op.column());
            if (Objects.equals(normalizeDefault(column.defaultValue()), normalizeDefault(op.defaultValue()))) {
                structural.add(skip(op, "default already " + column.defaultValue()));
                return null;
            }
            structural.add(apply(op, column.hasDefault() ? "default is " + column.defaultValue() : "no default",
                    dialect.getSetDefaultSql(op.table(), op.column(), op.defaultValue())));
            schema.setColumnDefault(op.table(), op.column(), op.defaultValue());
            return null;
        }

        @Override
        public Void visitEnsureFunction(EnsureFunction op) {
            if (schema.hasFunction(op.name())) {
                structural.add(skip(op, "function exists"));
                return null;
            }
            structural.add(apply(op, "function does not exist", dialect.getCreateFunctionSql(op)));
            schema.addFunction(op.name());
            return null;
        }

        @Override
        public Void visitEnsureTrigger(EnsureTrigger op) {
            TableInfo table = requireTable(op, op.table());
            if (table.hasTrigger(op.name())) {
                structural.add(skip(op, "trigger exists"));
                return null;
            }
            structural.add(apply(op, "trigger does not exist", dialect.getCreateTriggerSql(op)));
            schema.addTrigger(op.table(), new TriggerInfo(op.name(), table.getName()));
            return null;
        }

        private PlannedStep skipExistingColumn(OperationSpec op, ColumnInfo existing, String declaredType) {
            if (dialect.sameType(existing.dataType(), declaredType)) {
                return skip(op, "column exists");
            }
            return skip(op, "column exists as " + existing.dataType() + " (declared " + declaredType
                    + "); use alterColumnType to change it");
        }

        private TableInfo requireTable(OperationSpec op, String table) {
            return schema.table(table).orElseThrow(() ->
                    new PlanningException(op.describe() + ": table " + table + " does not exist"));
        }

        private ColumnInfo requireColumn(OperationSpec op, TableInfo table, String column) {
            return table.column(column).orElseThrow(() ->
                    new PlanningException(op.describe() + ": column " + table.getName() + "." + column + " does not exist"));
        }

        private ColumnInfo columnInfo(ColumnDef c) {
            return new ColumnInfo(c.name(), dialect.normalizeType(c.type()), c.nullable(),
                    c.defaultValue() != null, c.defaultValue());
        }
    }

    private static PlannedStep skip(OperationSpec op, String rationale) {
        return PlannedStep.builder().operation(op).classification(Classification.SKIP).rationale(rationale).build();
    }

    private static PlannedStep apply(OperationSpec op, String rationale, String statement) {
        return PlannedStep.builder()
                .operation(op)
                .classification(Classification.APPLY)
                .rationale(rationale)
                .statement(statement)
                .build();
    }

    /**
     * Strips casts ({@code 'x'::text}), enclosing parentheses and case, so that live and declared defaults compare.
     */
    static String normalizeDefault(String value) {
        if (value == null) {
            return null;
        }
        String s = value.replaceAll("::[a-zA-Z_ ]+(\\([0-9, ]+\\))?", "").trim();
        while (s.startsWith("(") && s.endsWith(")")) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return s.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String constraintKey(String table, String constraint) {
        return table.toLowerCase(Locale.ROOT) + "." + constraint.toLowerCase(Locale.ROOT);
    }

    private static List<String> lower(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
    }
}
