package org.migrata.plan;

import lombok.extern.slf4j.Slf4j;
import org.migrata.migration.spi.Dialect;
import org.migrata.model.ColumnInfo;
import org.migrata.model.ConstraintInfo;
import org.migrata.model.TableInfo;
import org.migrata.unit.AlterColumnType;
import org.migrata.unit.DropForeignKey;
import org.migrata.unit.EnsureForeignKey;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Computes the foreign-key drop/convert/recreate sequence around a destructive column type change.
 *
 * <p>Every foreign key pointing at the changing column is dropped, and so is every foreign key pointing at
 * a referencing column, transitively: referencing columns take the new type too. Drops run deepest
 * dependent first, then the changing column's own outbound keys. Recreations run in reverse drop order,
 * after all structural steps of the unit.
 *
 * <p>Without an author-supplied conversion expression the affected values are discarded before the type
 * change: nullable non-key columns are set to NULL, otherwise the table's rows are deleted. Rows are
 * never deleted while another table still holds a foreign key into that table.
 */
@Slf4j
public class ForeignKeyLifecycleManager {

    private final Dialect dialect;

    public ForeignKeyLifecycleManager(Dialect dialect) {
        this.dialect = dialect;
    }

    public record Sequence(List<PlannedStep> drops, List<PlannedStep> conversions, List<PlannedStep> recreates) {
    }

    private record AffectedColumn(String table, String column, int level) {
    }

    private record LeveledConstraint(ConstraintInfo constraint, int level) {
    }

    /**
     * Plans the sequence and applies its effects to {@code schema}.
     *
     * @param op      the destructive change, already validated against {@code schema}
     * @param current live state of the changing column
     */
    public Sequence plan(AlterColumnType op, ColumnInfo current, ProjectedSchema schema) {
        List<AffectedColumn> affected = new ArrayList<>();
        List<LeveledConstraint> inbound = new ArrayList<>();
        collectInbound(op, schema, affected, inbound);
        List<ConstraintInfo> outbound = collectOutbound(op, schema, affected, inbound);

        List<ConstraintInfo> dropOrder = new ArrayList<>();
        inbound.stream()
                .sorted(Comparator.comparingInt(LeveledConstraint::level).reversed()
                        .thenComparing(l -> key(l.constraint().table()))
                        .thenComparing(l -> key(l.constraint().name())))
                .forEach(l -> dropOrder.add(l.constraint()));
        outbound.stream()
                .sorted(Comparator.comparing((ConstraintInfo c) -> key(c.table())).thenComparing(c -> key(c.name())))
                .forEach(dropOrder::add);

        List<PlannedStep> drops = new ArrayList<>();
        for (ConstraintInfo fk : dropOrder) {
            drops.add(PlannedStep.builder()
                    .operation(new DropForeignKey(fk.table(), fk.name()))
                    .classification(Classification.APPLY)
                    .rationale("dropped around type change of " + op.table() + "." + op.column())
                    .statement(dialect.getDropConstraintSql(fk.table(), fk.name()))
                    .origin(StepOrigin.DERIVED)
                    .build());
            schema.dropConstraint(fk.table(), fk.name());
        }

        List<PlannedStep> conversions = new ArrayList<>();
        Set<String> emptiedTables = new HashSet<>();
        for (AffectedColumn column : affected) {
            conversions.add(convert(op, column, current, dropOrder.size(), schema, emptiedTables));
        }

        List<PlannedStep> recreates = new ArrayList<>();
        for (int i = dropOrder.size() - 1; i >= 0; i--) {
            ConstraintInfo fk = dropOrder.get(i);
            recreates.add(PlannedStep.builder()
                    .operation(new EnsureForeignKey(fk.table(), fk.columns().get(0), fk.referencedTable(),
                            fk.referencedColumns().get(0), fk.onDelete(), fk.name()))
                    .classification(Classification.APPLY)
                    .rationale("recreated after type change of " + op.table() + "." + op.column())
                    .statement(dialect.getAddForeignKeySql(fk.table(), fk.name(), fk.columns(),
                            fk.referencedTable(), fk.referencedColumns(), fk.onDelete()))
                    .origin(StepOrigin.DERIVED)
                    .build());
            schema.addConstraint(fk.table(), fk);
        }

        log.debug("Lifecycle for {}: {} column(s) converted, {} foreign key(s) dropped and recreated",
                op.describe(), affected.size(), dropOrder.size());
        return new Sequence(drops, conversions, recreates);
    }

    private void collectInbound(AlterColumnType op, ProjectedSchema schema,
                                List<AffectedColumn> affected, List<LeveledConstraint> inbound) {
        Set<String> visited = new HashSet<>();
        Set<String> seenConstraints = new HashSet<>();
        Deque<AffectedColumn> queue = new ArrayDeque<>();
        AffectedColumn root = new AffectedColumn(op.table(), op.column(), 0);
        queue.add(root);
        visited.add(columnKey(root.table(), root.column()));

        while (!queue.isEmpty()) {
            AffectedColumn col = queue.poll();
            affected.add(col);
            for (ConstraintInfo fk : schema.inboundForeignKeys(col.table(), col.column())) {
                requireSingleColumn(fk);
                if (!seenConstraints.add(key(fk.table()) + "." + key(fk.name()))) {
                    continue;
                }
                inbound.add(new LeveledConstraint(fk, col.level() + 1));
                String childColumn = fk.columns().get(0);
                if (visited.add(columnKey(fk.table(), childColumn))) {
                    queue.add(new AffectedColumn(fk.table(), childColumn, col.level() + 1));
                }
            }
        }
    }

    private List<ConstraintInfo> collectOutbound(AlterColumnType op, ProjectedSchema schema,
                                                 List<AffectedColumn> affected, List<LeveledConstraint> inbound) {
        Set<String> affectedKeys = new HashSet<>();
        affected.forEach(a -> affectedKeys.add(columnKey(a.table(), a.column())));
        Set<String> alreadyDropped = new HashSet<>();
        inbound.forEach(l -> alreadyDropped.add(key(l.constraint().table()) + "." + key(l.constraint().name())));

        List<ConstraintInfo> outbound = new ArrayList<>();
        for (AffectedColumn col : affected) {
            TableInfo table = schema.table(col.table()).orElseThrow();
            for (ConstraintInfo fk : table.foreignKeys()) {
                if (!fk.constrains(col.table(), col.column())
                        || alreadyDropped.contains(key(fk.table()) + "." + key(fk.name()))) {
                    continue;
                }
                requireSingleColumn(fk);
                String refColumn = fk.referencedColumns().get(0);
                if (!affectedKeys.contains(columnKey(fk.referencedTable(), refColumn))) {
                    String refType = schema.column(fk.referencedTable(), refColumn)
                            .map(ColumnInfo::dataType)
                            .orElseThrow(() -> new PlanningException("Foreign key " + fk.name()
                                    + " references unknown column " + fk.referencedTable() + "." + refColumn));
                    if (!dialect.comparableTypes(refType, op.newType())) {
                        throw new PlanningException("Cannot change " + col.table() + "." + col.column()
                                + " to " + op.newType() + ": foreign key " + fk.name() + " references "
                                + fk.referencedTable() + "." + refColumn + " of type " + refType);
                    }
                }
                alreadyDropped.add(key(fk.table()) + "." + key(fk.name()));
                outbound.add(fk);
            }
        }
        return outbound;
    }

    private PlannedStep convert(AlterColumnType op, AffectedColumn column, ColumnInfo rootCurrent, int fkCount,
                                ProjectedSchema schema, Set<String> emptiedTables) {
        boolean root = column.level() == 0;
        TableInfo table = schema.table(column.table()).orElseThrow();
        ColumnInfo live = root ? rootCurrent : table.column(column.column()).orElseThrow();
        String quoted = dialect.quoteIdentifier(column.column());
        boolean authorConverts = op.conversionExpr() != null;

        PlannedStep.PlannedStepBuilder step = PlannedStep.builder()
                .classification(Classification.DESTRUCTIVE)
                .origin(root ? StepOrigin.DECLARED : StepOrigin.DERIVED);
        StringBuilder rationale = new StringBuilder();

        if (root) {
            step.operation(op);
            rationale.append("no value-preserving conversion from ").append(live.dataType())
                    .append(" to ").append(op.newType());
            if (fkCount > 0) {
                rationale.append("; ").append(fkCount).append(" foreign key(s) dropped and recreated");
            }
        } else {
            step.operation(new AlterColumnType(column.table(), column.column(), op.newType()));
            rationale.append("references ").append(op.table()).append('.').append(op.column())
                    .append(", follows its type change");
        }

        if (!authorConverts) {
            if (live.nullable() && !table.isPrimaryKeyColumn(column.column())) {
                step.statement(dialect.getClearColumnSql(column.table(), column.column()));
                rationale.append("; values of ").append(column.column()).append(" set to NULL");
            } else if (emptiedTables.add(key(column.table()))) {
                requireNoOtherReferences(column.table(), schema);
                step.statement(dialect.getDeleteAllSql(column.table()));
                rationale.append("; rows of ").append(column.table()).append(" deleted");
            }
        }
        if (live.hasDefault()) {
            step.statement(dialect.getDropDefaultSql(column.table(), column.column()));
            schema.setColumnDefault(column.table(), column.column(), null);
        }

        String expression = root && authorConverts ? op.conversionExpr()
                : dialect.defaultConversionExpression(quoted, live.dataType(), op.newType());
        step.statement(dialect.getAlterColumnTypeSql(column.table(), column.column(), op.newType(), expression));
        schema.changeColumnType(column.table(), column.column(), dialect.normalizeType(op.newType()));

        if (root && op.defaultValue() != null) {
            step.statement(dialect.getSetDefaultSql(column.table(), column.column(), op.defaultValue()));
            schema.setColumnDefault(column.table(), column.column(), op.defaultValue());
        }

        return step.rationale(rationale.toString()).build();
    }

    /**
     * Deleting every row of {@code table} must not reach rows of another table through a foreign key
     * left in place, whichever column of {@code table} it references.
     */
    private static void requireNoOtherReferences(String table, ProjectedSchema schema) {
        for (TableInfo other : schema.snapshot().getTables()) {
            if (key(other.getName()).equals(key(table))) {
                continue;
            }
            for (ConstraintInfo fk : other.foreignKeys()) {
                if (key(fk.referencedTable()).equals(key(table))) {
                    throw new PlanningException("Cannot delete rows of " + table + ": foreign key " + fk.name()
                            + " on " + fk.table() + " references " + table + "." + String.join(", ", fk.referencedColumns())
                            + "; drop it in the unit or supply a conversion expression");
                }
            }
        }
    }

    private static void requireSingleColumn(ConstraintInfo fk) {
        if (fk.columns().size() != 1) {
            throw new PlanningException("Composite foreign key " + fk.name() + " on " + fk.table()
                    + " cannot be rebuilt around a type change");
        }
    }

    private static String columnKey(String table, String column) {
        return key(table) + "." + key(column);
    }

    private static String key(String identifier) {
        return identifier.toLowerCase(Locale.ROOT);
    }
}
