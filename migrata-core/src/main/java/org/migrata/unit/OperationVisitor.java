package org.migrata.unit;

public interface OperationVisitor<R> {
    R visitEnsureTable(EnsureTable op);
    R visitEnsureColumn(EnsureColumn op);
    R visitAlterColumnType(AlterColumnType op);
    R visitEnsureIndex(EnsureIndex op);
    R visitEnsureForeignKey(EnsureForeignKey op);
    R visitDropForeignKey(DropForeignKey op);
    R visitBackfill(Backfill op);
    R visitDynamicTypeColumn(DynamicTypeColumn op);
    R visitSetColumnDefault(SetColumnDefault op);
    R visitEnsureFunction(EnsureFunction op);
    R visitEnsureTrigger(EnsureTrigger op);
}
