package org.migrata.plan;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.migrata.unit.OperationSpec;

import java.util.List;

@Getter
@Builder
public class PlannedStep {

    private final OperationSpec operation;
    private final Classification classification;
    private final String rationale;
    @Singular
    private final List<String> statements;
    @Builder.Default
    private final StepOrigin origin = StepOrigin.DECLARED;

    public boolean isExecutable() {
        return classification != Classification.SKIP;
    }

    public boolean isBackfill() {
        return !operation.structural();
    }

    @Override
    public String toString() {
        return classification + " " + operation.describe() + (origin == StepOrigin.DERIVED ? " (derived)" : "")
                + " - " + rationale;
    }
}
