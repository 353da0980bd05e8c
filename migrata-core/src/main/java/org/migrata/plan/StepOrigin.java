package org.migrata.plan;

public enum StepOrigin {
    /** Written by the unit author. */
    DECLARED,
    /** Added by the planner, e.g. a foreign key dropped around a type change. */
    DERIVED
}
