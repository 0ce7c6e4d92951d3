package com.ops.alertdecision.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the per-alert pipeline. Transitions are strictly forward; classification is
 * either performed or skipped, never both.
 */
public enum WorkflowStage {
    RECEIVED,
    ANALYZED,
    DUPLICATE_CHECKED,
    PATTERN_CHECKED,
    CLASSIFIED,
    CLASSIFICATION_SKIPPED,
    DECIDED,
    ACTION_EXECUTED;

    public Set<WorkflowStage> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(ANALYZED);
            case ANALYZED -> EnumSet.of(DUPLICATE_CHECKED);
            case DUPLICATE_CHECKED -> EnumSet.of(PATTERN_CHECKED);
            case PATTERN_CHECKED -> EnumSet.of(CLASSIFIED, CLASSIFICATION_SKIPPED);
            case CLASSIFIED, CLASSIFICATION_SKIPPED -> EnumSet.of(DECIDED);
            case DECIDED -> EnumSet.of(ACTION_EXECUTED);
            case ACTION_EXECUTED -> EnumSet.noneOf(WorkflowStage.class);
        };
    }

    public boolean isTerminal() {
        return this == ACTION_EXECUTED;
    }
}
