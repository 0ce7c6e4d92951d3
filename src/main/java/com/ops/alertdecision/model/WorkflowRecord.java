package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Full trail of one alert's trip through the pipeline. Every step appears, including
 * skipped ones, so the record can be inspected after the fact.
 */
@Data
@NoArgsConstructor
@Schema(description = "Audit trail of one alert workflow run")
public class WorkflowRecord {

    @Schema(description = "Alert identifier (may be null for sources without ids)", example = "PD-Q1W2E3")
    private String alertId;

    private Instant startedAt;

    private Instant completedAt;

    @Schema(description = "Last stage reached", example = "ACTION_EXECUTED")
    private WorkflowStage currentStage;

    private List<WorkflowStep> steps = new ArrayList<>();

    private AlertAnalysis analysis;

    private DuplicateResult duplicateCheck;

    private FlappingResult flappingCheck;

    private SelfResolutionResult selfResolutionCheck;

    private ClassificationOutcome classification;

    private Decision decision;

    private ActionResult actionResult;

    @Schema(description = "Names of steps that fell back after a failure", example = "[\"classification\"]")
    private List<String> degradedSteps = new ArrayList<>();

    public static WorkflowRecord start(String alertId, Instant at) {
        WorkflowRecord record = new WorkflowRecord();
        record.alertId = alertId;
        record.startedAt = at;
        record.currentStage = WorkflowStage.RECEIVED;
        record.steps.add(WorkflowStep.builder()
                .stage(WorkflowStage.RECEIVED)
                .status(StepStatus.COMPLETED)
                .at(at)
                .build());
        return record;
    }

    /**
     * Move to the next stage.
     *
     * @throws IllegalStateException if {@code next} does not directly follow the current stage
     */
    public void advance(WorkflowStage next, StepStatus status, String detail, Instant at) {
        if (currentStage == null || !currentStage.successors().contains(next)) {
            throw new IllegalStateException("Illegal workflow transition " + currentStage + " -> " + next);
        }
        steps.add(WorkflowStep.builder().stage(next).status(status).detail(detail).at(at).build());
        currentStage = next;
        if (next.isTerminal()) {
            completedAt = at;
        }
    }

    public void markDegraded(String stepName) {
        if (!degradedSteps.contains(stepName)) {
            degradedSteps.add(stepName);
        }
    }
}
