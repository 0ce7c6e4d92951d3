package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "One recorded transition of the alert workflow")
public class WorkflowStep {

    @Schema(description = "Stage reached", example = "DUPLICATE_CHECKED")
    WorkflowStage stage;

    @Schema(description = "How the stage completed", example = "COMPLETED")
    StepStatus status;

    @Schema(description = "When the stage was reached")
    Instant at;

    @Schema(description = "Short note: skip reason, degradation cause, or outcome", example = "duplicate_alert")
    String detail;
}
