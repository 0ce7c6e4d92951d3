package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "What the action executor did with a decision")
public class ActionResult {

    DecisionAction action;

    String reason;

    @Schema(description = "Audit entry written for this decision")
    String auditEntryId;

    @Schema(description = "Notification outcome; absent for suppressed alerts")
    NotificationResult notification;

    @Schema(description = "Whether the decided alert was appended to the historical store", example = "true")
    boolean historyRecorded;
}
