package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Immutable record of one decision and the alert it was taken on.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Append-only audit record of a forward/suppress decision")
public class AuditEntry {

    @Schema(description = "Unique entry id", example = "3f1c9a0e-4b7a-4c55-9d8e-2a6c5d1e7f00")
    String entryId;

    String alertId;

    Instant recordedAt;

    DecisionAction action;

    String reason;

    double confidence;

    @Schema(description = "The alert as it was when decided")
    Alert alert;

    @Schema(description = "Pipeline steps that fell back after a failure", example = "[\"duplicate_check\"]")
    @Builder.Default
    List<String> degradedSteps = List.of();
}
