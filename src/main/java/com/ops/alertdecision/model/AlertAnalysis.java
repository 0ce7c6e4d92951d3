package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of the normalized alert taken when the workflow starts.
 */
@Value
@Builder
@Schema(description = "Initial analysis of an incoming alert")
public class AlertAnalysis {

    String alertId;
    AlertSource source;
    String host;
    String title;
    Severity severity;

    @Schema(description = "Source status, 'unknown' when the source sent none", example = "triggered")
    String status;

    @Schema(description = "Whether the severity is in the critical set", example = "false")
    boolean critical;

    @Schema(description = "Whether the alert had already cleared when ingested", example = "false")
    boolean resolved;

    Instant createdAt;
    Instant analyzedAt;

    public static AlertAnalysis of(Alert alert, Instant analyzedAt) {
        return AlertAnalysis.builder()
                .alertId(alert.getAlertId())
                .source(alert.getSource())
                .host(alert.getHost())
                .title(alert.getTitle())
                .severity(alert.getSeverity())
                .status(alert.getStatus() != null ? alert.getStatus() : "unknown")
                .critical(alert.getSeverity() != null && alert.getSeverity().isCritical())
                .resolved(alert.getResolvedAt() != null)
                .createdAt(alert.getCreatedAt())
                .analyzedAt(analyzedAt)
                .build();
    }
}
