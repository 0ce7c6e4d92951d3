package com.ops.alertdecision.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One observed alert after ingestion and severity normalization.
 * Decision fields are only ever set on a copy via {@link #withDecisionReason}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "An operational alert, normalized from its monitoring source")
public class Alert {

    @Schema(description = "Source-assigned identifier; absent for some sources", example = "PD-Q1W2E3")
    String alertId;

    @Schema(description = "Monitoring source", example = "PAGERDUTY")
    AlertSource source;

    @Schema(description = "Host the alert fired on", example = "web-01")
    String host;

    @Schema(description = "Alert title", example = "High CPU")
    String title;

    @Schema(description = "Normalized severity", example = "SEV2")
    Severity severity;

    @Schema(description = "Source status at ingestion", example = "triggered")
    String status;

    @Schema(description = "When the alert was raised", example = "2026-10-19T08:15:00Z")
    Instant createdAt;

    @Schema(description = "When the alert cleared, if it has")
    Instant resolvedAt;

    @Schema(description = "Reason of the decision taken for this alert, once decided", example = "duplicate_alert")
    String decisionReason;

    @JsonIgnore
    public String getPatternKey() {
        return patternKey(host, title);
    }

    public Alert withDecisionReason(String reason) {
        return toBuilder().decisionReason(reason).build();
    }

    /**
     * Key shared by every alert of the same (host, title) pattern.
     */
    public static String patternKey(String host, String title) {
        return host + "|" + title;
    }
}
