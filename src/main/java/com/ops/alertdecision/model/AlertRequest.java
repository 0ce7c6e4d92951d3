package com.ops.alertdecision.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.ops.alertdecision.exception.InvalidAlertException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Alert as received from a monitoring source, before normalization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An alert submitted for a forward/suppress decision")
public class AlertRequest {

    @Schema(description = "Source-assigned identifier", example = "PD-Q1W2E3")
    @JsonAlias("alert_id")
    private String alertId;

    @Schema(description = "pagerduty, jira, icinga or other", example = "pagerduty")
    private String source;

    @Schema(description = "Host the alert fired on", example = "web-01", requiredMode = Schema.RequiredMode.REQUIRED)
    private String host;

    @Schema(description = "Alert title", example = "High CPU", requiredMode = Schema.RequiredMode.REQUIRED)
    private String title;

    @Schema(description = "Severity in the source's own spelling (Sev1, severity-1, critical, Highest...)",
            example = "sev2", requiredMode = Schema.RequiredMode.REQUIRED)
    private String severity;

    @Schema(description = "Source status", example = "triggered")
    private String status;

    @Schema(description = "When the alert was raised. Defaults to the time of receipt.")
    @JsonAlias("created_at")
    private Instant createdAt;

    @Schema(description = "When the alert cleared, if it has")
    @JsonAlias("resolved_at")
    private Instant resolvedAt;

    /**
     * Validate and normalize into an {@link Alert}.
     *
     * @param receivedAt used as the creation time when the source sent none
     * @throws InvalidAlertException on a missing required field, unknown severity, or resolvedAt before createdAt
     */
    public Alert toAlert(Instant receivedAt) {
        if (host == null || host.isBlank()) {
            throw new InvalidAlertException("host is required", "host");
        }
        if (title == null || title.isBlank()) {
            throw new InvalidAlertException("title is required", "title");
        }
        AlertSource alertSource = AlertSource.fromString(source);
        Severity normalized = Severity.normalize(alertSource, severity);

        Instant created = createdAt != null ? createdAt : receivedAt;
        if (resolvedAt != null && resolvedAt.isBefore(created)) {
            throw new InvalidAlertException("resolvedAt must not precede createdAt", "resolvedAt");
        }

        return Alert.builder()
                .alertId(alertId)
                .source(alertSource)
                .host(host.trim())
                .title(title.trim())
                .severity(normalized)
                .status(status)
                .createdAt(created)
                .resolvedAt(resolvedAt)
                .build();
    }
}
