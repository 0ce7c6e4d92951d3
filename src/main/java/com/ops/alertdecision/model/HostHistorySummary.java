package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "Recent alert history of one host")
public class HostHistorySummary {

    String host;

    @Schema(example = "7")
    int lookbackDays;

    long totalAlerts;

    @Schema(description = "Distinct UTC days with at least one alert", example = "3")
    long daysWithAlerts;

    @Schema(description = "Share of decided alerts that were suppressed", example = "0.4")
    double suppressionRate;

    Instant lastAlertAt;
}
