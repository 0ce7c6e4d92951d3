package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Descriptive resolution-time statistics. Reported for observability only.
 */
@Value
@Builder
@Schema(description = "Resolution time statistics in minutes")
public class ResolutionStats {

    public static final ResolutionStats EMPTY = ResolutionStats.builder().build();

    double meanMinutes;
    double minMinutes;
    double maxMinutes;
    double stddevMinutes;
}
