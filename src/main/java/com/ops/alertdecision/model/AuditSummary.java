package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@Schema(description = "Totals over the audit log")
public class AuditSummary {

    long total;
    long suppressed;
    long forwarded;

    @Schema(description = "Suppressed share of all decisions, in percent", example = "62.5")
    double noiseReductionPct;

    @Schema(description = "Decisions per reason category")
    Map<String, Long> byReason;

    @Schema(description = "Older entries dropped by a bounded audit store and not counted above", example = "0")
    long evicted;
}
