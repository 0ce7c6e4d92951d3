package com.ops.alertdecision.controller;

import com.ops.alertdecision.exception.InvalidAlertException;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.AlertRequest;
import com.ops.alertdecision.model.HostHistorySummary;
import com.ops.alertdecision.model.WorkflowRecord;
import com.ops.alertdecision.service.AlertHistoryService;
import com.ops.alertdecision.service.AlertProcessingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Submit alerts for a forward/suppress decision and query alert history")
public class AlertController {

    static final int MAX_BATCH_SIZE = 500;

    private final AlertProcessingService processingService;
    private final AlertHistoryService historyService;
    private final Clock clock;

    public AlertController(AlertProcessingService processingService,
                           AlertHistoryService historyService,
                           Clock clock) {
        this.processingService = processingService;
        this.historyService = historyService;
        this.clock = clock;
    }

    @Operation(summary = "Decide on one alert",
            description = "Runs the full pipeline: duplicate check, flapping and self-resolution checks, " +
                    "optional classifier, decision policy, then audit, history and notification. " +
                    "Returns the workflow record with every step and the final decision.")
    @PostMapping("/process")
    public ResponseEntity<WorkflowRecord> process(@RequestBody AlertRequest request) {
        Alert alert = request.toAlert(clock.instant());
        return ResponseEntity.ok(processingService.submit(alert).join());
    }

    @Operation(summary = "Decide on a batch of alerts",
            description = "Validates every alert first; an invalid alert rejects the whole batch. " +
                    "Alerts are processed concurrently and records are returned in input order.")
    @PostMapping("/batch")
    public ResponseEntity<?> processBatch(@RequestBody List<AlertRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Batch is empty", "field", "body"));
        }
        if (requests.size() > MAX_BATCH_SIZE) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Batch exceeds " + MAX_BATCH_SIZE + " alerts", "field", "body"));
        }

        Instant receivedAt = clock.instant();
        List<Alert> alerts = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            try {
                alerts.add(requests.get(i).toAlert(receivedAt));
            } catch (InvalidAlertException e) {
                return ResponseEntity.badRequest().body(Map.of(
                        "error", e.getMessage(),
                        "field", "[" + i + "]." + e.getField()));
            }
        }
        return ResponseEntity.ok(processingService.processBatch(alerts));
    }

    @Operation(summary = "Recent alerts of a host/title pattern",
            description = "Alerts from the last 7 days, newest first, including the decision reason recorded for each.")
    @GetMapping("/history")
    public ResponseEntity<List<Alert>> history(
            @Parameter(description = "Host", example = "web-01") @RequestParam String host,
            @Parameter(description = "Alert title", example = "High CPU") @RequestParam String title,
            @Parameter(description = "Max alerts to return", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(historyService.recentAlerts(host, title, Math.max(1, limit)));
    }

    @Operation(summary = "Alert history summary for a host",
            description = "Totals over the last 7 days: alert count, distinct days with alerts, suppression rate.")
    @GetMapping("/history/host/{host}")
    public ResponseEntity<HostHistorySummary> hostSummary(
            @Parameter(description = "Host", example = "web-01") @PathVariable String host) {
        return ResponseEntity.ok(historyService.hostSummary(host));
    }
}
