package com.ops.alertdecision.controller;

import com.ops.alertdecision.model.AuditEntry;
import com.ops.alertdecision.model.AuditSummary;
import com.ops.alertdecision.model.DecisionAction;
import com.ops.alertdecision.service.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit", description = "Inspect recorded forward/suppress decisions")
public class AuditController {

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @Operation(summary = "List recent decisions",
            description = "Newest first. Filter by action with 'suppressed' or 'forwarded'.")
    @GetMapping
    public ResponseEntity<?> list(
            @Parameter(description = "suppressed or forwarded", example = "suppressed")
            @RequestParam(required = false) String action,
            @Parameter(description = "Max entries to return", example = "100")
            @RequestParam(defaultValue = "100") int limit) {
        DecisionAction filter = null;
        if (action != null && !action.isBlank()) {
            try {
                filter = DecisionAction.fromAuditKey(action);
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "action"));
            }
        }
        if (limit <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be > 0", "field", "limit"));
        }
        List<AuditEntry> entries = auditService.recent(filter, limit);
        return ResponseEntity.ok(entries);
    }

    @Operation(summary = "Decision totals",
            description = "Counts of suppressed and forwarded alerts, noise reduction percentage and counts per reason.")
    @GetMapping("/summary")
    public ResponseEntity<AuditSummary> summary() {
        return ResponseEntity.ok(auditService.summary());
    }
}
