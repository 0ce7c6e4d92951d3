package com.ops.alertdecision.service;

import com.ops.alertdecision.audit.AuditLog;
import com.ops.alertdecision.model.AuditEntry;
import com.ops.alertdecision.model.AuditSummary;
import com.ops.alertdecision.model.DecisionAction;
import com.ops.alertdecision.model.DecisionReasons;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Service
public class AuditService {

    private final AuditLog auditLog;

    public AuditService(AuditLog auditLog) {
        this.auditLog = auditLog;
    }

    public List<AuditEntry> recent(DecisionAction action, int limit) {
        return auditLog.find(action, limit);
    }

    public AuditSummary summary() {
        List<AuditEntry> entries = auditLog.findAll();
        long suppressed = entries.stream().filter(e -> e.getAction() == DecisionAction.SUPPRESS).count();
        long total = entries.size();

        Map<String, Long> byReason = entries.stream()
                .collect(Collectors.groupingBy(e -> DecisionReasons.category(e.getReason()),
                        TreeMap::new, Collectors.counting()));

        return AuditSummary.builder()
                .total(total)
                .suppressed(suppressed)
                .forwarded(total - suppressed)
                .noiseReductionPct(total > 0 ? Math.round(suppressed * 1000.0 / total) / 10.0 : 0.0)
                .byReason(byReason)
                .evicted(auditLog.evictedCount())
                .build();
    }
}
