package com.ops.alertdecision.service;

import com.ops.alertdecision.audit.AuditLog;
import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.ActionResult;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.AuditEntry;
import com.ops.alertdecision.model.Decision;
import com.ops.alertdecision.model.DecisionAction;
import com.ops.alertdecision.model.NotificationPayload;
import com.ops.alertdecision.model.NotificationResult;
import com.ops.alertdecision.notification.Notifier;
import com.ops.alertdecision.store.HistoricalAlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Carries out a decision: writes the audit entry, appends the decided alert to history so later
 * alerts see it, and notifies for forwarded alerts. A failing side effect is logged and
 * reported in the {@link ActionResult}; the decision itself is never changed.
 */
@Service
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final AuditLog auditLog;
    private final HistoricalAlertStore historyStore;
    private final Notifier notifier;
    private final Clock clock;

    public ActionExecutor(AuditLog auditLog, HistoricalAlertStore historyStore, Notifier notifier, Clock clock) {
        this.auditLog = auditLog;
        this.historyStore = historyStore;
        this.notifier = notifier;
        this.clock = clock;
    }

    public ActionResult execute(Alert alert, Decision decision, List<String> degradedSteps) {
        Alert decided = alert.withDecisionReason(decision.getReason());

        AuditEntry entry = AuditEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .alertId(alert.getAlertId())
                .recordedAt(clock.instant())
                .action(decision.getAction())
                .reason(decision.getReason())
                .confidence(decision.getConfidence())
                .alert(decided)
                .degradedSteps(List.copyOf(degradedSteps))
                .build();

        String auditEntryId = null;
        try {
            auditLog.append(entry);
            auditEntryId = entry.getEntryId();
        } catch (RuntimeException e) {
            log.error("Failed to write audit entry for alert {}: {}", alert.getAlertId(), e.getMessage(), e);
        }

        boolean historyRecorded = false;
        try {
            historyStore.append(decided);
            historyRecorded = true;
        } catch (StoreException e) {
            log.warn("Failed to record alert {} in history: {}", alert.getAlertId(), e.getMessage());
        }

        NotificationResult notification = null;
        if (decision.getAction() == DecisionAction.FORWARD) {
            try {
                notification = notifier.notify(NotificationPayload.builder()
                        .decision(decision.getAction())
                        .alertId(alert.getAlertId())
                        .reason(decision.getReason())
                        .build());
            } catch (RuntimeException e) {
                log.error("Notifier {} threw for alert {}", notifier.getChannel(), alert.getAlertId(), e);
                notification = NotificationResult.failed(notifier.getChannel(), e.getMessage());
            }
        }

        log.info("Alert {} {} ({}), audit={}, history={}", alert.getAlertId(),
                decision.getAction().getAuditKey(), decision.getReason(), auditEntryId, historyRecorded);

        return ActionResult.builder()
                .action(decision.getAction())
                .reason(decision.getReason())
                .auditEntryId(auditEntryId)
                .notification(notification)
                .historyRecorded(historyRecorded)
                .build();
    }
}
