package com.ops.alertdecision.service;

import com.ops.alertdecision.audit.InMemoryAuditLog;
import com.ops.alertdecision.model.AuditSummary;
import com.ops.alertdecision.model.DecisionAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.ops.alertdecision.testutil.TestDataFactory.NOW;
import static com.ops.alertdecision.testutil.TestDataFactory.createAuditEntry;
import static org.assertj.core.api.Assertions.assertThat;

class AuditServiceTest {

    private InMemoryAuditLog auditLog;
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditLog = new InMemoryAuditLog(100);
        auditService = new AuditService(auditLog);
    }

    @Test
    void summary_countsActionsAndGroupsReasons() {
        auditLog.append(createAuditEntry("1", DecisionAction.SUPPRESS, "duplicate_alert", NOW));
        auditLog.append(createAuditEntry("2", DecisionAction.SUPPRESS, "ml_prediction_confidence_0.91", NOW));
        auditLog.append(createAuditEntry("3", DecisionAction.SUPPRESS, "ml_prediction_confidence_0.85", NOW));
        auditLog.append(createAuditEntry("4", DecisionAction.FORWARD, "default_forward_no_strong_suppress", NOW));

        AuditSummary summary = auditService.summary();

        assertThat(summary.getTotal()).isEqualTo(4);
        assertThat(summary.getSuppressed()).isEqualTo(3);
        assertThat(summary.getForwarded()).isEqualTo(1);
        assertThat(summary.getNoiseReductionPct()).isEqualTo(75.0);
        assertThat(summary.getByReason())
                .containsEntry("duplicate_alert", 1L)
                .containsEntry("ml_prediction", 2L)
                .containsEntry("default_forward_no_strong_suppress", 1L);
    }

    @Test
    void summary_reportsEvictedEntries() {
        auditLog = new InMemoryAuditLog(1);
        auditService = new AuditService(auditLog);
        auditLog.append(createAuditEntry("1", DecisionAction.SUPPRESS, "duplicate_alert", NOW));
        auditLog.append(createAuditEntry("2", DecisionAction.SUPPRESS, "duplicate_alert", NOW.plusSeconds(1)));
        auditLog.append(createAuditEntry("3", DecisionAction.FORWARD, "default_forward_no_strong_suppress", NOW));

        AuditSummary summary = auditService.summary();

        assertThat(summary.getTotal()).isEqualTo(2);
        assertThat(summary.getEvicted()).isEqualTo(1);
    }

    @Test
    void summary_emptyLog_zeroes() {
        AuditSummary summary = auditService.summary();

        assertThat(summary.getTotal()).isZero();
        assertThat(summary.getNoiseReductionPct()).isEqualTo(0.0);
        assertThat(summary.getByReason()).isEmpty();
        assertThat(summary.getEvicted()).isZero();
    }
}
