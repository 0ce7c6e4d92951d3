package com.ops.alertdecision.audit;

import com.ops.alertdecision.model.AuditEntry;
import com.ops.alertdecision.model.DecisionAction;

import java.util.List;

/**
 * Append-only record of decisions, partitioned by action. Safe for concurrent appends.
 */
public interface AuditLog {

    void append(AuditEntry entry);

    /**
     * Newest entries first.
     *
     * @param action partition to read; {@code null} reads both
     * @param limit  maximum entries returned
     */
    List<AuditEntry> find(DecisionAction action, int limit);

    /**
     * Every retained entry, in no particular order.
     */
    List<AuditEntry> findAll();

    /**
     * Entries dropped to stay within a retention bound. Totals over {@link #findAll()} exclude them.
     */
    default long evictedCount() {
        return 0L;
    }
}
