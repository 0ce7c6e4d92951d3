package com.ops.alertdecision.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DecisionAction {
    FORWARD("forwarded"),
    SUPPRESS("suppressed");

    /** Audit log partition this action is recorded under. */
    private final String auditKey;

    public static DecisionAction fromAuditKey(String key) {
        for (DecisionAction action : values()) {
            if (action.auditKey.equalsIgnoreCase(key) || action.name().equalsIgnoreCase(key)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + key);
    }
}
