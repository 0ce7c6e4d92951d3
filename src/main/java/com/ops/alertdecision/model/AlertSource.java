package com.ops.alertdecision.model;

/**
 * Monitoring system an alert was ingested from.
 */
public enum AlertSource {
    PAGERDUTY,
    JIRA,
    ICINGA,
    OTHER;

    public static AlertSource fromString(String raw) {
        if (raw == null || raw.isBlank()) return OTHER;
        return switch (raw.trim().toLowerCase()) {
            case "pagerduty", "pager_duty", "pd" -> PAGERDUTY;
            case "jira" -> JIRA;
            case "icinga", "icinga2" -> ICINGA;
            default -> OTHER;
        };
    }
}
