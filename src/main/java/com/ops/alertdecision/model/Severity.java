package com.ops.alertdecision.model;

import com.ops.alertdecision.exception.InvalidAlertException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Normalized alert severity. Each source spells severities differently; {@link #normalize}
 * folds those spellings onto SEV1 (most severe) to SEV3.
 */
public enum Severity {
    SEV1,
    SEV2,
    SEV3;

    public static final Set<Severity> CRITICAL = EnumSet.of(SEV1);

    public boolean isCritical() {
        return CRITICAL.contains(this);
    }

    /**
     * Map a source-specific severity spelling to a normalized severity.
     *
     * @throws InvalidAlertException if the spelling is not recognised for the source
     */
    public static Severity normalize(AlertSource source, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidAlertException("severity is required", "severity");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);

        Severity sourceSpecific = switch (source == null ? AlertSource.OTHER : source) {
            case PAGERDUTY -> fromPagerDuty(value);
            case ICINGA -> fromIcinga(value);
            case JIRA -> fromJira(value);
            case OTHER -> null;
        };
        if (sourceSpecific != null) {
            return sourceSpecific;
        }

        Severity generic = fromGeneric(value);
        if (generic == null) {
            throw new InvalidAlertException("Unrecognised severity '" + raw + "' for source " + source, "severity");
        }
        return generic;
    }

    private static Severity fromGeneric(String value) {
        // sev1, Sev1, severity-1, severity_1, s1, p1, 1
        String compact = value.replaceAll("[^a-z0-9]", "");
        return switch (compact) {
            case "sev1", "severity1", "s1", "p1", "1", "critical" -> SEV1;
            case "sev2", "severity2", "s2", "p2", "2", "high", "major" -> SEV2;
            case "sev3", "severity3", "s3", "p3", "3", "sev4", "severity4", "p4", "4",
                    "medium", "low", "minor", "info" -> SEV3;
            default -> null;
        };
    }

    private static Severity fromPagerDuty(String value) {
        return switch (value) {
            case "critical" -> SEV1;
            case "error" -> SEV2;
            case "warning", "info" -> SEV3;
            default -> null;
        };
    }

    private static Severity fromIcinga(String value) {
        return switch (value) {
            case "critical", "down" -> SEV1;
            case "warning" -> SEV2;
            case "unknown", "ok", "up" -> SEV3;
            default -> null;
        };
    }

    private static Severity fromJira(String value) {
        return switch (value) {
            case "highest", "blocker" -> SEV1;
            case "high", "major" -> SEV2;
            case "medium", "low", "lowest", "minor", "trivial" -> SEV3;
            default -> null;
        };
    }
}
