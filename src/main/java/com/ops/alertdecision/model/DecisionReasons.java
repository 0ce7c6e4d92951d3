package com.ops.alertdecision.model;

import java.util.Locale;
import java.util.Set;

/**
 * The fixed vocabulary of decision reasons. Only the ML and error reasons carry a suffix.
 */
public final class DecisionReasons {

    public static final String DUPLICATE_ALERT = "duplicate_alert";
    public static final String FLAPPING_ALERT = "flapping_alert";
    public static final String SELF_RESOLVING_ALERT = "self_resolving_alert";
    public static final String CRITICAL_ALWAYS_FORWARD = "critical_alert_always_forward";
    public static final String DEFAULT_FORWARD = "default_forward_no_strong_suppress";
    public static final String ML_PREDICTION_PREFIX = "ml_prediction_confidence_";
    public static final String ERROR_PREFIX = "error_in_decision_";

    private static final Set<String> FIXED = Set.of(
            DUPLICATE_ALERT, FLAPPING_ALERT, SELF_RESOLVING_ALERT, CRITICAL_ALWAYS_FORWARD, DEFAULT_FORWARD);

    private static final Set<String> SUPPRESSING = Set.of(
            DUPLICATE_ALERT, FLAPPING_ALERT, SELF_RESOLVING_ALERT);

    private DecisionReasons() {}

    public static String mlPrediction(double confidence) {
        return ML_PREDICTION_PREFIX + String.format(Locale.ROOT, "%.2f", confidence);
    }

    public static String error(Throwable t) {
        String message = t.getMessage();
        return ERROR_PREFIX + (message != null && !message.isBlank() ? message : t.getClass().getSimpleName());
    }

    public static boolean isKnown(String reason) {
        if (reason == null) return false;
        return FIXED.contains(reason)
                || reason.matches("ml_prediction_confidence_\\d\\.\\d{2}")
                || reason.startsWith(ERROR_PREFIX);
    }

    /**
     * Whether a stored reason records a suppression. Accepts the legacy
     * {@code "suppressed: ..."} reasons found in older history rows.
     */
    public static boolean isSuppression(String reason) {
        if (reason == null) return false;
        return SUPPRESSING.contains(reason)
                || reason.startsWith(ML_PREDICTION_PREFIX)
                || reason.toLowerCase(Locale.ROOT).startsWith("suppressed");
    }

    /**
     * Reason with its numeric or free-form suffix dropped, for use as a low-cardinality metric tag.
     */
    public static String category(String reason) {
        if (reason == null) return "unknown";
        if (reason.startsWith(ML_PREDICTION_PREFIX)) return "ml_prediction";
        if (reason.startsWith(ERROR_PREFIX)) return "error_in_decision";
        return reason;
    }
}
