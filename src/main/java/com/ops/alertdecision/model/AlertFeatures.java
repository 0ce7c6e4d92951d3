package com.ops.alertdecision.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ops.alertdecision.exception.ClassifierException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;

/**
 * Feature vector sent to the suppression classifier. Unset fields are sent as an explicit
 * JSON null, never as an empty string.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
public class AlertFeatures {

    String source;
    String host;
    String severity;
    String status;
    Instant createdAt;
    Instant resolvedAt;

    public static AlertFeatures from(Alert alert) {
        return AlertFeatures.builder()
                .source(alert.getSource() != null ? alert.getSource().name().toLowerCase(Locale.ROOT) : null)
                .host(alert.getHost())
                .severity(alert.getSeverity() != null ? alert.getSeverity().name().toLowerCase(Locale.ROOT) : null)
                .status(alert.getStatus())
                .createdAt(alert.getCreatedAt())
                .resolvedAt(alert.getResolvedAt())
                .build();
    }

    /**
     * Boundary check run before the classifier is called.
     *
     * @throws ClassifierException if a required feature is missing or the timestamps are inconsistent
     */
    public AlertFeatures validate() {
        requirePresent(source, "source");
        requirePresent(host, "host");
        requirePresent(severity, "severity");
        if (createdAt == null) {
            throw new ClassifierException("Feature 'createdAt' is required");
        }
        if (resolvedAt != null && resolvedAt.isBefore(createdAt)) {
            throw new ClassifierException("Feature 'resolvedAt' precedes 'createdAt'");
        }
        return this;
    }

    private static void requirePresent(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new ClassifierException("Feature '" + name + "' is required");
        }
    }
}
