package com.ops.alertdecision.model;

import lombok.Builder;
import lombok.Value;

/**
 * What the notifier receives for a forwarded alert.
 */
@Value
@Builder
public class NotificationPayload {
    DecisionAction decision;
    String alertId;
    String reason;

    public String toText() {
        return decision + " | " + alertId + " | " + reason;
    }
}
