package com.ops.alertdecision.notification;

import com.ops.alertdecision.model.NotificationPayload;
import com.ops.alertdecision.model.NotificationResult;

/**
 * Delivers forwarded-alert notifications to a human-facing channel.
 * Implementations report failure through the result and never throw.
 */
public interface Notifier {

    String getChannel();

    NotificationResult notify(NotificationPayload payload);
}
