package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Delivery outcome of a forward notification")
public class NotificationResult {

    @Schema(description = "Whether the notification reached the channel", example = "true")
    boolean delivered;

    @Schema(description = "Delivery was not attempted because the channel is not configured", example = "false")
    boolean skipped;

    @Schema(description = "Channel used", example = "slack")
    String channel;

    @Schema(description = "Delivery detail: status code, message sid or failure cause", example = "HTTP 200")
    String detail;

    public static NotificationResult delivered(String channel, String detail) {
        return new NotificationResult(true, false, channel, detail);
    }

    public static NotificationResult failed(String channel, String detail) {
        return new NotificationResult(false, false, channel, detail);
    }

    public static NotificationResult skipped(String channel, String detail) {
        return new NotificationResult(false, true, channel, detail);
    }

    /**
     * Delivery was attempted and did not succeed.
     */
    public boolean isFailed() {
        return !delivered && !skipped;
    }
}
