package com.ops.alertdecision.notification;

import com.ops.alertdecision.config.MetricsConfig;
import com.ops.alertdecision.config.NotificationConfig;
import com.ops.alertdecision.model.NotificationPayload;
import com.ops.alertdecision.model.NotificationResult;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "notification.channel", havingValue = "twilio")
public class TwilioNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotifier.class);

    private final NotificationConfig.Twilio config;
    private final MetricsConfig metricsConfig;

    public TwilioNotifier(NotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config.getTwilio();
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        Twilio.init(config.getAccountSid(), config.getAuthToken());
        log.info("Twilio notifier initialized. Channel: {}", config.getChannel());
    }

    @Override
    public String getChannel() {
        return "twilio-" + config.getChannel();
    }

    @Override
    public NotificationResult notify(NotificationPayload payload) {
        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(payload)
            ).create();

            metricsConfig.recordNotification(getChannel(), "success");
            log.info("Twilio notification sent for alert={}, sid={}", payload.getAlertId(), message.getSid());
            return NotificationResult.delivered(getChannel(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(getChannel(), "error");
            log.error("Failed to send Twilio notification for alert={}: {}", payload.getAlertId(), e.getMessage(), e);
            return NotificationResult.failed(getChannel(), e.getMessage());
        }
    }

    private String buildMessageBody(NotificationPayload payload) {
        return String.format(
                "[ALERT FORWARDED]\n" +
                "Alert: %s\n" +
                "Reason: %s",
                payload.getAlertId(),
                payload.getReason());
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
