package com.ops.alertdecision.notification;

import com.ops.alertdecision.config.MetricsConfig;
import com.ops.alertdecision.config.NotificationConfig;
import com.ops.alertdecision.model.NotificationPayload;
import com.ops.alertdecision.model.NotificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts a one-line message to a Slack incoming webhook.
 */
@Component
@ConditionalOnProperty(name = "notification.channel", havingValue = "slack", matchIfMissing = true)
public class SlackWebhookNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookNotifier.class);

    static final String CHANNEL = "slack";

    private final NotificationConfig.Slack config;
    private final MetricsConfig metricsConfig;
    private final RestTemplate restTemplate;

    @Autowired
    public SlackWebhookNotifier(NotificationConfig config, MetricsConfig metricsConfig) {
        this(config, metricsConfig, timedRestTemplate(config.getSlack().getTimeoutMs()));
    }

    SlackWebhookNotifier(NotificationConfig config, MetricsConfig metricsConfig, RestTemplate restTemplate) {
        this.config = config.getSlack();
        this.metricsConfig = metricsConfig;
        this.restTemplate = restTemplate;
    }

    @Override
    public String getChannel() {
        return CHANNEL;
    }

    @Override
    public NotificationResult notify(NotificationPayload payload) {
        String webhookUrl = config.getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.debug("Slack webhook not configured, skipping notification for alert {}", payload.getAlertId());
            metricsConfig.recordNotification(CHANNEL, "skipped");
            return NotificationResult.skipped(CHANNEL, "skipped: no webhook configured");
        }

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(webhookUrl, Map.of("text", payload.toText()), String.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                metricsConfig.recordNotification(CHANNEL, "success");
                log.info("Slack notification sent for alert {}", payload.getAlertId());
                return NotificationResult.delivered(CHANNEL, "HTTP " + response.getStatusCode().value());
            }
            metricsConfig.recordNotification(CHANNEL, "error");
            log.warn("Slack webhook answered {} for alert {}", response.getStatusCode(), payload.getAlertId());
            return NotificationResult.failed(CHANNEL, "HTTP " + response.getStatusCode().value());
        } catch (RestClientException e) {
            metricsConfig.recordNotification(CHANNEL, "error");
            log.warn("Slack notification failed for alert {}: {}", payload.getAlertId(), e.getMessage());
            return NotificationResult.failed(CHANNEL, e.getMessage());
        } catch (Exception e) {
            metricsConfig.recordNotification(CHANNEL, "error");
            log.error("Unexpected error sending Slack notification for alert {}", payload.getAlertId(), e);
            return NotificationResult.failed(CHANNEL, e.getMessage());
        }
    }

    private static RestTemplate timedRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }
}
