package com.ops.alertdecision.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "notification")
public class NotificationConfig {

    private String channel = "slack";  // "slack" or "twilio"

    private Slack slack = new Slack();

    private Twilio twilio = new Twilio();

    @Data
    public static class Slack {
        private String webhookUrl;
        private int timeoutMs = 5000;
    }

    @Data
    public static class Twilio {
        private String accountSid;
        private String authToken;
        private String fromNumber;
        private String toNumber;
        private String channel = "sms";  // "sms" or "whatsapp"
    }
}
