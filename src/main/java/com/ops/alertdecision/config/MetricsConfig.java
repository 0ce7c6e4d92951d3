package com.ops.alertdecision.config;

import com.ops.alertdecision.model.DecisionReasons;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(String action, String reason, double confidence) {
        Counter.builder("alert.decision.count")
                .tag("action", action)
                .tag("reason", DecisionReasons.category(reason))
                .register(registry)
                .increment();

        DistributionSummary.builder("alert.decision.confidence")
                .tag("action", action)
                .register(registry)
                .record(confidence);
    }

    public void recordDetectorError(String detector) {
        Counter.builder("alert.detector.error.count")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    public void recordClassifier(String outcome) {
        Counter.builder("alert.classifier.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRejected() {
        Counter.builder("alert.rejected.count")
                .register(registry)
                .increment();
    }
}
