package com.ops.alertdecision.engine;

import com.ops.alertdecision.config.MetricsConfig;
import com.ops.alertdecision.engine.detectors.DuplicateDetector;
import com.ops.alertdecision.engine.detectors.FlappingDetector;
import com.ops.alertdecision.engine.detectors.SelfResolutionDetector;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.DetectionResult;
import com.ops.alertdecision.model.DuplicateResult;
import com.ops.alertdecision.model.PatternCheck;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Runs the history detectors for one alert, each inside its own span.
 * A detector that blows up is reported as a failed, negative result so the pipeline keeps going.
 */
@Component
public class AlertDetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertDetectionEngine.class);

    private final DuplicateDetector duplicateDetector;
    private final FlappingDetector flappingDetector;
    private final SelfResolutionDetector selfResolutionDetector;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public AlertDetectionEngine(DuplicateDetector duplicateDetector,
                                FlappingDetector flappingDetector,
                                SelfResolutionDetector selfResolutionDetector,
                                Tracer tracer, MetricsConfig metricsConfig) {
        this.duplicateDetector = duplicateDetector;
        this.flappingDetector = flappingDetector;
        this.selfResolutionDetector = selfResolutionDetector;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    public DuplicateResult checkDuplicate(Alert alert, Instant now) {
        return run(duplicateDetector, alert, now);
    }

    public PatternCheck checkPatterns(Alert alert, Instant now) {
        return new PatternCheck(
                run(flappingDetector, alert, now),
                run(selfResolutionDetector, alert, now));
    }

    private <R extends DetectionResult> R run(AlertDetector<R> detector, Alert alert, Instant now) {
        Span span = tracer.nextSpan()
                .name("detector." + detector.getName())
                .tag("alert.host", String.valueOf(alert.getHost()))
                .tag("alert.title", String.valueOf(alert.getTitle()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            R result = detector.detect(alert, now);

            span.tag("detector.positive", String.valueOf(result.isPositive()));
            span.tag("detector.status", result.getStatus().name());

            if (result.isDegraded()) {
                metricsConfig.recordDetectorError(detector.getName());
            }
            log.debug("{} for {}: positive={}, confidence={}, {}", detector.getName(), alert.getPatternKey(),
                    result.isPositive(), result.getConfidence(), result.getMessage());
            return result;
        } catch (Exception e) {
            span.error(e);
            log.error("Detector {} failed for {}: {}", detector.getName(), alert.getPatternKey(), e.getMessage(), e);
            metricsConfig.recordDetectorError(detector.getName());
            return detector.failed(e.getMessage());
        } finally {
            span.end();
        }
    }
}
