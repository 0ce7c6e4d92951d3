package com.ops.alertdecision.engine;

import com.ops.alertdecision.config.AlertSettings;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.ClassifierPrediction;
import com.ops.alertdecision.model.Decision;
import com.ops.alertdecision.model.DecisionReasons;
import com.ops.alertdecision.model.DuplicateResult;
import com.ops.alertdecision.model.FlappingResult;
import com.ops.alertdecision.model.SelfResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns detector verdicts and the optional classifier prediction into a forward/suppress decision.
 *
 * <p>Rules are applied in a fixed order and the first that matches wins:
 * <ol>
 *   <li>duplicate: suppress, {@code duplicate_alert}, confidence 1.0</li>
 *   <li>flapping: suppress, {@code flapping_alert}, flapping confidence</li>
 *   <li>self-resolving: suppress, {@code self_resolving_alert}, self-resolution confidence</li>
 *   <li>critical alert with critical-always-forward on: forward, {@code critical_alert_always_forward}, 1.0</li>
 *   <li>classifier predicted {@code suppress} with probability at or above the suppression threshold:
 *       suppress, {@code ml_prediction_confidence_<p>}, p</li>
 *   <li>otherwise: forward, {@code default_forward_no_strong_suppress}, 0.5</li>
 * </ol>
 *
 * <p>Note that a duplicate, flapping or self-resolving critical alert is suppressed: the critical
 * override only guards against the classifier. Absent detector results count as negative.
 * Any failure inside the policy yields forward with an {@code error_in_decision_} reason.
 */
@Component
public class DecisionPolicy {

    private static final Logger log = LoggerFactory.getLogger(DecisionPolicy.class);

    static final double DEFAULT_FORWARD_CONFIDENCE = 0.5;

    private final AlertSettings settings;

    public DecisionPolicy(AlertSettings settings) {
        this.settings = settings;
    }

    public Decision decide(Alert alert, DuplicateResult duplicate, FlappingResult flapping,
                           SelfResolutionResult selfResolution, Optional<ClassifierPrediction> prediction) {
        try {
            Decision decision = evaluate(alert, duplicate, flapping, selfResolution, prediction);
            log.debug("Decision for {}: {} ({}, confidence={})", alert.getPatternKey(),
                    decision.getAction(), decision.getReason(), decision.getConfidence());
            return decision;
        } catch (Exception e) {
            log.error("Decision policy failed for alert {}: {}", alert != null ? alert.getAlertId() : null,
                    e.getMessage(), e);
            return Decision.forward(DecisionReasons.error(e), 0.0);
        }
    }

    private Decision evaluate(Alert alert, DuplicateResult duplicate, FlappingResult flapping,
                              SelfResolutionResult selfResolution, Optional<ClassifierPrediction> prediction) {
        if (duplicate != null && duplicate.isDuplicate()) {
            return Decision.suppress(DecisionReasons.DUPLICATE_ALERT, 1.0);
        }
        if (flapping != null && flapping.isFlapping()) {
            return Decision.suppress(DecisionReasons.FLAPPING_ALERT, flapping.getConfidence());
        }
        if (selfResolution != null && selfResolution.isSelfResolving()) {
            return Decision.suppress(DecisionReasons.SELF_RESOLVING_ALERT, selfResolution.getConfidence());
        }
        if (settings.isCriticalAlwaysForward() && alert.getSeverity().isCritical()) {
            return Decision.forward(DecisionReasons.CRITICAL_ALWAYS_FORWARD, 1.0);
        }
        if (prediction != null && prediction.isPresent()) {
            ClassifierPrediction p = prediction.get();
            double probability = p.getPredictedProbability();
            if (p.indicatesSuppression() && probability >= settings.getSuppressionThreshold()) {
                return Decision.suppress(DecisionReasons.mlPrediction(probability), probability);
            }
        }
        return Decision.forward(DecisionReasons.DEFAULT_FORWARD, DEFAULT_FORWARD_CONFIDENCE);
    }
}
