package com.ops.alertdecision.service;

import com.ops.alertdecision.classifier.SuppressionClassifier;
import com.ops.alertdecision.config.MetricsConfig;
import com.ops.alertdecision.engine.AlertDetectionEngine;
import com.ops.alertdecision.engine.DecisionPolicy;
import com.ops.alertdecision.exception.ClassifierException;
import com.ops.alertdecision.model.ActionResult;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.AlertAnalysis;
import com.ops.alertdecision.model.AlertFeatures;
import com.ops.alertdecision.model.ClassificationOutcome;
import com.ops.alertdecision.model.ClassificationStatus;
import com.ops.alertdecision.model.Decision;
import com.ops.alertdecision.model.DecisionReasons;
import com.ops.alertdecision.model.DetectionResult;
import com.ops.alertdecision.model.DuplicateResult;
import com.ops.alertdecision.model.PatternCheck;
import com.ops.alertdecision.model.StepStatus;
import com.ops.alertdecision.model.WorkflowRecord;
import com.ops.alertdecision.model.WorkflowStage;
import com.ops.alertdecision.model.WorkflowStep;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Main orchestrator for a single alert.
 *
 * Flow:
 * 1. Snapshot the normalized alert
 * 2. Duplicate check
 * 3. Flapping and self-resolution checks
 * 4. Classifier call, skipped when a detector already signals suppression or no model is configured
 * 5. Decision policy
 * 6. Action execution (audit, history, notification)
 *
 * Every run ends in ACTION_EXECUTED with a decision. Failed steps fall back and are listed
 * in the record's degraded steps.
 */
@Service
public class AlertWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(AlertWorkflowService.class);

    private final AlertDetectionEngine detectionEngine;
    private final SuppressionClassifier classifier;
    private final DecisionPolicy decisionPolicy;
    private final ActionExecutor actionExecutor;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertWorkflowService(AlertDetectionEngine detectionEngine,
                                SuppressionClassifier classifier,
                                DecisionPolicy decisionPolicy,
                                ActionExecutor actionExecutor,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.detectionEngine = detectionEngine;
        this.classifier = classifier;
        this.decisionPolicy = decisionPolicy;
        this.actionExecutor = actionExecutor;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "alert.process", contextualName = "process-alert")
    public WorkflowRecord process(Alert alert) {
        Instant now = clock.instant();
        WorkflowRecord record = WorkflowRecord.start(alert.getAlertId(), now);

        try {
            record.setAnalysis(AlertAnalysis.of(alert, now));
            record.advance(WorkflowStage.ANALYZED, StepStatus.COMPLETED, null, clock.instant());

            DuplicateResult duplicate = detectionEngine.checkDuplicate(alert, now);
            record.setDuplicateCheck(duplicate);
            record.advance(WorkflowStage.DUPLICATE_CHECKED, stepStatus(duplicate, record, "duplicate_check"),
                    duplicate.getMessage(), clock.instant());

            PatternCheck patterns = detectionEngine.checkPatterns(alert, now);
            record.setFlappingCheck(patterns.getFlapping());
            record.setSelfResolutionCheck(patterns.getSelfResolution());
            StepStatus flappingStatus = stepStatus(patterns.getFlapping(), record, "flapping_check");
            StepStatus selfResolutionStatus = stepStatus(patterns.getSelfResolution(), record, "self_resolution_check");
            record.advance(WorkflowStage.PATTERN_CHECKED,
                    flappingStatus == StepStatus.DEGRADED || selfResolutionStatus == StepStatus.DEGRADED
                            ? StepStatus.DEGRADED : StepStatus.COMPLETED,
                    null, clock.instant());

            ClassificationOutcome classification = classify(alert, duplicate, patterns);
            record.setClassification(classification);
            if (classification.getStatus() == ClassificationStatus.SKIPPED) {
                record.advance(WorkflowStage.CLASSIFICATION_SKIPPED, StepStatus.SKIPPED,
                        classification.getSkipReason(), clock.instant());
            } else if (classification.getStatus() == ClassificationStatus.FAILED) {
                record.markDegraded("classification");
                record.advance(WorkflowStage.CLASSIFIED, StepStatus.DEGRADED, classification.getError(), clock.instant());
            } else {
                record.advance(WorkflowStage.CLASSIFIED, StepStatus.COMPLETED, null, clock.instant());
            }

            Decision decision = decisionPolicy.decide(alert, duplicate, patterns.getFlapping(),
                    patterns.getSelfResolution(), classification.usablePrediction());
            record.setDecision(decision);
            boolean policyFailed = decision.getReason().startsWith(DecisionReasons.ERROR_PREFIX);
            if (policyFailed) {
                record.markDegraded("decision");
            }
            record.advance(WorkflowStage.DECIDED, policyFailed ? StepStatus.DEGRADED : StepStatus.COMPLETED,
                    decision.getReason(), clock.instant());
        } catch (RuntimeException e) {
            log.error("Workflow for alert {} failed before a decision, forwarding: {}",
                    alert.getAlertId(), e.getMessage(), e);
            record.markDegraded("workflow");
            record.setDecision(Decision.forward(DecisionReasons.error(e), 0.0));
        }

        Decision decision = record.getDecision();
        metricsConfig.recordDecision(decision.getAction().getAuditKey(), decision.getReason(), decision.getConfidence());

        ActionResult actionResult = actionExecutor.execute(alert, decision, record.getDegradedSteps());
        record.setActionResult(actionResult);
        List<String> failedActions = failedActions(actionResult);
        failedActions.forEach(record::markDegraded);
        finish(record, failedActions.isEmpty() ? StepStatus.COMPLETED : StepStatus.DEGRADED);

        log.info("Alert {} on {} decided: {} ({}, confidence={})", alert.getAlertId(), alert.getPatternKey(),
                decision.getAction(), decision.getReason(), decision.getConfidence());
        return record;
    }

    private ClassificationOutcome classify(Alert alert, DuplicateResult duplicate, PatternCheck patterns) {
        if (duplicate.isDuplicate()) {
            return ClassificationOutcome.skipped(ClassificationOutcome.SKIP_DUPLICATE);
        }
        if (patterns.isSuppressionSignal()) {
            return ClassificationOutcome.skipped(ClassificationOutcome.SKIP_PATTERN);
        }
        if (!classifier.isAvailable()) {
            metricsConfig.recordClassifier("unavailable");
            return ClassificationOutcome.skipped(ClassificationOutcome.SKIP_UNAVAILABLE);
        }

        try {
            ClassificationOutcome outcome =
                    ClassificationOutcome.predicted(classifier.predict(AlertFeatures.from(alert).validate()));
            metricsConfig.recordClassifier("predicted");
            return outcome;
        } catch (ClassifierException e) {
            log.warn("Classifier failed for alert {}: {}", alert.getAlertId(), e.getMessage());
            metricsConfig.recordClassifier("error");
            return ClassificationOutcome.failed(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected classifier error for alert {}", alert.getAlertId(), e);
            metricsConfig.recordClassifier("error");
            return ClassificationOutcome.failed(e.getMessage());
        }
    }

    private static List<String> failedActions(ActionResult result) {
        List<String> failed = new ArrayList<>();
        if (result.getAuditEntryId() == null) {
            failed.add("audit");
        }
        if (!result.isHistoryRecorded()) {
            failed.add("history");
        }
        if (result.getNotification() != null && result.getNotification().isFailed()) {
            failed.add("notification");
        }
        return failed;
    }

    private static StepStatus stepStatus(DetectionResult result, WorkflowRecord record, String stepName) {
        if (result.isDegraded()) {
            record.markDegraded(stepName);
            return StepStatus.DEGRADED;
        }
        return StepStatus.COMPLETED;
    }

    private void finish(WorkflowRecord record, StepStatus status) {
        if (record.getCurrentStage() == WorkflowStage.DECIDED) {
            record.advance(WorkflowStage.ACTION_EXECUTED, status, null, clock.instant());
        } else {
            // the run broke off early; close it out without replaying the skipped stages
            Instant at = clock.instant();
            record.getSteps().add(WorkflowStep.builder()
                    .stage(WorkflowStage.ACTION_EXECUTED)
                    .status(StepStatus.DEGRADED)
                    .at(at)
                    .build());
            record.setCurrentStage(WorkflowStage.ACTION_EXECUTED);
            record.setCompletedAt(at);
        }
    }
}
