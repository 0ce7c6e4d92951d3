package com.ops.alertdecision.model;

import org.junit.jupiter.api.Test;

import static com.ops.alertdecision.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowRecordTest {

    @Test
    void start_recordsReceivedStep() {
        WorkflowRecord record = WorkflowRecord.start("A-1", NOW);

        assertThat(record.getCurrentStage()).isEqualTo(WorkflowStage.RECEIVED);
        assertThat(record.getSteps()).hasSize(1);
        assertThat(record.getCompletedAt()).isNull();
    }

    @Test
    void advance_fullSkippedPath_completesRecord() {
        WorkflowRecord record = WorkflowRecord.start("A-1", NOW);
        record.advance(WorkflowStage.ANALYZED, StepStatus.COMPLETED, null, NOW);
        record.advance(WorkflowStage.DUPLICATE_CHECKED, StepStatus.COMPLETED, null, NOW);
        record.advance(WorkflowStage.PATTERN_CHECKED, StepStatus.COMPLETED, null, NOW);
        record.advance(WorkflowStage.CLASSIFICATION_SKIPPED, StepStatus.SKIPPED, "duplicate", NOW);
        record.advance(WorkflowStage.DECIDED, StepStatus.COMPLETED, null, NOW);
        record.advance(WorkflowStage.ACTION_EXECUTED, StepStatus.COMPLETED, null, NOW.plusSeconds(1));

        assertThat(record.getSteps()).extracting(WorkflowStep::getStage).containsExactly(
                WorkflowStage.RECEIVED, WorkflowStage.ANALYZED, WorkflowStage.DUPLICATE_CHECKED,
                WorkflowStage.PATTERN_CHECKED, WorkflowStage.CLASSIFICATION_SKIPPED,
                WorkflowStage.DECIDED, WorkflowStage.ACTION_EXECUTED);
        assertThat(record.getCompletedAt()).isEqualTo(NOW.plusSeconds(1));
    }

    @Test
    void advance_skippingAStage_throws() {
        WorkflowRecord record = WorkflowRecord.start("A-1", NOW);

        assertThatThrownBy(() -> record.advance(WorkflowStage.DECIDED, StepStatus.COMPLETED, null, NOW))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void advance_classifiedAfterSkipped_throws() {
        WorkflowRecord record = WorkflowRecord.start("A-1", NOW);
        record.advance(WorkflowStage.ANALYZED, StepStatus.COMPLETED, null, NOW);
        record.advance(WorkflowStage.DUPLICATE_CHECKED, StepStatus.COMPLETED, null, NOW);
        record.advance(WorkflowStage.PATTERN_CHECKED, StepStatus.COMPLETED, null, NOW);
        record.advance(WorkflowStage.CLASSIFICATION_SKIPPED, StepStatus.SKIPPED, null, NOW);

        assertThatThrownBy(() -> record.advance(WorkflowStage.CLASSIFIED, StepStatus.COMPLETED, null, NOW))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void markDegraded_isIdempotent() {
        WorkflowRecord record = WorkflowRecord.start("A-1", NOW);
        record.markDegraded("classification");
        record.markDegraded("classification");

        assertThat(record.getDegradedSteps()).containsExactly("classification");
    }
}
