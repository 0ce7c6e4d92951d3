package com.ops.alertdecision.controller;

import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.*;
import com.ops.alertdecision.service.AlertHistoryService;
import com.ops.alertdecision.service.AlertProcessingService;
import com.ops.alertdecision.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.ops.alertdecision.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AlertController.class)
class AlertControllerTest {

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AlertProcessingService processingService;

    @MockBean
    private AlertHistoryService historyService;

    private static WorkflowRecord decided(String alertId, Decision decision) {
        WorkflowRecord record = WorkflowRecord.start(alertId, NOW);
        record.setDecision(decision);
        return record;
    }

    @Test
    void process_success_returnsWorkflowRecord() throws Exception {
        when(processingService.submit(any(Alert.class))).thenReturn(CompletableFuture.completedFuture(
                decided("PD-1", Decision.forward(DecisionReasons.DEFAULT_FORWARD, 0.5))));

        mockMvc.perform(post("/api/v1/alerts/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"alert_id": "PD-1", "source": "pagerduty", "host": "web-01",
                                 "title": "High CPU", "severity": "error", "status": "triggered"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alertId").value("PD-1"))
                .andExpect(jsonPath("$.decision.action").value("FORWARD"))
                .andExpect(jsonPath("$.decision.reason").value("default_forward_no_strong_suppress"));

        ArgumentCaptor<Alert> alert = ArgumentCaptor.forClass(Alert.class);
        verify(processingService).submit(alert.capture());
        assertThat(alert.getValue().getSeverity()).isEqualTo(Severity.SEV2);
        assertThat(alert.getValue().getSource()).isEqualTo(AlertSource.PAGERDUTY);
        assertThat(alert.getValue().getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void process_missingHost_returns400WithField() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"High CPU\", \"severity\": \"sev2\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("host"));

        verifyNoInteractions(processingService);
    }

    @Test
    void process_unknownSeverity_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host\": \"web-01\", \"title\": \"High CPU\", \"severity\": \"catastrophic\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("severity"));
    }

    @Test
    void process_resolvedBeforeCreated_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"host": "web-01", "title": "High CPU", "severity": "sev2",
                                 "created_at": "2026-10-19T10:00:00Z", "resolved_at": "2026-10-19T09:00:00Z"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("resolvedAt"));
    }

    @Test
    void process_workersBusy_returns503() throws Exception {
        when(processingService.submit(any(Alert.class))).thenThrow(new TaskRejectedException("queue full"));

        mockMvc.perform(post("/api/v1/alerts/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host\": \"web-01\", \"title\": \"High CPU\", \"severity\": \"sev2\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("WORKERS_BUSY"));
    }

    @Test
    void process_pipelineStoreFailure_unwrappedTo503() throws Exception {
        when(processingService.submit(any(Alert.class)))
                .thenReturn(CompletableFuture.failedFuture(new StoreException("history unavailable")));

        mockMvc.perform(post("/api/v1/alerts/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host\": \"web-01\", \"title\": \"High CPU\", \"severity\": \"sev2\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("STORE_ERROR"));
    }

    @Test
    void process_pipelineUnexpectedFailure_returns500() throws Exception {
        when(processingService.submit(any(Alert.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        mockMvc.perform(post("/api/v1/alerts/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host\": \"web-01\", \"title\": \"High CPU\", \"severity\": \"sev2\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"));
    }

    @Test
    void batch_success() throws Exception {
        when(processingService.processBatch(anyList())).thenReturn(List.of(
                decided("A", Decision.forward(DecisionReasons.DEFAULT_FORWARD, 0.5)),
                decided("B", Decision.suppress(DecisionReasons.DUPLICATE_ALERT, 1.0))));

        mockMvc.perform(post("/api/v1/alerts/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                [{"alert_id": "A", "host": "web-01", "title": "High CPU", "severity": "sev2"},
                                 {"alert_id": "B", "host": "web-01", "title": "High CPU", "severity": "sev2"}]
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].decision.action").value("SUPPRESS"));
    }

    @Test
    void batch_oneInvalid_rejectsWholeBatchWithIndex() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                [{"host": "web-01", "title": "High CPU", "severity": "sev2"},
                                 {"host": "web-01", "severity": "sev2"}]
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("[1].title"));

        verify(processingService, never()).processBatch(anyList());
    }

    @Test
    void batch_empty_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void history_returnsAlerts() throws Exception {
        Alert alert = TestDataFactory.createAlert("A-1").withDecisionReason(DecisionReasons.DUPLICATE_ALERT);
        when(historyService.recentAlerts("web-01", "High CPU", 50)).thenReturn(List.of(alert));

        mockMvc.perform(get("/api/v1/alerts/history")
                        .param("host", "web-01")
                        .param("title", "High CPU"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].alertId").value("A-1"))
                .andExpect(jsonPath("$[0].decisionReason").value("duplicate_alert"));
    }

    @Test
    void hostSummary_returnsSummary() throws Exception {
        when(historyService.hostSummary("web-01")).thenReturn(HostHistorySummary.builder()
                .host("web-01").lookbackDays(7).totalAlerts(4).daysWithAlerts(3).suppressionRate(0.5).build());

        mockMvc.perform(get("/api/v1/alerts/history/host/web-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAlerts").value(4))
                .andExpect(jsonPath("$.suppressionRate").value(0.5));
    }
}
