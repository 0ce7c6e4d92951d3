package com.ops.alertdecision.controller;

import com.ops.alertdecision.model.AuditSummary;
import com.ops.alertdecision.model.DecisionAction;
import com.ops.alertdecision.service.AuditService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static com.ops.alertdecision.testutil.TestDataFactory.NOW;
import static com.ops.alertdecision.testutil.TestDataFactory.createAuditEntry;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuditController.class)
class AuditControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuditService auditService;

    @Test
    void list_filteredByAuditKey() throws Exception {
        when(auditService.recent(DecisionAction.SUPPRESS, 100)).thenReturn(
                List.of(createAuditEntry("1", DecisionAction.SUPPRESS, "duplicate_alert", NOW)));

        mockMvc.perform(get("/api/v1/audit").param("action", "suppressed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].entryId").value("1"))
                .andExpect(jsonPath("$[0].action").value("SUPPRESS"));
    }

    @Test
    void list_noFilter_passesNull() throws Exception {
        when(auditService.recent(null, 5)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/audit").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(auditService).recent(null, 5);
    }

    @Test
    void list_unknownAction_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/audit").param("action", "ignored"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("action"));

        verifyNoInteractions(auditService);
    }

    @Test
    void list_nonPositiveLimit_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/audit").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("limit"));
    }

    @Test
    void summary_success() throws Exception {
        when(auditService.summary()).thenReturn(AuditSummary.builder()
                .total(4).suppressed(3).forwarded(1).noiseReductionPct(75.0)
                .byReason(Map.of("duplicate_alert", 3L, "default_forward_no_strong_suppress", 1L))
                .build());

        mockMvc.perform(get("/api/v1/audit/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.noiseReductionPct").value(75.0))
                .andExpect(jsonPath("$.byReason.duplicate_alert").value(3));
    }
}
