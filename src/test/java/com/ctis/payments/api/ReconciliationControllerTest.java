package com.ctis.payments.api;

import com.ctis.payments.reconciliation.PaymentReconciliationJob;
import com.ctis.payments.reconciliation.ReconciliationReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ReconciliationController.class)
class ReconciliationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PaymentReconciliationJob reconciliationJob;

    @Test
    void runReturnsTheSweepReport() throws Exception {
        when(reconciliationJob.runOnce(any())).thenReturn(ReconciliationReport.builder()
                .startedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .inspected(3)
                .updated(2)
                .errors(1)
                .build());

        mockMvc.perform(post("/api/v1/reconciliation/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inspected").value(3))
                .andExpect(jsonPath("$.updated").value(2))
                .andExpect(jsonPath("$.errors").value(1))
                .andExpect(jsonPath("$.skipped").value(false));
    }

    @Test
    void heldLockIsReportedAsSkipped() throws Exception {
        when(reconciliationJob.runOnce(any())).thenReturn(ReconciliationReport.skipped(Instant.parse("2026-03-01T10:00:00Z")));

        mockMvc.perform(post("/api/v1/reconciliation/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skipped").value(true));
    }
}
