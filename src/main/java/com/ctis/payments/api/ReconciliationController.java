package com.ctis.payments.api;

import com.ctis.payments.reconciliation.PaymentReconciliationJob;
import com.ctis.payments.reconciliation.ReconciliationReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Tag(name = "Reconciliation", description = "Operational trigger for the reconciliation sweep")
public class ReconciliationController {

    private final PaymentReconciliationJob reconciliationJob;

    @PostMapping("/run")
    @Operation(summary = "Run a sweep now",
            description = "Runs one sweep under the same lock as the scheduler. skipped=true when another sweep is running.")
    public ReconciliationReport run() {
        log.info("Reconciliation sweep requested through the API");
        return reconciliationJob.runOnce(() -> Thread.currentThread().isInterrupted());
    }
}
