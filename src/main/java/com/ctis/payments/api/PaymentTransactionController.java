package com.ctis.payments.api;

import com.ctis.payments.core.PaymentGatewayService;
import com.ctis.payments.domain.Actor;
import com.ctis.payments.domain.AuditEntry;
import com.ctis.payments.domain.InitiatePaymentCommand;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.ProviderStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Interactive payment flow: create, confirm, dispatch, poll, cancel.
 * The caller is identified by the {@code X-User-Id} header set by the API gateway.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments/transactions")
@RequiredArgsConstructor
@Tag(name = "Payment transactions", description = "Create and drive gateway transactions")
public class PaymentTransactionController {

    static final String USER_HEADER = "X-User-Id";

    private final PaymentGatewayService gatewayService;

    @PostMapping
    @Operation(summary = "Initiate payment",
            description = "Creates a transaction in INITIATED. Repeating a transactionReference returns the existing transaction.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Transaction created (or existing one returned)"),
            @ApiResponse(responseCode = "400", description = "Validation failed. Body: { \"error\": \"VALIDATION_FAILED\"|\"BAD_REQUEST\", ... }"),
            @ApiResponse(responseCode = "404", description = "Unknown client")
    })
    public ResponseEntity<TransactionResponseDto> initiate(@Valid @RequestBody InitiatePaymentRequestDto dto,
                                                           @RequestHeader(value = USER_HEADER, required = false) String userId) {
        InitiatePaymentCommand command = InitiatePaymentCommand.builder()
                .clientId(dto.getClientId())
                .amount(dto.getAmount())
                .currency(dto.getCurrency())
                .gatewayType(dto.getGatewayType())
                .transactionReference(dto.getTransactionReference())
                .metadata(dto.getMetadata())
                .initiatedBy(userId)
                .build();
        PaymentTransaction transaction = gatewayService.initiate(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponseDto.from(transaction));
    }

    @PostMapping("/{id}/confirmation-request")
    @Operation(summary = "Send confirmation prompt",
            description = "Pushes a confirmation prompt to the payer's wallet and moves INITIATED to PENDING.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Prompt sent"),
            @ApiResponse(responseCode = "409", description = "Not INITIATED, or session expired"),
            @ApiResponse(responseCode = "503", description = "Provider unavailable; retry later")
    })
    public TransactionResponseDto requestConfirmation(@PathVariable("id") Long id,
                                                      @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return TransactionResponseDto.from(gatewayService.requestConfirmation(id, Actor.user(userId)));
    }

    @PostMapping("/{id}/process")
    @Operation(summary = "Process payment",
            description = "Dispatches the payment to its provider and moves it to PROCESSING. Terminal transactions are returned unchanged.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Dispatched, or already terminal"),
            @ApiResponse(responseCode = "409", description = "Illegal transition, session expired, or concurrent modification"),
            @ApiResponse(responseCode = "503", description = "Provider unavailable; transaction left unchanged")
    })
    public TransactionResponseDto process(@PathVariable("id") Long id,
                                          @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return TransactionResponseDto.from(gatewayService.process(id, Actor.user(userId)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get transaction")
    public TransactionResponseDto get(@PathVariable("id") Long id) {
        return TransactionResponseDto.from(gatewayService.getTransaction(id));
    }

    @GetMapping("/by-reference/{reference}")
    @Operation(summary = "Get transaction by reference")
    public TransactionResponseDto getByReference(@PathVariable("reference") String reference) {
        return TransactionResponseDto.from(gatewayService.findByReference(reference));
    }

    @GetMapping("/{id}/status")
    @Operation(summary = "Check status",
            description = "Asks the provider where supported and applies a definitive terminal answer.")
    public StatusResponseDto checkStatus(@PathVariable("id") Long id) {
        ProviderStatus status = gatewayService.checkStatus(id);
        return StatusResponseDto.from(id, status);
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel payment", description = "Allowed from PENDING and PROCESSING.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Cancelled, or already terminal (cancelled=false)"),
            @ApiResponse(responseCode = "409", description = "Illegal transition or concurrent modification")
    })
    public CancelResponseDto cancel(@PathVariable("id") Long id,
                                    @Valid @RequestBody(required = false) CancelRequestDto dto,
                                    @RequestHeader(value = USER_HEADER, required = false) String userId) {
        String reason = dto != null ? dto.getReason() : null;
        boolean cancelled = gatewayService.cancel(id, reason, Actor.user(userId));
        PaymentTransaction transaction = gatewayService.getTransaction(id);
        return CancelResponseDto.builder()
                .transactionId(id)
                .cancelled(cancelled)
                .status(transaction.getStatus())
                .build();
    }

    @GetMapping("/{id}/audit")
    @Operation(summary = "Audit trail", description = "Every status change of the transaction, oldest first.")
    public List<AuditEntry> auditTrail(@PathVariable("id") Long id) {
        return gatewayService.getAuditTrail(id);
    }
}
