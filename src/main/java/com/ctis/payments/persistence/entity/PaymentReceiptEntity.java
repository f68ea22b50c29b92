package com.ctis.payments.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Receipt issued for a completed transaction. The unique transaction id keeps issuance
 * at most once per transaction.
 */
@Entity
@Table(name = "payment_receipts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_receipt_transaction", columnNames = "transaction_id"),
    @UniqueConstraint(name = "uk_receipt_number", columnNames = "receipt_number")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentReceiptEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "receipt_number", nullable = false, length = 64)
    private String receiptNumber;

    @Column(name = "transaction_id", nullable = false)
    private Long transactionId;

    @Column(name = "transaction_reference", nullable = false, length = 100)
    private String transactionReference;

    @Column(name = "client_id", nullable = false, length = 64)
    private String clientId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;
}
