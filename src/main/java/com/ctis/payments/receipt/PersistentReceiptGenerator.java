package com.ctis.payments.receipt;

import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.persistence.entity.PaymentReceiptEntity;
import com.ctis.payments.persistence.repository.PaymentReceiptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Stores receipts in {@code payment_receipts}. Two racing issuers for one transaction
 * collide on the unique transaction id; the loser reads back the winner's receipt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PersistentReceiptGenerator implements ReceiptGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final PaymentReceiptRepository receiptRepository;
    private final Clock clock;

    @Override
    public String issue(PaymentTransaction transaction) {
        if (transaction.getStatus() != TransactionStatus.COMPLETED) {
            throw new IllegalStateException("Receipts are only issued for completed transactions, got "
                    + transaction.getStatus() + " for " + transaction.getId());
        }
        Optional<PaymentReceiptEntity> existing = receiptRepository.findByTransactionId(transaction.getId());
        if (existing.isPresent()) {
            log.debug("Receipt already issued: transactionId={}, receiptNumber={}",
                    transaction.getId(), existing.get().getReceiptNumber());
            return existing.get().getReceiptNumber();
        }

        Instant issuedAt = Instant.now(clock);
        PaymentReceiptEntity receipt = PaymentReceiptEntity.builder()
                .receiptNumber(receiptNumber(transaction.getId(), issuedAt))
                .transactionId(transaction.getId())
                .transactionReference(transaction.getTransactionReference())
                .clientId(transaction.getClientId())
                .amount(transaction.getAmount())
                .currency(transaction.getCurrency())
                .issuedAt(issuedAt)
                .build();
        try {
            PaymentReceiptEntity saved = receiptRepository.saveAndFlush(receipt);
            log.info("Issued receipt: transactionId={}, receiptNumber={}", transaction.getId(), saved.getReceiptNumber());
            return saved.getReceiptNumber();
        } catch (DataIntegrityViolationException e) {
            log.info("Receipt for transactionId={} issued concurrently, using existing one", transaction.getId());
            return receiptRepository.findByTransactionId(transaction.getId())
                    .map(PaymentReceiptEntity::getReceiptNumber)
                    .orElseThrow(() -> e);
        }
    }

    static String receiptNumber(Long transactionId, Instant issuedAt) {
        return String.format("RCT-%s-%08d", DAY.format(issuedAt), transactionId);
    }
}
