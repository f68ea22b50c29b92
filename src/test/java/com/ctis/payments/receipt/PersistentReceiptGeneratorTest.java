package com.ctis.payments.receipt;

import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.persistence.repository.PaymentReceiptRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({PersistentReceiptGenerator.class, PersistentReceiptGeneratorTest.FixedClockConfig.class})
class PersistentReceiptGeneratorTest {

    @Autowired
    private PersistentReceiptGenerator receiptGenerator;

    @Autowired
    private PaymentReceiptRepository receiptRepository;

    @Test
    void issuesOneReceiptPerTransaction() {
        PaymentTransaction completed = completed(42L);

        String first = receiptGenerator.issue(completed);
        String second = receiptGenerator.issue(completed);

        assertThat(first).isEqualTo("RCT-20260301-00000042");
        assertThat(second).isEqualTo(first);
        assertThat(receiptRepository.countByTransactionId(42L)).isEqualTo(1);
        assertThat(receiptRepository.findByTransactionId(42L)).get()
                .satisfies(receipt -> {
                    assertThat(receipt.getAmount()).isEqualByComparingTo("99.95");
                    assertThat(receipt.getCurrency()).isEqualTo("SLE");
                    assertThat(receipt.getTransactionReference()).isEqualTo("PAY-42");
                });
    }

    @Test
    void refusesNonCompletedTransactions() {
        PaymentTransaction failed = completed(43L).toBuilder().status(TransactionStatus.FAILED).build();

        assertThatThrownBy(() -> receiptGenerator.issue(failed))
                .isInstanceOf(IllegalStateException.class);
        assertThat(receiptRepository.countByTransactionId(43L)).isZero();
    }

    private static PaymentTransaction completed(Long id) {
        return PaymentTransaction.builder()
                .id(id)
                .transactionReference("PAY-" + id)
                .clientId("client-1")
                .amount(new BigDecimal("99.95"))
                .currency("SLE")
                .gatewayType(GatewayType.ORANGE_MONEY)
                .status(TransactionStatus.COMPLETED)
                .build();
    }

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        }
    }
}
