package com.ctis.payments.persistence.repository;

import com.ctis.payments.persistence.entity.PaymentReceiptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PaymentReceiptRepository extends JpaRepository<PaymentReceiptEntity, Long> {

    Optional<PaymentReceiptEntity> findByTransactionId(Long transactionId);

    long countByTransactionId(Long transactionId);
}
