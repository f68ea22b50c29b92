package com.ctis.payments.persistence.repository;

import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.persistence.entity.PaymentTransactionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for gateway transactions.
 */
@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransactionEntity, Long> {

    Optional<PaymentTransactionEntity> findByTransactionReference(String transactionReference);

    Optional<PaymentTransactionEntity> findByGatewayTypeAndExternalReference(GatewayType gatewayType, String externalReference);

    /** Oldest first, so a bounded batch always makes progress on the longest-waiting rows. */
    @Query("SELECT t FROM PaymentTransactionEntity t WHERE t.status IN :statuses ORDER BY t.initiatedAt ASC, t.id ASC")
    List<PaymentTransactionEntity> findOldestByStatusIn(@Param("statuses") Collection<TransactionStatus> statuses, Pageable pageable);
}
