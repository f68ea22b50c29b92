package com.ctis.payments.persistence.repository;

import com.ctis.payments.domain.ActorType;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.persistence.entity.TransactionAuditEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Audit trail repository. Only inserts and reads are used.
 */
@Repository
public interface TransactionAuditRepository extends JpaRepository<TransactionAuditEntity, Long> {

    List<TransactionAuditEntity> findByTransactionIdOrderByIdAsc(Long transactionId);

    boolean existsByTransactionIdAndActorTypeAndNewStatus(Long transactionId, ActorType actorType, TransactionStatus newStatus);

    long countByTransactionId(Long transactionId);
}
