package com.rockpoint.payments.persistence.repository;

import com.rockpoint.payments.persistence.entity.AuditEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for the audit trail. Only inserts and reads are used.
 */
@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntryEntity, String> {

    List<AuditEntryEntity> findByTransactionIdOrderByCreatedAtAsc(String transactionId);

    List<AuditEntryEntity> findByAction(String action);

    @Query("SELECT a FROM AuditEntryEntity a WHERE a.createdAt BETWEEN :from AND :to ORDER BY a.createdAt DESC")
    List<AuditEntryEntity> findByDateRange(@Param("from") Instant from, @Param("to") Instant to);
}
