package com.rockpoint.payments.persistence.repository;

import com.rockpoint.payments.domain.OperationStatus;
import com.rockpoint.payments.persistence.entity.FiscalizationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface FiscalizationRepository extends JpaRepository<FiscalizationEntity, String> {

    Optional<FiscalizationEntity> findByTransactionId(String transactionId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE FiscalizationEntity f SET f.status = :pending, f.fiscalUrl = :fiscalUrl, "
            + "f.requestPayload = :requestPayload, f.responsePayload = NULL, f.errorCode = NULL, "
            + "f.errorMessage = NULL, f.submittedAt = :now, f.completedAt = NULL "
            + "WHERE f.id = :id AND f.status = :expected")
    int reopenIfStatus(@Param("id") String id,
                       @Param("expected") OperationStatus expected,
                       @Param("pending") OperationStatus pending,
                       @Param("fiscalUrl") String fiscalUrl,
                       @Param("requestPayload") String requestPayload,
                       @Param("now") Instant now);
}
