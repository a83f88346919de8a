package com.rockpoint.payments.persistence.service;

import com.rockpoint.payments.core.InvalidStatusTransitionException;
import com.rockpoint.payments.core.TransactionNotFoundException;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.domain.GatewayStats;
import com.rockpoint.payments.domain.OperationStatus;
import com.rockpoint.payments.domain.TransactionFilter;
import com.rockpoint.payments.domain.TransactionStatus;
import com.rockpoint.payments.persistence.entity.FiscalizationEntity;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import com.rockpoint.payments.persistence.entity.ReversalEntity;
import com.rockpoint.payments.persistence.repository.FiscalizationRepository;
import com.rockpoint.payments.persistence.repository.GatewayTransactionRepository;
import com.rockpoint.payments.persistence.repository.GatewayTransactionRepository.TransactionStatsRow;
import com.rockpoint.payments.persistence.repository.ReversalRepository;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns every write to {@code gateway_transactions} and its reversal and
 * fiscalization sub-records.
 * <p>
 * Status writes are conditional updates ({@code WHERE status = :expected})
 * checked against {@link TransactionStatus#canTransitionTo}. Non-status
 * columns are written after the status update succeeded, on a freshly loaded
 * entity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionPersistenceService {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;
    private static final int TOP_ERRORS = 5;
    public static final int INTERNAL_ERROR_CODE = 500;

    private final GatewayTransactionRepository transactionRepository;
    private final ReversalRepository reversalRepository;
    private final FiscalizationRepository fiscalizationRepository;
    private final Clock clock;

    /** Durable record of intent, written before the gateway is called. */
    @Transactional
    public GatewayTransactionEntity createPending(GatewayTransactionEntity draft) {
        if (draft.getId() == null) {
            draft.setId(UUID.randomUUID().toString());
        }
        draft.setStatus(TransactionStatus.PENDING);
        draft.setRetryCount(0);
        draft.setInitiatedAt(clock.instant());
        GatewayTransactionEntity saved = transactionRepository.save(draft);
        log.debug("Transaction persisted id={} orderId={} gateway={} status=PENDING",
                saved.getId(), saved.getOrderId(), saved.getGateway());
        return saved;
    }

    /**
     * Marks the start of a gateway attempt. The first attempt moves the row to
     * PROCESSING; later ones only record how many attempts failed so far.
     */
    @Transactional
    public void startAttempt(String id, int failedAttempts) {
        if (failedAttempts == 0) {
            transition(id, TransactionStatus.PENDING, TransactionStatus.PROCESSING);
            return;
        }
        int updated = transactionRepository.updateRetryCountIfStatus(
                id, TransactionStatus.PROCESSING, failedAttempts, clock.instant());
        if (updated == 0) {
            throw new InvalidStatusTransitionException(id, currentStatus(id), TransactionStatus.PROCESSING);
        }
    }

    /**
     * @throws InvalidStatusTransitionException if the move is not in the table or the row is no longer at {@code from}
     */
    @Transactional
    public void transition(String id, TransactionStatus from, TransactionStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new InvalidStatusTransitionException(id, from, to);
        }
        int updated = transactionRepository.updateStatusIfCurrent(id, from, to, clock.instant());
        if (updated == 0) {
            throw new InvalidStatusTransitionException(id, currentStatus(id), to);
        }
        log.debug("Transaction status id={} {} -> {}", id, from, to);
    }

    /** PROCESSING -> {@code outcome}, then applies the response columns and {@code completed_at}. */
    @Transactional
    public GatewayTransactionEntity recordOutcome(String id, TransactionStatus outcome,
                                                  Consumer<GatewayTransactionEntity> responseFields) {
        transition(id, TransactionStatus.PROCESSING, outcome);
        return update(id, entity -> {
            responseFields.accept(entity);
            entity.setCompletedAt(clock.instant());
        });
    }

    /** No response after every attempt. */
    @Transactional
    public GatewayTransactionEntity failAfterRetries(String id, int retryCount, boolean timeoutOccurred, String message) {
        transition(id, TransactionStatus.PROCESSING, TransactionStatus.FAILED);
        return update(id, entity -> {
            entity.setRetryCount(retryCount);
            entity.setTimeoutOccurred(timeoutOccurred);
            entity.setErrorMessage(message);
            entity.setCompletedAt(clock.instant());
        });
    }

    /**
     * Best effort after an unexpected exception: moves the row to FAILED when its
     * current status still allows it, otherwise leaves it untouched.
     */
    @Transactional
    public void failInternal(String id, String message) {
        Optional<GatewayTransactionEntity> current = transactionRepository.findById(id);
        if (current.isEmpty()) {
            log.warn("Cannot mark missing transaction id={} as failed", id);
            return;
        }
        TransactionStatus status = current.get().getStatus();
        if (!status.canTransitionTo(TransactionStatus.FAILED)) {
            log.warn("Transaction id={} left at {} after internal error: {}", id, status, message);
            return;
        }
        int updated = transactionRepository.updateStatusIfCurrent(id, status, TransactionStatus.FAILED, clock.instant());
        if (updated == 0) {
            log.warn("Transaction id={} changed concurrently, not marked failed after internal error", id);
            return;
        }
        update(id, entity -> {
            entity.setErrorCode(INTERNAL_ERROR_CODE);
            entity.setErrorMessage(message);
            entity.setCompletedAt(clock.instant());
        });
    }

    /** SUCCESS -> REVERSED; false when another caller already moved the row. */
    @Transactional
    public boolean markReversed(String id) {
        return transactionRepository.updateStatusIfCurrent(
                id, TransactionStatus.SUCCESS, TransactionStatus.REVERSED, clock.instant()) == 1;
    }

    /** Sets the POS sale link once, and only on a successful payment. */
    @Transactional
    public boolean linkToSale(String id, String posTransactionId) {
        return transactionRepository.linkSaleIfEligible(
                id, TransactionStatus.SUCCESS, posTransactionId, clock.instant()) == 1;
    }

    @Transactional
    public void clearConfirmationFlag(String id) {
        update(id, entity -> entity.setRequiresConfirmation(false));
    }

    @Transactional(readOnly = true)
    public Optional<GatewayTransactionEntity> findById(String id) {
        return transactionRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public Optional<GatewayTransactionEntity> findByOrderId(String orderId) {
        return transactionRepository.findByOrderId(orderId);
    }

    /** Newest first. {@code size} defaults to 20 and is capped at 100. */
    @Transactional(readOnly = true)
    public Page<GatewayTransactionEntity> search(TransactionFilter filter, int page, int size) {
        int pageSize = size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);
        PageRequest pageable = PageRequest.of(Math.max(page, 0), pageSize, Sort.by(Sort.Direction.DESC, "initiatedAt"));
        return transactionRepository.findAll(toSpecification(filter), pageable);
    }

    @Transactional(readOnly = true)
    public GatewayStats stats(GatewayKind gateway, Duration window) {
        Instant since = clock.instant().minus(window);
        List<TransactionStatsRow> rows = transactionRepository.findByGatewayAndInitiatedAtGreaterThanEqual(gateway, since);

        long successful = rows.stream().filter(r -> r.getStatus() == TransactionStatus.SUCCESS).count();
        long failed = rows.stream().filter(r -> r.getStatus() == TransactionStatus.FAILED).count();
        long pending = rows.stream()
                .filter(r -> r.getStatus() == TransactionStatus.PENDING || r.getStatus() == TransactionStatus.PROCESSING)
                .count();
        long averageMs = Math.round(rows.stream()
                .filter(r -> r.getCompletedAt() != null && r.getInitiatedAt() != null)
                .mapToLong(r -> Duration.between(r.getInitiatedAt(), r.getCompletedAt()).toMillis())
                .average()
                .orElse(0));

        Map<ErrorKey, Long> errorCounts = rows.stream()
                .filter(r -> r.getStatus() == TransactionStatus.FAILED && r.getErrorCode() != null)
                .collect(Collectors.groupingBy(r -> new ErrorKey(r.getErrorCode(), r.getErrorMessage()), Collectors.counting()));
        List<GatewayStats.ErrorFrequency> commonErrors = errorCounts.entrySet().stream()
                .sorted(Map.Entry.<ErrorKey, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(e -> e.getKey().code()))
                .limit(TOP_ERRORS)
                .map(e -> new GatewayStats.ErrorFrequency(e.getKey().code(), e.getKey().message(), e.getValue()))
                .collect(Collectors.toList());

        return GatewayStats.builder()
                .gateway(gateway)
                .totalTransactions(rows.size())
                .successfulTransactions(successful)
                .failedTransactions(failed)
                .pendingTransactions(pending)
                .totalAmountProcessed(transactionRepository.sumAmountByStatusSince(gateway, TransactionStatus.SUCCESS, since))
                .averageProcessingTimeMs(averageMs)
                .successRatePercent(rows.isEmpty() ? 0 : (int) (successful * 100 / rows.size()))
                .commonErrors(commonErrors)
                .build();
    }

    /**
     * Reversal record in PENDING. A transaction has at most one reversal row:
     * a FAILED attempt is reopened in place, while a PENDING or SUCCESS row
     * yields empty so the caller never sends a second reversal.
     */
    @Transactional
    public Optional<ReversalEntity> openReversal(GatewayTransactionEntity tx, String reason, String requestedBy,
                                                 String requestPayload) {
        Optional<ReversalEntity> existing = reversalRepository.findByTransactionId(tx.getId());
        if (existing.isPresent()) {
            String id = existing.get().getId();
            int reopened = reversalRepository.reopenIfStatus(id, OperationStatus.FAILED, OperationStatus.PENDING,
                    reason, requestedBy, requestPayload, clock.instant());
            if (reopened == 0) {
                log.warn("Reversal for transactionId={} not reopened, current status={}",
                        tx.getId(), existing.get().getStatus());
                return Optional.empty();
            }
            return reversalRepository.findById(id);
        }
        return Optional.of(reversalRepository.saveAndFlush(ReversalEntity.builder()
                .id(UUID.randomUUID().toString())
                .transactionId(tx.getId())
                .originalOrderId(tx.getOrderId())
                .gatewayPaymentId(tx.getGatewayPaymentId())
                .reason(reason)
                .requestedBy(requestedBy)
                .requestPayload(requestPayload)
                .status(OperationStatus.PENDING)
                .requestedAt(clock.instant())
                .build()));
    }

    @Transactional
    public ReversalEntity completeReversal(String reversalId, OperationStatus status, Integer errorCode,
                                           String errorMessage, String responsePayload) {
        ReversalEntity reversal = reversalRepository.findById(reversalId)
                .orElseThrow(() -> new IllegalStateException("Reversal " + reversalId + " disappeared"));
        reversal.setStatus(status);
        reversal.setErrorCode(errorCode);
        reversal.setErrorMessage(errorMessage);
        reversal.setResponsePayload(responsePayload);
        reversal.setCompletedAt(clock.instant());
        return reversalRepository.save(reversal);
    }

    @Transactional(readOnly = true)
    public Optional<FiscalizationEntity> findFiscalization(String transactionId) {
        return fiscalizationRepository.findByTransactionId(transactionId);
    }

    /** Fiscalization record in PENDING; empty when a submission is already PENDING or SUCCESS. */
    @Transactional
    public Optional<FiscalizationEntity> openFiscalization(GatewayTransactionEntity tx, String fiscalUrl,
                                                           String requestPayload) {
        Optional<FiscalizationEntity> existing = fiscalizationRepository.findByTransactionId(tx.getId());
        if (existing.isPresent()) {
            String id = existing.get().getId();
            int reopened = fiscalizationRepository.reopenIfStatus(id, OperationStatus.FAILED, OperationStatus.PENDING,
                    fiscalUrl, requestPayload, clock.instant());
            if (reopened == 0) {
                log.warn("Fiscalization for transactionId={} not reopened, current status={}",
                        tx.getId(), existing.get().getStatus());
                return Optional.empty();
            }
            return fiscalizationRepository.findById(id);
        }
        return Optional.of(fiscalizationRepository.saveAndFlush(FiscalizationEntity.builder()
                .id(UUID.randomUUID().toString())
                .transactionId(tx.getId())
                .gatewayPaymentId(tx.getGatewayPaymentId())
                .fiscalUrl(fiscalUrl)
                .requestPayload(requestPayload)
                .status(OperationStatus.PENDING)
                .submittedAt(clock.instant())
                .build()));
    }

    @Transactional
    public FiscalizationEntity completeFiscalization(String fiscalizationId, OperationStatus status, Integer errorCode,
                                                     String errorMessage, String responsePayload) {
        FiscalizationEntity fiscalization = fiscalizationRepository.findById(fiscalizationId)
                .orElseThrow(() -> new IllegalStateException("Fiscalization " + fiscalizationId + " disappeared"));
        fiscalization.setStatus(status);
        fiscalization.setErrorCode(errorCode);
        fiscalization.setErrorMessage(errorMessage);
        fiscalization.setResponsePayload(responsePayload);
        fiscalization.setCompletedAt(clock.instant());
        return fiscalizationRepository.save(fiscalization);
    }

    private GatewayTransactionEntity update(String id, Consumer<GatewayTransactionEntity> change) {
        GatewayTransactionEntity entity = transactionRepository.findById(id)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction not found: " + id));
        change.accept(entity);
        entity.setUpdatedAt(clock.instant());
        return transactionRepository.save(entity);
    }

    private TransactionStatus currentStatus(String id) {
        return transactionRepository.findById(id)
                .map(GatewayTransactionEntity::getStatus)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction not found: " + id));
    }

    private static Specification<GatewayTransactionEntity> toSpecification(TransactionFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter == null) {
                return cb.and();
            }
            addIfPresent(predicates, filter.getGateway(), v -> cb.equal(root.get("gateway"), v));
            addIfPresent(predicates, filter.getStatus(), v -> cb.equal(root.get("status"), v));
            addIfPresent(predicates, filter.getEmployeeId(), v -> cb.equal(root.get("employeeId"), v));
            addIfPresent(predicates, filter.getTerminalId(), v -> cb.equal(root.get("terminalId"), v));
            addIfPresent(predicates, filter.getErrorCode(), v -> cb.equal(root.get("errorCode"), v));
            addIfPresent(predicates, filter.getInitiatedFrom(),
                    v -> cb.greaterThanOrEqualTo(root.<Instant>get("initiatedAt"), v));
            addIfPresent(predicates, filter.getInitiatedTo(),
                    v -> cb.lessThan(root.<Instant>get("initiatedAt"), v));
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static <T> void addIfPresent(List<Predicate> predicates, T value, Function<T, Predicate> predicate) {
        if (value instanceof String && ((String) value).isBlank()) {
            return;
        }
        if (value != null) {
            predicates.add(Objects.requireNonNull(predicate.apply(value)));
        }
    }

    private record ErrorKey(Integer code, String message) {}
}
