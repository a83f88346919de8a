package com.rockpoint.payments.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rockpoint.payments.compliance.AuditLogger;
import com.rockpoint.payments.compliance.AuditRecord;
import com.rockpoint.payments.config.ConfigurationException;
import com.rockpoint.payments.config.GatewayConfigService;
import com.rockpoint.payments.config.GatewayCredentials;
import com.rockpoint.payments.core.http.GatewayCall;
import com.rockpoint.payments.core.http.GatewayClient;
import com.rockpoint.payments.core.http.GatewayResponse;
import com.rockpoint.payments.core.http.GatewayTransportException;
import com.rockpoint.payments.domain.AuditAction;
import com.rockpoint.payments.domain.OperationResult;
import com.rockpoint.payments.domain.OperationStatus;
import com.rockpoint.payments.domain.TransactionStatus;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import com.rockpoint.payments.persistence.entity.ReversalEntity;
import com.rockpoint.payments.persistence.service.TransactionPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Cancels a successful payment at the gateway. The transaction moves to
 * REVERSED only when the gateway confirms and the row is still SUCCESS;
 * otherwise it stays SUCCESS and the reversal record carries the reason.
 * Reversals are sent once, never retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReversalOrchestrator {

    static final String CONCURRENT_CHANGE = "Transaction state changed concurrently";
    static final String ALREADY_REVERSING = "A reversal is already in progress or completed for this payment";
    static final String INTERNAL_ERROR_MESSAGE = "An internal error occurred while processing the reversal";

    private final GatewayIntegrationRegistry registry;
    private final GatewayConfigService configService;
    private final GatewayClient gatewayClient;
    private final TransactionPersistenceService persistence;
    private final AuditLogger auditLogger;
    private final ObjectMapper objectMapper;

    /**
     * @throws TransactionNotFoundException when no transaction has {@code orderId}
     */
    public OperationResult reversePayment(String orderId, String reason, String requestedBy) {
        GatewayTransactionEntity tx = persistence.findByOrderId(orderId)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction not found for order " + orderId));
        if (tx.getStatus() != TransactionStatus.SUCCESS) {
            String error = "Only successful payments can be reversed (current status: " + tx.getStatus() + ")";
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", reason);
            details.put("requested_by", requestedBy);
            details.put("rejected", error);
            auditLogger.record(AuditRecord.forTransaction(tx, AuditAction.ERROR_OCCURRED).details(details).build());
            log.warn("Reversal rejected orderId={} status={} requestedBy={}", orderId, tx.getStatus(), requestedBy);
            return OperationResult.rejected(error);
        }
        return reverse(registry.get(tx.getGateway()), tx, reason, requestedBy);
    }

    private <C extends GatewayCredentials> OperationResult reverse(GatewayIntegration<C> integration,
                                                                  GatewayTransactionEntity tx,
                                                                  String reason, String requestedBy) {
        C credentials;
        try {
            credentials = configService.load(tx.getGateway(), integration.credentialsType());
        } catch (ConfigurationException e) {
            log.error("Reversal aborted, gateway not configured orderId={}: {}", tx.getOrderId(), e.getMessage());
            Map<String, Object> details = requestDetails(reason, requestedBy);
            details.put("stage", "reversal");
            details.put("error", e.getMessage());
            details.put("missing_keys", e.getMissingKeys());
            auditError(tx, details, e.getMessage());
            return OperationResult.rejected("Configuration error: " + e.getMessage());
        }

        String reversalId = null;
        try {
            GatewayCall call = integration.reversalCall(credentials, tx);
            Optional<ReversalEntity> opened = open(tx, reason, requestedBy, call);
            if (opened.isEmpty()) {
                Map<String, Object> details = requestDetails(reason, requestedBy);
                details.put("rejected", ALREADY_REVERSING);
                auditError(tx, details, ALREADY_REVERSING);
                log.warn("Reversal rejected orderId={} requestedBy={}: {}", tx.getOrderId(), requestedBy, ALREADY_REVERSING);
                return OperationResult.rejected(ALREADY_REVERSING);
            }
            reversalId = opened.get().getId();
            return send(integration, credentials, tx, call, reversalId, reason, requestedBy);
        } catch (RuntimeException e) {
            log.error("Reversal failed internally orderId={} reversalId={}", tx.getOrderId(), reversalId, e);
            markFailedAfterError(tx, reversalId, reason, requestedBy, e);
            return OperationResult.builder()
                    .success(false)
                    .error(INTERNAL_ERROR_MESSAGE)
                    .recordId(reversalId)
                    .build();
        }
    }

    private Optional<ReversalEntity> open(GatewayTransactionEntity tx, String reason, String requestedBy,
                                          GatewayCall call) {
        try {
            return persistence.openReversal(tx, reason, requestedBy, PayloadJson.write(objectMapper, call.getPayload()));
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent reversal insert for transactionId={}: {}", tx.getId(), e.getMostSpecificCause().getMessage());
            return Optional.empty();
        }
    }

    private <C extends GatewayCredentials> OperationResult send(GatewayIntegration<C> integration, C credentials,
                                                               GatewayTransactionEntity tx, GatewayCall call,
                                                               String reversalId, String reason, String requestedBy) {
        Map<String, Object> details = requestDetails(reason, requestedBy);
        details.put("reversal_id", reversalId);
        AuditRecord.AuditRecordBuilder audit = AuditRecord.forTransaction(tx, AuditAction.REVERSAL_REQUESTED)
                .httpMethod(call.getMethod().name())
                .endpoint(call.getEndpoint());

        GatewayResponse response;
        try {
            response = gatewayClient.call(call, integration.authHeader(credentials), credentials.getRequestTimeoutMs());
        } catch (GatewayTransportException e) {
            persistence.completeReversal(reversalId, OperationStatus.FAILED, null, e.getMessage(), null);
            details.put("success", false);
            details.put("error", e.getMessage());
            auditLogger.record(audit.details(details).responseTimeMs(e.getElapsedMs()).build());
            log.warn("Reversal not delivered orderId={} timeout={}: {}", tx.getOrderId(), e.isTimeout(), e.getMessage());
            return OperationResult.builder()
                    .success(false)
                    .error(e.getMessage())
                    .recordId(reversalId)
                    .build();
        }

        GatewayOutcome outcome = integration.interpret(credentials, response);
        OperationStatus status = outcome.isSuccess() ? OperationStatus.SUCCESS : OperationStatus.FAILED;
        persistence.completeReversal(reversalId, status, outcome.getErrorCode(),
                outcome.getErrorMessage(), response.getRawBody());
        details.put("success", outcome.isSuccess());
        details.put("error_code", outcome.getErrorCode());
        details.put("error_message", outcome.getErrorMessage());
        audit.responseStatus(response.getHttpStatus()).responseTimeMs(response.getResponseTimeMs());

        if (!outcome.isSuccess()) {
            auditLogger.record(audit.details(details).build());
            log.warn("Reversal declined orderId={} errorCode={} message={}",
                    tx.getOrderId(), outcome.getErrorCode(), outcome.getErrorMessage());
            return OperationResult.builder()
                    .success(false)
                    .error(outcome.getErrorMessage())
                    .errorCode(outcome.getErrorCode())
                    .recordId(reversalId)
                    .build();
        }

        if (!persistence.markReversed(tx.getId())) {
            details.put("error", CONCURRENT_CHANGE);
            auditLogger.record(audit.details(details).build());
            log.warn("Reversal confirmed by gateway but transaction {} is no longer SUCCESS", tx.getId());
            return OperationResult.builder()
                    .success(false)
                    .error(CONCURRENT_CHANGE)
                    .recordId(reversalId)
                    .build();
        }
        auditLogger.record(audit.status(TransactionStatus.REVERSED).details(details).build());
        log.info("Payment reversed orderId={} transactionId={} requestedBy={}",
                tx.getOrderId(), tx.getId(), requestedBy);
        return OperationResult.ok(reversalId);
    }

    private void markFailedAfterError(GatewayTransactionEntity tx, String reversalId, String reason,
                                      String requestedBy, RuntimeException cause) {
        if (reversalId != null) {
            try {
                persistence.completeReversal(reversalId, OperationStatus.FAILED,
                        TransactionPersistenceService.INTERNAL_ERROR_CODE, cause.getMessage(), null);
            } catch (RuntimeException e) {
                log.error("Could not mark reversal {} failed", reversalId, e);
            }
        }
        Map<String, Object> details = requestDetails(reason, requestedBy);
        details.put("stage", "reversal");
        details.put("reversal_id", reversalId);
        details.put("error", cause.getMessage());
        details.put("exception", cause.getClass().getName());
        auditError(tx, details, cause.getMessage());
    }

    private void auditError(GatewayTransactionEntity tx, Map<String, Object> details, String message) {
        auditLogger.record(AuditRecord.forTransaction(tx, AuditAction.ERROR_OCCURRED)
                .details(details)
                .errorMessage(message)
                .build());
    }

    private static Map<String, Object> requestDetails(String reason, String requestedBy) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("requested_by", requestedBy);
        return details;
    }
}
