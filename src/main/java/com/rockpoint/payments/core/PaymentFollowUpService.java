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
import com.rockpoint.payments.domain.StatusCheckResult;
import com.rockpoint.payments.domain.TransactionStatus;
import com.rockpoint.payments.persistence.entity.FiscalizationEntity;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import com.rockpoint.payments.persistence.service.TransactionPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Side-channel calls against an existing payment: fiscal receipt submission
 * and gateway status polls. Neither changes the transaction's status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentFollowUpService {

    static final String ALREADY_SUBMITTED = "Fiscal data already submitted for this payment";
    static final String INTERNAL_ERROR_MESSAGE = "An internal error occurred while contacting the gateway";

    private final GatewayIntegrationRegistry registry;
    private final GatewayConfigService configService;
    private final GatewayClient gatewayClient;
    private final TransactionPersistenceService persistence;
    private final AuditLogger auditLogger;
    private final ObjectMapper objectMapper;

    /**
     * Sends the fiscal receipt URL for a successful payment. A failed
     * submission can be sent again; the record is reused.
     *
     * @throws TransactionNotFoundException for an unknown id
     */
    public OperationResult submitFiscalization(String transactionId, String fiscalUrl) {
        if (fiscalUrl == null || fiscalUrl.isBlank()) {
            throw new PaymentValidationException("Fiscal URL is required");
        }
        GatewayTransactionEntity tx = load(transactionId);
        if (tx.getStatus() != TransactionStatus.SUCCESS) {
            log.warn("Fiscalization rejected transactionId={} status={}", transactionId, tx.getStatus());
            return OperationResult.rejected(
                    "Only successful payments can be fiscalized (current status: " + tx.getStatus() + ")");
        }
        Optional<FiscalizationEntity> existing = persistence.findFiscalization(transactionId);
        if (existing.isPresent() && existing.get().getStatus() == OperationStatus.SUCCESS) {
            return OperationResult.rejected(ALREADY_SUBMITTED);
        }
        return fiscalize(registry.get(tx.getGateway()), tx, fiscalUrl);
    }

    private <C extends GatewayCredentials> OperationResult fiscalize(GatewayIntegration<C> integration,
                                                                    GatewayTransactionEntity tx, String fiscalUrl) {
        C credentials;
        try {
            credentials = configService.load(tx.getGateway(), integration.credentialsType());
        } catch (ConfigurationException e) {
            log.error("Fiscalization aborted, gateway not configured transactionId={}: {}", tx.getId(), e.getMessage());
            Map<String, Object> details = errorDetails("fiscalization", e);
            details.put("missing_keys", e.getMissingKeys());
            auditError(tx, details, e.getMessage());
            return OperationResult.rejected("Configuration error: " + e.getMessage());
        }
        String fiscalizationId = null;
        try {
            Optional<GatewayCall> maybeCall = integration.fiscalizationCall(credentials, tx, fiscalUrl);
            if (maybeCall.isEmpty()) {
                log.warn("Fiscalization not supported gateway={} transactionId={}", tx.getGateway(), tx.getId());
                return OperationResult.rejected("Fiscalization is not supported by " + tx.getGateway());
            }
            GatewayCall call = maybeCall.get();
            Optional<FiscalizationEntity> opened = openFiscalization(tx, fiscalUrl, call);
            if (opened.isEmpty()) {
                log.warn("Fiscalization rejected transactionId={}: {}", tx.getId(), ALREADY_SUBMITTED);
                return OperationResult.rejected(ALREADY_SUBMITTED);
            }
            fiscalizationId = opened.get().getId();
            return sendFiscalization(integration, credentials, tx, call, fiscalizationId, fiscalUrl);
        } catch (RuntimeException e) {
            log.error("Fiscalization failed internally transactionId={} fiscalizationId={}",
                    tx.getId(), fiscalizationId, e);
            if (fiscalizationId != null) {
                try {
                    persistence.completeFiscalization(fiscalizationId, OperationStatus.FAILED,
                            TransactionPersistenceService.INTERNAL_ERROR_CODE, e.getMessage(), null);
                } catch (RuntimeException markError) {
                    log.error("Could not mark fiscalization {} failed", fiscalizationId, markError);
                }
            }
            Map<String, Object> details = errorDetails("fiscalization", e);
            details.put("fiscalization_id", fiscalizationId);
            details.put("exception", e.getClass().getName());
            auditError(tx, details, e.getMessage());
            return OperationResult.builder()
                    .success(false)
                    .error(INTERNAL_ERROR_MESSAGE)
                    .recordId(fiscalizationId)
                    .build();
        }
    }

    private Optional<FiscalizationEntity> openFiscalization(GatewayTransactionEntity tx, String fiscalUrl,
                                                            GatewayCall call) {
        try {
            return persistence.openFiscalization(tx, fiscalUrl, PayloadJson.write(objectMapper, call.getPayload()));
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent fiscalization insert for transactionId={}: {}",
                    tx.getId(), e.getMostSpecificCause().getMessage());
            return Optional.empty();
        }
    }

    private <C extends GatewayCredentials> OperationResult sendFiscalization(GatewayIntegration<C> integration,
                                                                            C credentials, GatewayTransactionEntity tx,
                                                                            GatewayCall call, String fiscalizationId,
                                                                            String fiscalUrl) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fiscalization_id", fiscalizationId);
        details.put("fiscal_url", fiscalUrl);
        AuditRecord.AuditRecordBuilder audit = AuditRecord.forTransaction(tx, AuditAction.FISCALIZATION_SENT)
                .httpMethod(call.getMethod().name())
                .endpoint(call.getEndpoint());
        try {
            GatewayResponse response = gatewayClient.call(call, integration.authHeader(credentials),
                    credentials.getRequestTimeoutMs());
            GatewayOutcome outcome = integration.interpret(credentials, response);
            persistence.completeFiscalization(fiscalizationId,
                    outcome.isSuccess() ? OperationStatus.SUCCESS : OperationStatus.FAILED,
                    outcome.getErrorCode(), outcome.getErrorMessage(), response.getRawBody());
            details.put("success", outcome.isSuccess());
            details.put("error_code", outcome.getErrorCode());
            details.put("error_message", outcome.getErrorMessage());
            auditLogger.record(audit.details(details)
                    .responseStatus(response.getHttpStatus())
                    .responseTimeMs(response.getResponseTimeMs())
                    .build());
            if (!outcome.isSuccess()) {
                log.warn("Fiscalization declined transactionId={} errorCode={}", tx.getId(), outcome.getErrorCode());
                return OperationResult.builder()
                        .success(false)
                        .error(outcome.getErrorMessage())
                        .errorCode(outcome.getErrorCode())
                        .recordId(fiscalizationId)
                        .build();
            }
            log.info("Fiscal data submitted transactionId={} orderId={}", tx.getId(), tx.getOrderId());
            return OperationResult.ok(fiscalizationId);
        } catch (GatewayTransportException e) {
            persistence.completeFiscalization(fiscalizationId, OperationStatus.FAILED, null, e.getMessage(), null);
            details.put("success", false);
            details.put("error", e.getMessage());
            auditLogger.record(audit.details(details).responseTimeMs(e.getElapsedMs()).build());
            log.warn("Fiscalization not delivered transactionId={}: {}", tx.getId(), e.getMessage());
            return OperationResult.builder()
                    .success(false)
                    .error(e.getMessage())
                    .recordId(fiscalizationId)
                    .build();
        }
    }

    /**
     * Asks the gateway for its view of the payment. The local status is
     * returned alongside and left untouched.
     *
     * @throws TransactionNotFoundException for an unknown id
     */
    public StatusCheckResult checkPaymentStatus(String transactionId) {
        GatewayTransactionEntity tx = load(transactionId);
        if (tx.getGatewayPaymentId() == null) {
            return StatusCheckResult.builder()
                    .success(false)
                    .localStatus(tx.getStatus())
                    .error("Gateway payment id not available")
                    .build();
        }
        return poll(registry.get(tx.getGateway()), tx);
    }

    private <C extends GatewayCredentials> StatusCheckResult poll(GatewayIntegration<C> integration,
                                                                 GatewayTransactionEntity tx) {
        C credentials;
        try {
            credentials = configService.load(tx.getGateway(), integration.credentialsType());
        } catch (ConfigurationException e) {
            log.error("Status poll aborted, gateway not configured transactionId={}: {}", tx.getId(), e.getMessage());
            Map<String, Object> details = errorDetails("status_check", e);
            details.put("missing_keys", e.getMissingKeys());
            auditError(tx, details, e.getMessage());
            return StatusCheckResult.builder()
                    .success(false)
                    .localStatus(tx.getStatus())
                    .error("Configuration error: " + e.getMessage())
                    .build();
        }
        try {
            return sendStatusCheck(integration, credentials, tx);
        } catch (RuntimeException e) {
            log.error("Status poll failed internally transactionId={}", tx.getId(), e);
            Map<String, Object> details = errorDetails("status_check", e);
            details.put("exception", e.getClass().getName());
            auditError(tx, details, e.getMessage());
            return StatusCheckResult.builder()
                    .success(false)
                    .localStatus(tx.getStatus())
                    .error(INTERNAL_ERROR_MESSAGE)
                    .build();
        }
    }

    private <C extends GatewayCredentials> StatusCheckResult sendStatusCheck(GatewayIntegration<C> integration,
                                                                            C credentials,
                                                                            GatewayTransactionEntity tx) {
        GatewayCall call = integration.statusCall(credentials, tx);
        Map<String, Object> details = new LinkedHashMap<>();
        AuditRecord.AuditRecordBuilder audit = AuditRecord.forTransaction(tx, AuditAction.STATUS_CHECKED)
                .httpMethod(call.getMethod().name())
                .endpoint(call.getEndpoint());
        try {
            GatewayResponse response = gatewayClient.call(call, integration.authHeader(credentials),
                    credentials.getRequestTimeoutMs());
            GatewayOutcome outcome = integration.interpret(credentials, response);
            details.put("local_status", tx.getStatus());
            details.put("gateway_status", outcome.getGatewayStatus());
            details.put("error_code", outcome.getErrorCode());
            auditLogger.record(audit.details(details)
                    .responseStatus(response.getHttpStatus())
                    .responseTimeMs(response.getResponseTimeMs())
                    .build());
            log.debug("Status polled transactionId={} local={} gateway={}",
                    tx.getId(), tx.getStatus(), outcome.getGatewayStatus());
            return StatusCheckResult.builder()
                    .success(outcome.isSuccess())
                    .localStatus(tx.getStatus())
                    .gatewayStatus(outcome.getGatewayStatus())
                    .errorCode(outcome.getErrorCode())
                    .error(outcome.getErrorMessage())
                    .build();
        } catch (GatewayTransportException e) {
            details.put("local_status", tx.getStatus());
            details.put("error", e.getMessage());
            auditLogger.record(audit.details(details).responseTimeMs(e.getElapsedMs()).build());
            log.warn("Status poll failed transactionId={}: {}", tx.getId(), e.getMessage());
            return StatusCheckResult.builder()
                    .success(false)
                    .localStatus(tx.getStatus())
                    .error(e.getMessage())
                    .build();
        }
    }

    private void auditError(GatewayTransactionEntity tx, Map<String, Object> details, String message) {
        auditLogger.record(AuditRecord.forTransaction(tx, AuditAction.ERROR_OCCURRED)
                .details(details)
                .errorMessage(message)
                .build());
    }

    private static Map<String, Object> errorDetails(String stage, RuntimeException cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("stage", stage);
        details.put("error", cause.getMessage());
        return details;
    }

    private GatewayTransactionEntity load(String transactionId) {
        return persistence.findById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction not found: " + transactionId));
    }
}
