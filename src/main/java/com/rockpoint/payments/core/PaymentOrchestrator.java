package com.rockpoint.payments.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rockpoint.payments.compliance.AuditLogger;
import com.rockpoint.payments.compliance.AuditRecord;
import com.rockpoint.payments.compliance.SensitiveDataMasker;
import com.rockpoint.payments.config.ConfigurationException;
import com.rockpoint.payments.config.GatewayConfigService;
import com.rockpoint.payments.config.GatewayCredentials;
import com.rockpoint.payments.core.auth.AuthHeader;
import com.rockpoint.payments.core.http.GatewayCall;
import com.rockpoint.payments.core.http.GatewayClient;
import com.rockpoint.payments.core.http.GatewayResponse;
import com.rockpoint.payments.core.http.GatewayTransportException;
import com.rockpoint.payments.domain.AuditAction;
import com.rockpoint.payments.domain.ConfirmationAction;
import com.rockpoint.payments.domain.CreatePaymentRequest;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.domain.GatewayStats;
import com.rockpoint.payments.domain.MoneyUnits;
import com.rockpoint.payments.domain.OperationResult;
import com.rockpoint.payments.domain.PaymentData;
import com.rockpoint.payments.domain.PaymentResult;
import com.rockpoint.payments.domain.TransactionFilter;
import com.rockpoint.payments.domain.TransactionStatus;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import com.rockpoint.payments.persistence.service.TransactionPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Drives a wallet/QR payment from the scanned code to a final status:
 * validate, load credentials, allocate identifiers, write the PENDING row,
 * call the gateway with retries, and record the outcome. Every path writes
 * an audit entry before it returns.
 * <p>
 * Declines and transport failures are returned as {@link PaymentResult}s;
 * only lookups of unknown transactions throw.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentOrchestrator {

    static final String INTERNAL_ERROR_MESSAGE = "An internal error occurred while processing the payment";
    static final String CONFIRMATION_ERROR_MESSAGE = "An internal error occurred while confirming the payment";
    static final String REJECT_REASON = "Rejected at terminal";
    /** Integer digits that still fit a signed 64-bit count of tiyin. */
    static final int MAX_INTEGER_DIGITS = 16;
    private static final Duration STATS_WINDOW = Duration.ofHours(24);

    private final GatewayIntegrationRegistry registry;
    private final GatewayConfigService configService;
    private final GatewayClient gatewayClient;
    private final OrderIdGenerator orderIdGenerator;
    private final TransactionPersistenceService persistence;
    private final ReversalOrchestrator reversalOrchestrator;
    private final AuditLogger auditLogger;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${payments.retry.base-delay:1s}")
    private Duration retryBaseDelay = Duration.ofSeconds(1);

    @Value("${payments.retry.cap-delay:5s}")
    private Duration retryCapDelay = Duration.ofSeconds(5);

    public PaymentResult createPayment(CreatePaymentRequest request) {
        GatewayIntegration<?> integration;
        try {
            validateCommon(request);
            integration = registry.get(request.getGateway());
            integration.validate(request);
        } catch (PaymentValidationException e) {
            log.warn("Payment rejected gateway={} terminalId={} employeeId={} reason={}",
                    request.getGateway(), request.getTerminalId(), request.getEmployeeId(), e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", "validation");
            details.put("error", e.getMessage());
            auditLogger.record(AuditRecord.builder()
                    .gateway(request.getGateway())
                    .action(AuditAction.PAYMENT_FAILED)
                    .details(details)
                    .employeeId(request.getEmployeeId())
                    .terminalId(request.getTerminalId())
                    .amount(request.getAmount())
                    .errorMessage(e.getMessage())
                    .build());
            return PaymentResult.invalid("Invalid payment request", e.getMessage());
        }
        return create(integration, request);
    }

    private <C extends GatewayCredentials> PaymentResult create(GatewayIntegration<C> integration,
                                                               CreatePaymentRequest request) {
        GatewayKind gateway = integration.kind();
        C credentials;
        try {
            credentials = configService.load(gateway, integration.credentialsType());
        } catch (ConfigurationException e) {
            log.error("Payment aborted, gateway not configured gateway={} terminalId={}: {}",
                    gateway, request.getTerminalId(), e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", "configuration");
            details.put("error", e.getMessage());
            details.put("missing_keys", e.getMissingKeys());
            auditLogger.record(AuditRecord.builder()
                    .gateway(gateway)
                    .action(AuditAction.PAYMENT_FAILED)
                    .details(details)
                    .employeeId(request.getEmployeeId())
                    .terminalId(request.getTerminalId())
                    .amount(request.getAmount())
                    .errorMessage(e.getMessage())
                    .build());
            return PaymentResult.failure(PaymentResult.CONFIGURATION_ERROR, e.getMessage(), null);
        }

        long started = clock.millis();
        String transactionId = null;
        try {
            String orderId = orderIdGenerator.generateUniqueOrderId(gateway);
            long amountMinor = MoneyUnits.toMinorUnits(request.getAmount());
            PaymentContext context = PaymentContext.builder()
                    .request(request)
                    .orderId(orderId)
                    .gatewayTransactionId(UUID.randomUUID().toString())
                    .amountMinor(amountMinor)
                    .amountMajor(request.getAmount().setScale(2, RoundingMode.HALF_UP))
                    .cashboxCode(integration.cashboxCode(credentials, request))
                    .build();
            GatewayCall call = integration.createCall(credentials, context);
            AuthHeader firstHeader = integration.authHeader(credentials);

            GatewayTransactionEntity tx = persistence.createPending(GatewayTransactionEntity.builder()
                    .gateway(gateway)
                    .orderId(orderId)
                    .gatewayTransactionId(context.getGatewayTransactionId())
                    .amountMinor(amountMinor)
                    .amountMajor(context.getAmountMajor())
                    .employeeId(request.getEmployeeId())
                    .terminalId(request.getTerminalId())
                    .cashboxCode(context.getCashboxCode())
                    .requestPayload(PayloadJson.write(objectMapper, call.getPayload()))
                    .authHeader(firstHeader.storableValue())
                    .authTimestamp(firstHeader.getTimestamp())
                    .build());
            transactionId = tx.getId();

            Map<String, Object> initiated = new LinkedHashMap<>();
            initiated.put("order_id", orderId);
            initiated.put("amount", context.getAmountMajor());
            initiated.put("amount_minor", amountMinor);
            initiated.put("cashbox_code", context.getCashboxCode());
            auditLogger.record(AuditRecord.forTransaction(tx, AuditAction.PAYMENT_INITIATED).details(initiated).build());
            log.info("Payment initiated gateway={} transactionId={} orderId={} amount={} terminalId={} otp={}",
                    gateway, transactionId, orderId, context.getAmountMajor(), request.getTerminalId(),
                    SensitiveDataMasker.maskOtp(request.getOtpData()));

            RetryPolicy policy = RetryPolicy.of(credentials.getMaxRetryAttempts(), retryBaseDelay, retryCapDelay);
            String id = transactionId;
            GatewayResponse response;
            try {
                response = BackoffRetrier.run(gateway.name() + ":" + orderId, policy, failedAttempts -> {
                    persistence.startAttempt(id, failedAttempts);
                    AuthHeader header = failedAttempts == 0 ? firstHeader : integration.authHeader(credentials);
                    if (credentials.isLoggingEnabled()) {
                        log.debug("Gateway request transactionId={} attempt={} {} {} fields={}",
                                id, failedAttempts + 1, call.getMethod(), call.getEndpoint(),
                                call.getPayload() == null ? null : call.getPayload().keySet());
                    }
                    return gatewayClient.call(call, header, credentials.getRequestTimeoutMs());
                });
            } catch (GatewayTransportException e) {
                return exhausted(id, call, policy, e, started);
            }
            return complete(integration, credentials, id, call, response, started);
        } catch (RuntimeException e) {
            log.error("Payment failed internally gateway={} transactionId={}", gateway, transactionId, e);
            if (transactionId != null) {
                markFailedAfterError(transactionId, e);
            } else {
                auditErrorBeforeInsert(gateway, request, e);
            }
            return PaymentResult.failure("Internal error", INTERNAL_ERROR_MESSAGE, null);
        }
    }

    private PaymentResult exhausted(String transactionId, GatewayCall call, RetryPolicy policy,
                                    GatewayTransportException e, long started) {
        int attempts = policy.getMaxAttempts();
        GatewayTransactionEntity tx = persistence.failAfterRetries(transactionId, attempts, e.isTimeout(), e.getMessage());
        long processingMs = clock.millis() - started;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", e.getMessage());
        details.put("retry_count", attempts);
        details.put("timeout_occurred", e.isTimeout());
        details.put("processing_time_ms", processingMs);
        auditLogger.record(AuditRecord.forTransaction(tx, AuditAction.PAYMENT_FAILED)
                .details(details)
                .httpMethod(call.getMethod().name())
                .endpoint(call.getEndpoint())
                .responseTimeMs(e.getElapsedMs())
                .build());
        log.warn("Payment failed without gateway response transactionId={} orderId={} attempts={} timeout={}",
                transactionId, tx.getOrderId(), attempts, e.isTimeout());
        return PaymentResult.builder()
                .success(false)
                .error("Network error")
                .message("Payment request failed after " + attempts + " attempts: " + e.getMessage())
                .retryable(true)
                .data(toData(tx, processingMs, null))
                .build();
    }

    private <C extends GatewayCredentials> PaymentResult complete(GatewayIntegration<C> integration, C credentials,
                                                                 String transactionId, GatewayCall call,
                                                                 GatewayResponse response, long started) {
        if (credentials.isLoggingEnabled()) {
            log.debug("Gateway response transactionId={} httpStatus={} body={}",
                    transactionId, response.getHttpStatus(), response.getRawBody());
        }
        GatewayOutcome outcome = integration.interpret(credentials, response);
        TransactionStatus status = outcome.isSuccess() ? TransactionStatus.SUCCESS : TransactionStatus.FAILED;
        GatewayTransactionEntity tx = persistence.recordOutcome(transactionId, status, entity -> {
            entity.setGatewayPaymentId(outcome.getPaymentId());
            entity.setErrorCode(outcome.getErrorCode());
            entity.setErrorMessage(outcome.getErrorMessage());
            entity.setResponsePayload(response.getRawBody());
            entity.setClientPhoneNumber(outcome.getClientPhoneNumber());
            entity.setCardType(outcome.getCardType());
            entity.setMaskedCardNumber(outcome.getMaskedCardNumber());
            entity.setRequiresConfirmation(outcome.isRequiresConfirmation());
            entity.setPaymentUrl(outcome.getPaymentUrl());
        });
        long processingMs = clock.millis() - started;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_code", outcome.getErrorCode());
        details.put("error_message", outcome.getErrorMessage());
        details.put("payment_id", outcome.getPaymentId());
        details.put("retry_count", tx.getRetryCount());
        details.put("processing_time_ms", processingMs);
        auditLogger.record(AuditRecord.forTransaction(tx,
                        outcome.isSuccess() ? AuditAction.PAYMENT_COMPLETED : AuditAction.PAYMENT_FAILED)
                .details(details)
                .httpMethod(call.getMethod().name())
                .endpoint(call.getEndpoint())
                .responseStatus(response.getHttpStatus())
                .responseTimeMs(response.getResponseTimeMs())
                .build());

        PaymentData data = toData(tx, processingMs, outcome.getMetadata());
        if (outcome.isSuccess()) {
            log.info("Payment completed transactionId={} orderId={} paymentId={} phone={} processingMs={}",
                    transactionId, tx.getOrderId(), outcome.getPaymentId(),
                    SensitiveDataMasker.maskPhone(outcome.getClientPhoneNumber()), processingMs);
            return PaymentResult.success(data);
        }
        log.warn("Payment declined transactionId={} orderId={} errorCode={} message={}",
                transactionId, tx.getOrderId(), outcome.getErrorCode(), outcome.getErrorMessage());
        return PaymentResult.failure("Payment failed", outcome.getErrorMessage(), data);
    }

    private void auditErrorBeforeInsert(GatewayKind gateway, CreatePaymentRequest request, RuntimeException cause) {
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("stage", "before_transaction_insert");
            details.put("error", cause.getMessage());
            details.put("exception", cause.getClass().getName());
            auditLogger.record(AuditRecord.builder()
                    .gateway(gateway)
                    .action(AuditAction.ERROR_OCCURRED)
                    .details(details)
                    .employeeId(request.getEmployeeId())
                    .terminalId(request.getTerminalId())
                    .amount(request.getAmount())
                    .errorMessage(cause.getMessage())
                    .build());
        } catch (RuntimeException e) {
            log.error("Could not audit internal failure gateway={} terminalId={}", gateway, request.getTerminalId(), e);
        }
    }

    private void markFailedAfterError(String transactionId, RuntimeException cause) {
        try {
            persistence.failInternal(transactionId, cause.getMessage());
            GatewayTransactionEntity tx = persistence.findById(transactionId).orElse(null);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", cause.getMessage());
            details.put("exception", cause.getClass().getName());
            AuditRecord.AuditRecordBuilder record = tx != null
                    ? AuditRecord.forTransaction(tx, AuditAction.ERROR_OCCURRED)
                    : AuditRecord.builder().transactionId(transactionId).action(AuditAction.ERROR_OCCURRED);
            auditLogger.record(record.details(details).build());
        } catch (RuntimeException e) {
            log.error("Could not record internal failure for transactionId={}", transactionId, e);
        }
    }

    /**
     * Confirms or rejects a payment the gateway approved with
     * {@code requires_confirmation}. Rejecting runs the reversal flow.
     */
    public OperationResult confirmPayment(String transactionId, ConfirmationAction action, String employeeId) {
        GatewayTransactionEntity tx = getTransaction(transactionId);
        if (tx.getStatus() != TransactionStatus.SUCCESS || !tx.isRequiresConfirmation()) {
            log.warn("Confirmation rejected transactionId={} status={} requiresConfirmation={}",
                    transactionId, tx.getStatus(), tx.isRequiresConfirmation());
            return OperationResult.rejected("Transaction does not require confirmation");
        }
        if (action == ConfirmationAction.REJECT) {
            return reversalOrchestrator.reversePayment(tx.getOrderId(), REJECT_REASON, employeeId);
        }
        return confirm(registry.get(tx.getGateway()), tx, employeeId);
    }

    private <C extends GatewayCredentials> OperationResult confirm(GatewayIntegration<C> integration,
                                                                  GatewayTransactionEntity tx, String employeeId) {
        C credentials;
        try {
            credentials = configService.load(tx.getGateway(), integration.credentialsType());
        } catch (ConfigurationException e) {
            log.error("Confirmation aborted, gateway not configured transactionId={}: {}", tx.getId(), e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("stage", "confirmation");
            details.put("reason", "configuration");
            details.put("error", e.getMessage());
            details.put("requested_by", employeeId);
            auditLogger.record(AuditRecord.forTransaction(tx, AuditAction.ERROR_OCCURRED)
                    .details(details)
                    .errorMessage(e.getMessage())
                    .build());
            return OperationResult.rejected("Configuration error: " + e.getMessage());
        }
        try {
            return sendConfirmation(integration, credentials, tx, employeeId);
        } catch (RuntimeException e) {
            log.error("Confirmation failed internally transactionId={}", tx.getId(), e);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("stage", "confirmation");
            details.put("error", e.getMessage());
            details.put("exception", e.getClass().getName());
            auditLogger.record(AuditRecord.forTransaction(tx, AuditAction.ERROR_OCCURRED)
                    .details(details)
                    .errorMessage(e.getMessage())
                    .build());
            return OperationResult.rejected(CONFIRMATION_ERROR_MESSAGE);
        }
    }

    private <C extends GatewayCredentials> OperationResult sendConfirmation(GatewayIntegration<C> integration,
                                                                           C credentials,
                                                                           GatewayTransactionEntity tx,
                                                                           String employeeId) {
        GatewayCall call = integration.confirmationCall(credentials, tx).orElse(null);
        if (call == null) {
            return OperationResult.rejected("Confirmation is not supported by " + tx.getGateway());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", "confirm");
        details.put("requested_by", employeeId);
        AuditRecord.AuditRecordBuilder audit = AuditRecord.forTransaction(tx, AuditAction.CONFIRMATION_SENT)
                .httpMethod(call.getMethod().name())
                .endpoint(call.getEndpoint());
        try {
            GatewayResponse response = gatewayClient.call(call, integration.authHeader(credentials),
                    credentials.getRequestTimeoutMs());
            GatewayOutcome outcome = integration.interpret(credentials, response);
            details.put("success", outcome.isSuccess());
            details.put("error_code", outcome.getErrorCode());
            details.put("error_message", outcome.getErrorMessage());
            auditLogger.record(audit.details(details)
                    .responseStatus(response.getHttpStatus())
                    .responseTimeMs(response.getResponseTimeMs())
                    .build());
            if (!outcome.isSuccess()) {
                log.warn("Confirmation declined transactionId={} errorCode={}", tx.getId(), outcome.getErrorCode());
                return OperationResult.builder()
                        .success(false)
                        .error(outcome.getErrorMessage())
                        .errorCode(outcome.getErrorCode())
                        .build();
            }
            persistence.clearConfirmationFlag(tx.getId());
            log.info("Payment confirmed transactionId={} orderId={}", tx.getId(), tx.getOrderId());
            return OperationResult.ok(tx.getId());
        } catch (GatewayTransportException e) {
            details.put("success", false);
            details.put("error", e.getMessage());
            auditLogger.record(audit.details(details).responseTimeMs(e.getElapsedMs()).build());
            return OperationResult.rejected(e.getMessage());
        }
    }

    /** Links a successful payment to the POS sale it settles. Allowed once. */
    public OperationResult linkToSale(String transactionId, String posTransactionId) {
        if (posTransactionId == null || posTransactionId.isBlank()) {
            throw new PaymentValidationException("POS transaction id is required");
        }
        GatewayTransactionEntity tx = getTransaction(transactionId);
        if (!persistence.linkToSale(transactionId, posTransactionId)) {
            String reason = tx.getStatus() != TransactionStatus.SUCCESS
                    ? "Only successful payments can be linked to a sale (current status: " + tx.getStatus() + ")"
                    : "Transaction is already linked to sale " + tx.getPosTransactionId();
            log.warn("Sale link rejected transactionId={} posTransactionId={}: {}", transactionId, posTransactionId, reason);
            return OperationResult.rejected(reason);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pos_transaction_id", posTransactionId);
        auditLogger.record(AuditRecord.forTransaction(tx, AuditAction.SALE_LINKED).details(details).build());
        log.info("Payment linked to sale transactionId={} posTransactionId={}", transactionId, posTransactionId);
        return OperationResult.ok(transactionId);
    }

    /**
     * @throws TransactionNotFoundException for an unknown id
     */
    public GatewayTransactionEntity getTransaction(String transactionId) {
        return persistence.findById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction not found: " + transactionId));
    }

    public Page<GatewayTransactionEntity> listTransactions(TransactionFilter filter, int page, int size) {
        return persistence.search(filter, page, size);
    }

    public GatewayStats gatewayStats(GatewayKind gateway) {
        return persistence.stats(gateway, STATS_WINDOW);
    }

    private static void validateCommon(CreatePaymentRequest request) {
        if (request.getGateway() == null) {
            throw new PaymentValidationException("Gateway is required");
        }
        BigDecimal amount = request.getAmount();
        if (amount == null || amount.signum() <= 0) {
            throw new PaymentValidationException("Amount must be greater than zero");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new PaymentValidationException("Amount must have at most two decimal places");
        }
        if (amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            throw new PaymentValidationException("Amount is too large");
        }
        if (request.getEmployeeId() == null || request.getEmployeeId().isBlank()) {
            throw new PaymentValidationException("Employee id is required");
        }
        if (request.getTerminalId() == null || request.getTerminalId().isBlank()) {
            throw new PaymentValidationException("Terminal id is required");
        }
    }

    private static PaymentData toData(GatewayTransactionEntity tx, long processingMs, Map<String, Object> metadata) {
        return PaymentData.builder()
                .transactionId(tx.getId())
                .orderId(tx.getOrderId())
                .gatewayPaymentId(tx.getGatewayPaymentId())
                .status(tx.getStatus())
                .errorCode(tx.getErrorCode())
                .errorMessage(tx.getErrorMessage())
                .retryCount(tx.getRetryCount())
                .processingTimeMs(processingMs)
                .metadata(metadata)
                .build();
    }
}
