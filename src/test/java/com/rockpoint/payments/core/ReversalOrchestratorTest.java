package com.rockpoint.payments.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rockpoint.payments.adapters.FastPayIntegration;
import com.rockpoint.payments.compliance.AuditLogger;
import com.rockpoint.payments.compliance.AuditRecord;
import com.rockpoint.payments.config.ConfigurationException;
import com.rockpoint.payments.config.FastPayCredentials;
import com.rockpoint.payments.config.GatewayConfigService;
import com.rockpoint.payments.core.http.GatewayCall;
import com.rockpoint.payments.core.http.GatewayClient;
import com.rockpoint.payments.core.http.GatewayNetworkException;
import com.rockpoint.payments.core.http.GatewayResponse;
import com.rockpoint.payments.domain.AuditAction;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.domain.OperationResult;
import com.rockpoint.payments.domain.OperationStatus;
import com.rockpoint.payments.domain.TransactionStatus;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import com.rockpoint.payments.persistence.entity.ReversalEntity;
import com.rockpoint.payments.persistence.service.TransactionPersistenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpMethod;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReversalOrchestratorTest {

    private static final String ORDER_ID = "RP_1772359200000_ABC123";

    @Mock private GatewayConfigService configService;
    @Mock private GatewayClient gatewayClient;
    @Mock private TransactionPersistenceService persistence;
    @Mock private AuditLogger auditLogger;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ReversalOrchestrator reversalOrchestrator;

    @BeforeEach
    void setUp() {
        GatewayIntegrationRegistry registry = new GatewayIntegrationRegistry(
                List.of(new FastPayIntegration(Clock.systemUTC())));
        registry.init();
        reversalOrchestrator = new ReversalOrchestrator(registry, configService, gatewayClient, persistence,
                auditLogger, objectMapper);
    }

    private static GatewayTransactionEntity transaction(TransactionStatus status) {
        return GatewayTransactionEntity.builder()
                .id("tx-1")
                .gateway(GatewayKind.FAST_PAY)
                .orderId(ORDER_ID)
                .gatewayPaymentId("pay-77")
                .amountMinor(50000)
                .amountMajor(new BigDecimal("500.00"))
                .status(status)
                .employeeId("emp-7")
                .terminalId("T01")
                .build();
    }

    private void givenGatewayReady(GatewayTransactionEntity tx) {
        givenConfigured(tx);
        when(persistence.openReversal(eq(tx), any(), any(), any()))
                .thenReturn(Optional.of(ReversalEntity.builder().id("rev-1").transactionId(tx.getId()).build()));
    }

    private void givenConfigured(GatewayTransactionEntity tx) {
        when(persistence.findByOrderId(ORDER_ID)).thenReturn(Optional.of(tx));
        when(configService.load(GatewayKind.FAST_PAY, FastPayCredentials.class)).thenReturn(FastPayCredentials.builder()
                .merchantServiceUserId("merchant-1")
                .secretKey("s3cret")
                .serviceId(101)
                .apiBaseUrl("https://fastpay.test")
                .requestTimeoutMs(15000)
                .cashboxCodePrefix("RockPoint")
                .maxRetryAttempts(3)
                .build());
    }

    private GatewayResponse response(String json) throws Exception {
        return GatewayResponse.builder()
                .httpStatus(200)
                .body(objectMapper.readTree(json))
                .rawBody(json)
                .responseTimeMs(80)
                .build();
    }

    @Test
    void successfulReversalMarksTransactionReversed() throws Exception {
        GatewayTransactionEntity tx = transaction(TransactionStatus.SUCCESS);
        givenGatewayReady(tx);
        when(gatewayClient.call(any(), any(), eq(15000))).thenReturn(response("{\"error_code\":0}"));
        when(persistence.markReversed("tx-1")).thenReturn(true);

        OperationResult result = reversalOrchestrator.reversePayment(ORDER_ID, "Customer changed mind", "emp-7");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRecordId()).isEqualTo("rev-1");

        ArgumentCaptor<GatewayCall> call = ArgumentCaptor.forClass(GatewayCall.class);
        verify(gatewayClient, times(1)).call(call.capture(), any(), eq(15000));
        assertThat(call.getValue().getMethod()).isEqualTo(HttpMethod.PUT);
        assertThat(call.getValue().getEndpoint()).endsWith("/v2/payment/reversal/" + ORDER_ID);
        assertThat(call.getValue().getPayload()).containsEntry("payment_id", "pay-77");

        verify(persistence).completeReversal("rev-1", OperationStatus.SUCCESS, 0, null, "{\"error_code\":0}");
        ArgumentCaptor<AuditRecord> audit = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditLogger).record(audit.capture());
        assertThat(audit.getValue().getAction()).isEqualTo(AuditAction.REVERSAL_REQUESTED);
        assertThat(audit.getValue().getStatus()).isEqualTo(TransactionStatus.REVERSED);
    }

    @Test
    void declinedReversalLeavesTransactionSuccessful() throws Exception {
        GatewayTransactionEntity tx = transaction(TransactionStatus.SUCCESS);
        givenGatewayReady(tx);
        when(gatewayClient.call(any(), any(), eq(15000)))
                .thenReturn(response("{\"error_code\":-31,\"error_message\":\"Reversal period expired\"}"));

        OperationResult result = reversalOrchestrator.reversePayment(ORDER_ID, "late", "emp-7");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(-31);
        assertThat(result.getError()).isEqualTo("Reversal period expired");
        verify(persistence, never()).markReversed(any());
        verify(persistence).completeReversal(eq("rev-1"), eq(OperationStatus.FAILED), eq(-31),
                eq("Reversal period expired"), any());
    }

    @Test
    void lostRaceIsReportedAsConcurrentChange() throws Exception {
        GatewayTransactionEntity tx = transaction(TransactionStatus.SUCCESS);
        givenGatewayReady(tx);
        when(gatewayClient.call(any(), any(), eq(15000))).thenReturn(response("{\"error_code\":0}"));
        when(persistence.markReversed("tx-1")).thenReturn(false);

        OperationResult result = reversalOrchestrator.reversePayment(ORDER_ID, "dup", "emp-7");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo(ReversalOrchestrator.CONCURRENT_CHANGE);
    }

    @Test
    void networkFailureIsNotRetried() {
        GatewayTransactionEntity tx = transaction(TransactionStatus.SUCCESS);
        givenGatewayReady(tx);
        when(gatewayClient.call(any(), any(), eq(15000)))
                .thenThrow(new GatewayNetworkException("Connection refused", 3, null));

        OperationResult result = reversalOrchestrator.reversePayment(ORDER_ID, "test", "emp-7");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Network error: Connection refused");
        verify(gatewayClient, times(1)).call(any(), any(), eq(15000));
        verify(persistence).completeReversal("rev-1", OperationStatus.FAILED, null, "Network error: Connection refused", null);
        verify(persistence, never()).markReversed(any());
    }

    @Test
    void reversalAlreadyOnRecordIsNotSentAgain() {
        GatewayTransactionEntity tx = transaction(TransactionStatus.SUCCESS);
        givenConfigured(tx);
        when(persistence.openReversal(eq(tx), any(), any(), any())).thenReturn(Optional.empty());

        OperationResult result = reversalOrchestrator.reversePayment(ORDER_ID, "again", "emp-7");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo(ReversalOrchestrator.ALREADY_REVERSING);
        verifyNoInteractions(gatewayClient);
        verify(persistence, never()).completeReversal(any(), any(), any(), any(), any());
        ArgumentCaptor<AuditRecord> audit = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditLogger).record(audit.capture());
        assertThat(audit.getValue().getAction()).isEqualTo(AuditAction.ERROR_OCCURRED);
    }

    @Test
    void concurrentInsertIsTreatedAsReversalInProgress() {
        GatewayTransactionEntity tx = transaction(TransactionStatus.SUCCESS);
        givenConfigured(tx);
        when(persistence.openReversal(eq(tx), any(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("uk_reversal_transaction"));

        OperationResult result = reversalOrchestrator.reversePayment(ORDER_ID, "again", "emp-7");

        assertThat(result.getError()).isEqualTo(ReversalOrchestrator.ALREADY_REVERSING);
        verifyNoInteractions(gatewayClient);
    }

    @Test
    void storeFailureAfterGatewayReplyMarksReversalFailed() throws Exception {
        GatewayTransactionEntity tx = transaction(TransactionStatus.SUCCESS);
        givenGatewayReady(tx);
        when(gatewayClient.call(any(), any(), eq(15000))).thenReturn(response("{\"error_code\":0}"));
        when(persistence.completeReversal(any(), any(), any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"))
                .thenReturn(null);

        OperationResult result = reversalOrchestrator.reversePayment(ORDER_ID, "customer", "emp-7");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo(ReversalOrchestrator.INTERNAL_ERROR_MESSAGE);
        assertThat(result.getRecordId()).isEqualTo("rev-1");
        verify(persistence).completeReversal("rev-1", OperationStatus.FAILED, 500, "connection reset", null);
        verify(persistence, never()).markReversed(any());
        ArgumentCaptor<AuditRecord> audit = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditLogger).record(audit.capture());
        assertThat(audit.getValue().getAction()).isEqualTo(AuditAction.ERROR_OCCURRED);
        assertThat(audit.getValue().getDetails()).containsEntry("reversal_id", "rev-1");
    }

    @Test
    void missingConfigurationIsAudited() {
        GatewayTransactionEntity tx = transaction(TransactionStatus.SUCCESS);
        when(persistence.findByOrderId(ORDER_ID)).thenReturn(Optional.of(tx));
        when(configService.load(GatewayKind.FAST_PAY, FastPayCredentials.class))
                .thenThrow(new ConfigurationException(GatewayKind.FAST_PAY, "Missing keys", List.of("secret_key")));

        OperationResult result = reversalOrchestrator.reversePayment(ORDER_ID, "customer", "emp-7");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).startsWith("Configuration error");
        verify(persistence, never()).openReversal(any(), any(), any(), any());
        ArgumentCaptor<AuditRecord> audit = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditLogger).record(audit.capture());
        assertThat(audit.getValue().getAction()).isEqualTo(AuditAction.ERROR_OCCURRED);
    }

    @Test
    void nonSuccessfulTransactionIsRejectedWithoutNetworkCall() {
        for (TransactionStatus status : List.of(TransactionStatus.PENDING, TransactionStatus.FAILED, TransactionStatus.REVERSED)) {
            when(persistence.findByOrderId(ORDER_ID)).thenReturn(Optional.of(transaction(status)));

            OperationResult result = reversalOrchestrator.reversePayment(ORDER_ID, "test", "emp-7");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).contains(status.name());
        }
        verifyNoInteractions(gatewayClient, configService);
        verify(persistence, never()).openReversal(any(), any(), any(), any());
    }

    @Test
    void unknownOrderThrows() {
        when(persistence.findByOrderId("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reversalOrchestrator.reversePayment("nope", "x", "emp-7"))
                .isInstanceOf(TransactionNotFoundException.class);
    }
}
