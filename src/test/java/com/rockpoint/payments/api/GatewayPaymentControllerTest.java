package com.rockpoint.payments.api;

import com.rockpoint.payments.core.PaymentFollowUpService;
import com.rockpoint.payments.core.PaymentOrchestrator;
import com.rockpoint.payments.core.ReversalOrchestrator;
import com.rockpoint.payments.core.TransactionNotFoundException;
import com.rockpoint.payments.domain.ConfirmationAction;
import com.rockpoint.payments.domain.CreatePaymentRequest;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.domain.OperationResult;
import com.rockpoint.payments.domain.PaymentData;
import com.rockpoint.payments.domain.PaymentResult;
import com.rockpoint.payments.domain.TransactionStatus;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * MockMvc tests for the terminal-facing payment endpoints.
 */
@WebMvcTest(controllers = GatewayPaymentController.class)
class GatewayPaymentControllerTest {

    private static final String CREATE_BODY = """
            {
              "amount": 500.00,
              "otpData": "%s",
              "employeeId": "emp-7",
              "terminalId": "T01"
            }
            """.formatted("Q".repeat(40));

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PaymentOrchestrator orchestrator;

    @MockitoBean
    private ReversalOrchestrator reversalOrchestrator;

    @MockitoBean
    private PaymentFollowUpService followUpService;

    @Test
    void createReturnsOkWithReconciliationData() throws Exception {
        when(orchestrator.createPayment(any())).thenReturn(PaymentResult.success(PaymentData.builder()
                .transactionId("tx-1")
                .orderId("RP_1_AAAAAA")
                .gatewayPaymentId("pay-77")
                .status(TransactionStatus.SUCCESS)
                .build()));

        mockMvc.perform(post("/api/v1/payments/FAST_PAY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.orderId").value("RP_1_AAAAAA"))
                .andExpect(jsonPath("$.data.status").value("SUCCESS"))
                .andExpect(jsonPath("$.error").doesNotExist());

        ArgumentCaptor<CreatePaymentRequest> request = ArgumentCaptor.forClass(CreatePaymentRequest.class);
        verify(orchestrator).createPayment(request.capture());
        assertThat(request.getValue().getGateway()).isEqualTo(GatewayKind.FAST_PAY);
        assertThat(request.getValue().getAmount()).isEqualByComparingTo("500.00");
    }

    @Test
    void declineIsStillOk() throws Exception {
        when(orchestrator.createPayment(any())).thenReturn(PaymentResult.failure("Payment failed", "Insufficient funds",
                PaymentData.builder().transactionId("tx-1").status(TransactionStatus.FAILED).errorCode(-12).build()));

        mockMvc.perform(post("/api/v1/payments/FAST_PAY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Insufficient funds"))
                .andExpect(jsonPath("$.data.errorCode").value(-12));
    }

    @Test
    void orchestratorValidationErrorIsBadRequest() throws Exception {
        when(orchestrator.createPayment(any()))
                .thenReturn(PaymentResult.invalid("Validation error", "QR code data is too short (minimum 40 characters)"));

        mockMvc.perform(post("/api/v1/payments/FAST_PAY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void unconfiguredGatewayIsServerError() throws Exception {
        when(orchestrator.createPayment(any())).thenReturn(
                PaymentResult.failure(PaymentResult.CONFIGURATION_ERROR, "FAST_PAY configuration is incomplete", null));

        mockMvc.perform(post("/api/v1/payments/FAST_PAY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Configuration error"));
    }

    @Test
    void missingFieldsAreRejectedBeforeOrchestrator() throws Exception {
        mockMvc.perform(post("/api/v1/payments/FAST_PAY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 0, \"terminalId\": \"T01\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.employeeId").value("employeeId is required"))
                .andExpect(jsonPath("$.details.amount").exists());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void unknownGatewayIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/payments/VISA")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void reversalDelegatesWithOrderId() throws Exception {
        when(reversalOrchestrator.reversePayment("RP_1_AAAAAA", "changed mind", "emp-7"))
                .thenReturn(OperationResult.ok("rev-1"));

        mockMvc.perform(post("/api/v1/payments/orders/RP_1_AAAAAA/reversal")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"changed mind\", \"requestedBy\": \"emp-7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.recordId").value("rev-1"));
    }

    @Test
    void unknownOrderIsNotFound() throws Exception {
        when(reversalOrchestrator.reversePayment(any(), any(), any()))
                .thenThrow(new TransactionNotFoundException("Transaction not found for order nope"));

        mockMvc.perform(post("/api/v1/payments/orders/nope/reversal")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"requestedBy\": \"emp-7\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void confirmationPassesAction() throws Exception {
        when(orchestrator.confirmPayment("tx-1", ConfirmationAction.REJECT, "emp-7"))
                .thenReturn(OperationResult.ok("rev-2"));

        mockMvc.perform(post("/api/v1/payments/transactions/tx-1/confirmation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\": \"REJECT\", \"employeeId\": \"emp-7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recordId").value("rev-2"));
    }

    @Test
    void transactionViewMasksPhone() throws Exception {
        when(orchestrator.getTransaction("tx-1")).thenReturn(GatewayTransactionEntity.builder()
                .id("tx-1")
                .gateway(GatewayKind.FAST_PAY)
                .orderId("RP_1_AAAAAA")
                .amountMinor(50000)
                .amountMajor(new BigDecimal("500.00"))
                .status(TransactionStatus.SUCCESS)
                .employeeId("emp-7")
                .terminalId("T01")
                .clientPhoneNumber("998901234567")
                .initiatedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build());

        mockMvc.perform(get("/api/v1/payments/transactions/tx-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orderId").value("RP_1_AAAAAA"))
                .andExpect(jsonPath("$.clientPhoneNumber").value("9989***67"));
    }

    @Test
    void unexpectedErrorHidesInternalDetails() throws Exception {
        when(orchestrator.getTransaction("tx-1"))
                .thenThrow(new DataAccessResourceFailureException("jdbc:postgresql://db-host:5432/payments refused"));

        mockMvc.perform(get("/api/v1/payments/transactions/tx-1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value(GlobalExceptionHandler.INTERNAL_ERROR_MESSAGE))
                .andExpect(content().string(not(containsString("db-host"))));
    }

    @Test
    void amountBeyondSixteenIntegerDigitsIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/payments/FAST_PAY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY.replace("500.00", "100000000000000000")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.amount").exists());

        verifyNoInteractions(orchestrator);
    }
}
