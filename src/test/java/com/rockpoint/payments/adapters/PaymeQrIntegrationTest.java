package com.rockpoint.payments.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rockpoint.payments.config.PaymeQrCredentials;
import com.rockpoint.payments.core.GatewayOutcome;
import com.rockpoint.payments.core.PaymentContext;
import com.rockpoint.payments.core.auth.AuthHeader;
import com.rockpoint.payments.core.http.GatewayCall;
import com.rockpoint.payments.core.http.GatewayResponse;
import com.rockpoint.payments.domain.CreatePaymentRequest;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PaymeQrIntegrationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PaymeQrIntegration integration =
            new PaymeQrIntegration(Clock.fixed(Instant.ofEpochMilli(1772359200000L), ZoneOffset.UTC));

    private final PaymeQrCredentials credentials = PaymeQrCredentials.builder()
            .cashboxId("cashbox-9")
            .keyPassword("pw")
            .apiBaseUrl("https://payme.test")
            .requestTimeoutMs(15000)
            .maxRetryAttempts(3)
            .build();

    private GatewayResponse response(String json) throws Exception {
        return GatewayResponse.builder().httpStatus(200).body(objectMapper.readTree(json)).rawBody(json).build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void receiptCarriesOrderAndTerminalInAccount() {
        CreatePaymentRequest request = CreatePaymentRequest.builder()
                .gateway(GatewayKind.PAYME_QR)
                .amount(new BigDecimal("120.50"))
                .employeeId("emp-7")
                .terminalId("T01")
                .accountData(Map.of("phone", "998901234567"))
                .build();
        PaymentContext context = PaymentContext.builder()
                .request(request)
                .orderId("RP_1_AAAAAA")
                .gatewayTransactionId("tx-1")
                .amountMinor(12050)
                .amountMajor(new BigDecimal("120.50"))
                .build();

        GatewayCall call = integration.createCall(credentials, context);

        assertThat(call.getEndpoint()).isEqualTo("https://payme.test/api");
        assertThat(call.getPayload())
                .containsEntry("id", 1772359200000L)
                .containsEntry("method", "receipts.create");
        Map<String, Object> params = (Map<String, Object>) call.getPayload().get("params");
        assertThat(params).containsEntry("amount", 12050L)
                .containsEntry("description", "POS Payment - Order RP_1_AAAAAA");
        assertThat((Map<String, Object>) params.get("account"))
                .containsEntry("order_id", "RP_1_AAAAAA")
                .containsEntry("terminal_id", "T01")
                .containsEntry("phone", "998901234567");
    }

    @Test
    void authHeaderIsMaskedForStorage() {
        AuthHeader header = integration.authHeader(credentials);

        assertThat(header.getHeaderName()).isEqualTo("X-Auth");
        assertThat(header.getValue()).isEqualTo("cashbox-9:pw");
        assertThat(header.storableValue()).isEqualTo("cashbox-9:***");
    }

    @Test
    void createdReceiptYieldsPaymentUrl() throws Exception {
        GatewayOutcome outcome = integration.interpret(credentials,
                response("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"receipt\":{\"_id\":\"rcpt-1\",\"state\":0}}}"));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getPaymentId()).isEqualTo("rcpt-1");
        assertThat(outcome.getPaymentUrl()).isEqualTo("https://payme.test/rcpt-1");
        assertThat(outcome.getGatewayStatus()).isEqualTo("0");
    }

    @Test
    void localizedErrorMessageIsPicked() throws Exception {
        GatewayOutcome outcome = integration.interpret(credentials, response(
                "{\"error\":{\"code\":-31001,\"message\":{\"ru\":\"Неверная сумма\",\"en\":\"Invalid amount\"}}}"));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getErrorCode()).isEqualTo(-31001);
        assertThat(outcome.getErrorMessage()).isEqualTo("Invalid amount");
    }

    @Test
    @SuppressWarnings("unchecked")
    void fiscalDataIsAttachedToReceipt() {
        GatewayTransactionEntity tx = GatewayTransactionEntity.builder()
                .gatewayPaymentId("rcpt-1").terminalId("T01").build();

        GatewayCall call = integration.fiscalizationCall(credentials, tx, "https://ofd.test/check").orElseThrow();

        assertThat(call.getPayload()).containsEntry("method", "receipts.set_fiscal_data");
        Map<String, Object> params = (Map<String, Object>) call.getPayload().get("params");
        assertThat(params).containsEntry("id", "rcpt-1");
        assertThat((Map<String, Object>) params.get("fiscal_data")).containsEntry("qr_code_url", "https://ofd.test/check");
    }
}
