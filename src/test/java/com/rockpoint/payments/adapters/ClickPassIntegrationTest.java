package com.rockpoint.payments.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rockpoint.payments.config.ClickPassCredentials;
import com.rockpoint.payments.core.GatewayOutcome;
import com.rockpoint.payments.core.PaymentValidationException;
import com.rockpoint.payments.core.http.GatewayCall;
import com.rockpoint.payments.core.http.GatewayResponse;
import com.rockpoint.payments.domain.CreatePaymentRequest;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import java.math.BigDecimal;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClickPassIntegrationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ClickPassIntegration integration = new ClickPassIntegration(Clock.systemUTC());

    private final ClickPassCredentials credentials = ClickPassCredentials.builder()
            .serviceId(11)
            .merchantId(22)
            .merchantUserId(33)
            .secretKey("k")
            .apiBaseUrl("https://click.test")
            .requestTimeoutMs(15000)
            .maxRetryAttempts(3)
            .build();

    private static CreatePaymentRequest request(String otp) {
        return CreatePaymentRequest.builder()
                .gateway(GatewayKind.CLICK_PASS)
                .amount(new BigDecimal("10.00"))
                .otpData(otp)
                .employeeId("emp-7")
                .terminalId("T01")
                .build();
    }

    private GatewayResponse response(String json) throws Exception {
        return GatewayResponse.builder().httpStatus(200).body(objectMapper.readTree(json)).rawBody(json).build();
    }

    @Test
    void shortOtpIsAcceptedButEmptyIsNot() {
        assertThatCode(() -> integration.validate(request("123456"))).doesNotThrowAnyException();
        assertThatThrownBy(() -> integration.validate(request(" ")))
                .isInstanceOf(PaymentValidationException.class)
                .hasMessage("OTP data is required");
        assertThatThrownBy(() -> integration.validate(request("9".repeat(501))))
                .isInstanceOf(PaymentValidationException.class);
    }

    @Test
    void cashboxCodeDefaultsToTerminal() {
        assertThat(integration.cashboxCode(credentials, request("123456"))).isEqualTo("T01");
    }

    @Test
    void confirmationFlagIsSurfaced() throws Exception {
        GatewayOutcome outcome = integration.interpret(credentials, response(
                "{\"error_code\":0,\"payment_id\":\"555\",\"payment_status\":1,\"requires_confirmation\":true,"
                        + "\"card_type\":\"UZCARD\",\"masked_card_number\":\"8600****1234\"}"));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isRequiresConfirmation()).isTrue();
        assertThat(outcome.getPaymentId()).isEqualTo("555");
        assertThat(outcome.getCardType()).isEqualTo("UZCARD");
        assertThat(outcome.getMaskedCardNumber()).isEqualTo("8600****1234");
        assertThat(outcome.getMetadata()).containsEntry("requires_confirmation", true);
    }

    @Test
    void errorNoteIsPreferredForDeclines() throws Exception {
        GatewayOutcome outcome = integration.interpret(credentials,
                response("{\"error_code\":-5017,\"error_note\":\"Card blocked\",\"error_message\":\"generic\"}"));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getErrorCode()).isEqualTo(-5017);
        assertThat(outcome.getErrorMessage()).isEqualTo("Card blocked");
    }

    @Test
    void statusAndReversalAddressThePaymentInThePath() {
        GatewayTransactionEntity tx = GatewayTransactionEntity.builder().gatewayPaymentId("555").build();

        GatewayCall status = integration.statusCall(credentials, tx);
        GatewayCall reversal = integration.reversalCall(credentials, tx);

        assertThat(status.getMethod()).isEqualTo(HttpMethod.GET);
        assertThat(status.getEndpoint()).isEqualTo("https://click.test/v2/merchant/payment/status/11/555");
        assertThat(reversal.getMethod()).isEqualTo(HttpMethod.DELETE);
        assertThat(reversal.getEndpoint()).isEqualTo("https://click.test/v2/merchant/payment/reversal/11/555");
        assertThat(integration.fiscalizationCall(credentials, tx, "https://ofd.test")).isEmpty();
        assertThat(integration.confirmationCall(credentials, tx)).isPresent();
    }
}
