package com.rockpoint.payments.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.rockpoint.payments.config.ClickPassCredentials;
import com.rockpoint.payments.core.GatewayIntegration;
import com.rockpoint.payments.core.GatewayOutcome;
import com.rockpoint.payments.core.PaymentContext;
import com.rockpoint.payments.core.PaymentValidationException;
import com.rockpoint.payments.core.auth.AuthHeader;
import com.rockpoint.payments.core.auth.AuthHeaderBuilder;
import com.rockpoint.payments.core.auth.TimestampDigestAuthHeaderBuilder;
import com.rockpoint.payments.core.http.GatewayCall;
import com.rockpoint.payments.core.http.GatewayResponse;
import com.rockpoint.payments.domain.CreatePaymentRequest;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Click Pass. Card-backed QR from the Click app; some payments come back with
 * {@code requires_confirmation} and must be confirmed or rejected at the terminal.
 * No fiscal endpoint.
 */
@Component
public class ClickPassIntegration implements GatewayIntegration<ClickPassCredentials> {

    static final int MAX_OTP_LENGTH = 500;

    private final AuthHeaderBuilder authHeaderBuilder;

    public ClickPassIntegration(Clock clock) {
        this.authHeaderBuilder = TimestampDigestAuthHeaderBuilder.clickPass(clock);
    }

    @Override
    public GatewayKind kind() {
        return GatewayKind.CLICK_PASS;
    }

    @Override
    public Class<ClickPassCredentials> credentialsType() {
        return ClickPassCredentials.class;
    }

    @Override
    public void validate(CreatePaymentRequest request) {
        String otp = request.getOtpData();
        if (otp == null || otp.isBlank()) {
            throw new PaymentValidationException("OTP data is required");
        }
        if (otp.length() > MAX_OTP_LENGTH) {
            throw new PaymentValidationException("OTP data is too long (maximum " + MAX_OTP_LENGTH + " characters)");
        }
    }

    @Override
    public AuthHeader authHeader(ClickPassCredentials credentials) {
        return authHeaderBuilder.build(credentials.getSecretKey(), String.valueOf(credentials.getMerchantUserId()));
    }

    @Override
    public String cashboxCode(ClickPassCredentials credentials, CreatePaymentRequest request) {
        if (request.getCashboxCode() != null && !request.getCashboxCode().isBlank()) {
            return request.getCashboxCode();
        }
        return request.getTerminalId();
    }

    @Override
    public GatewayCall createCall(ClickPassCredentials credentials, PaymentContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service_id", credentials.getServiceId());
        payload.put("otp_data", context.getRequest().getOtpData());
        payload.put("amount", context.getAmountMinor());
        payload.put("cashbox_code", context.getCashboxCode());
        payload.put("transaction_id", context.getGatewayTransactionId());
        return GatewayCall.builder()
                .method(HttpMethod.POST)
                .endpoint(credentials.getApiBaseUrl() + "/v2/merchant/click_pass/payment")
                .payload(payload)
                .build();
    }

    @Override
    public GatewayCall statusCall(ClickPassCredentials credentials, GatewayTransactionEntity transaction) {
        return GatewayCall.builder()
                .method(HttpMethod.GET)
                .endpoint(credentials.getApiBaseUrl() + "/v2/merchant/payment/status/"
                        + credentials.getServiceId() + "/" + transaction.getGatewayPaymentId())
                .build();
    }

    @Override
    public GatewayCall reversalCall(ClickPassCredentials credentials, GatewayTransactionEntity transaction) {
        return GatewayCall.builder()
                .method(HttpMethod.DELETE)
                .endpoint(credentials.getApiBaseUrl() + "/v2/merchant/payment/reversal/"
                        + credentials.getServiceId() + "/" + transaction.getGatewayPaymentId())
                .build();
    }

    @Override
    public Optional<GatewayCall> confirmationCall(ClickPassCredentials credentials, GatewayTransactionEntity transaction) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service_id", credentials.getServiceId());
        payload.put("payment_id", transaction.getGatewayPaymentId());
        return Optional.of(GatewayCall.builder()
                .method(HttpMethod.POST)
                .endpoint(credentials.getApiBaseUrl() + "/v2/merchant/click_pass/confirm")
                .payload(payload)
                .build());
    }

    @Override
    public GatewayOutcome interpret(ClickPassCredentials credentials, GatewayResponse response) {
        JsonNode body = response.getBody();
        Integer code = JsonFields.integer(body, "error_code");
        if (code == null) {
            return GatewayOutcome.builder()
                    .success(false)
                    .errorMessage(JsonFields.unexpected(response.getHttpStatus()))
                    .build();
        }
        boolean success = code == 0 && JsonFields.is2xx(response.getHttpStatus());
        String message = JsonFields.text(body, "error_note");
        if (message == null) {
            message = JsonFields.text(body, "error_message");
        }
        String paymentStatus = JsonFields.text(body, "payment_status");
        String cardType = JsonFields.text(body, "card_type");
        String maskedCard = JsonFields.text(body, "masked_card_number");
        boolean requiresConfirmation = JsonFields.flag(body, "requires_confirmation");

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (paymentStatus != null) {
            metadata.put("payment_status", paymentStatus);
        }
        if (cardType != null) {
            metadata.put("card_type", cardType);
        }
        if (maskedCard != null) {
            metadata.put("masked_card_number", maskedCard);
        }
        metadata.put("requires_confirmation", requiresConfirmation);

        return GatewayOutcome.builder()
                .success(success)
                .errorCode(code)
                .errorMessage(success ? null : (message != null ? message : "Error code: " + code))
                .paymentId(JsonFields.text(body, "payment_id"))
                .gatewayStatus(paymentStatus)
                .cardType(cardType)
                .maskedCardNumber(maskedCard)
                .requiresConfirmation(requiresConfirmation)
                .metadata(metadata)
                .build();
    }
}
