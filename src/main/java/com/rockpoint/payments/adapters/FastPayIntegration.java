package com.rockpoint.payments.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.rockpoint.payments.config.FastPayCredentials;
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
 * Uzum Bank FastPay (Apelsin merchant API v2). The customer shows a QR code in
 * the bank app; the cashier scans it and we debit the account with it.
 * <p>
 * Success is {@code error_code == 0}. Amounts are sent in tiyin.
 */
@Component
public class FastPayIntegration implements GatewayIntegration<FastPayCredentials> {

    static final int MIN_OTP_LENGTH = 40;
    static final int MAX_OTP_LENGTH = 500;

    private static final String API_PATH = "/api/apelsin-pay/merchant";

    private final AuthHeaderBuilder authHeaderBuilder;

    public FastPayIntegration(Clock clock) {
        this.authHeaderBuilder = TimestampDigestAuthHeaderBuilder.fastPay(clock);
    }

    @Override
    public GatewayKind kind() {
        return GatewayKind.FAST_PAY;
    }

    @Override
    public Class<FastPayCredentials> credentialsType() {
        return FastPayCredentials.class;
    }

    @Override
    public void validate(CreatePaymentRequest request) {
        String otp = request.getOtpData();
        if (otp == null || otp.isBlank()) {
            throw new PaymentValidationException("QR code data is required");
        }
        if (otp.length() < MIN_OTP_LENGTH) {
            throw new PaymentValidationException("QR code data is too short (minimum " + MIN_OTP_LENGTH + " characters)");
        }
        if (otp.length() > MAX_OTP_LENGTH) {
            throw new PaymentValidationException("QR code data is too long (maximum " + MAX_OTP_LENGTH + " characters)");
        }
    }

    @Override
    public AuthHeader authHeader(FastPayCredentials credentials) {
        return authHeaderBuilder.build(credentials.getSecretKey(), credentials.getMerchantServiceUserId());
    }

    /** {@code <cashbox_code_prefix>_<terminal_id>} unless the terminal sent its own. */
    @Override
    public String cashboxCode(FastPayCredentials credentials, CreatePaymentRequest request) {
        if (request.getCashboxCode() != null && !request.getCashboxCode().isBlank()) {
            return request.getCashboxCode();
        }
        return credentials.getCashboxCodePrefix() + "_" + request.getTerminalId();
    }

    @Override
    public GatewayCall createCall(FastPayCredentials credentials, PaymentContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("amount", context.getAmountMinor());
        payload.put("cashbox_code", context.getCashboxCode());
        payload.put("otp_data", context.getRequest().getOtpData());
        payload.put("order_id", context.getOrderId());
        payload.put("transaction_id", context.getGatewayTransactionId());
        payload.put("service_id", credentials.getServiceId());
        return post(credentials.getApiBaseUrl() + API_PATH + "/v2/payment", payload);
    }

    @Override
    public GatewayCall statusCall(FastPayCredentials credentials, GatewayTransactionEntity transaction) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("payment_id", transaction.getGatewayPaymentId());
        payload.put("service_id", credentials.getServiceId());
        return post(credentials.getApiBaseUrl() + API_PATH + "/payment/status", payload);
    }

    @Override
    public GatewayCall reversalCall(FastPayCredentials credentials, GatewayTransactionEntity transaction) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service_id", credentials.getServiceId());
        payload.put("payment_id", transaction.getGatewayPaymentId());
        return GatewayCall.builder()
                .method(HttpMethod.PUT)
                .endpoint(credentials.getApiBaseUrl() + API_PATH + "/v2/payment/reversal/" + transaction.getOrderId())
                .payload(payload)
                .build();
    }

    @Override
    public Optional<GatewayCall> fiscalizationCall(FastPayCredentials credentials, GatewayTransactionEntity transaction,
                                                   String fiscalUrl) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("payment_id", transaction.getGatewayPaymentId());
        payload.put("service_id", credentials.getServiceId());
        payload.put("fiscal_url", fiscalUrl);
        return Optional.of(post(credentials.getApiBaseUrl() + API_PATH + "/payment/fiscal", payload));
    }

    @Override
    public GatewayOutcome interpret(FastPayCredentials credentials, GatewayResponse response) {
        JsonNode body = response.getBody();
        Integer code = JsonFields.integer(body, "error_code");
        if (code == null) {
            return GatewayOutcome.builder()
                    .success(false)
                    .errorMessage(JsonFields.unexpected(response.getHttpStatus()))
                    .build();
        }
        boolean success = code == 0 && JsonFields.is2xx(response.getHttpStatus());
        String message = JsonFields.text(body, "error_message");
        Map<String, Object> metadata = new LinkedHashMap<>();
        String operationTime = JsonFields.text(body, "operation_time");
        if (operationTime != null) {
            metadata.put("operation_time", operationTime);
        }
        return GatewayOutcome.builder()
                .success(success)
                .errorCode(code)
                .errorMessage(success ? null : (message != null ? message : "Error code: " + code))
                .paymentId(JsonFields.text(body, "payment_id"))
                .gatewayStatus(JsonFields.text(body, "payment_status"))
                .clientPhoneNumber(JsonFields.text(body, "client_phone_number"))
                .metadata(metadata)
                .build();
    }

    private static GatewayCall post(String endpoint, Map<String, Object> payload) {
        return GatewayCall.builder().method(HttpMethod.POST).endpoint(endpoint).payload(payload).build();
    }
}
