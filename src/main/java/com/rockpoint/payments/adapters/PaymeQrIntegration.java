package com.rockpoint.payments.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.rockpoint.payments.config.PaymeQrCredentials;
import com.rockpoint.payments.core.GatewayIntegration;
import com.rockpoint.payments.core.GatewayOutcome;
import com.rockpoint.payments.core.PaymentContext;
import com.rockpoint.payments.core.auth.AuthHeader;
import com.rockpoint.payments.core.auth.AuthHeaderBuilder;
import com.rockpoint.payments.core.auth.StaticCredentialAuthHeaderBuilder;
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
 * Payme merchant receipts over JSON-RPC ({@code POST {base}/api}). A created
 * receipt is shown to the customer as a QR code pointing at
 * {@code {base}/<receipt id>}. Errors come back in the {@code error} member.
 */
@Component
public class PaymeQrIntegration implements GatewayIntegration<PaymeQrCredentials> {

    private final AuthHeaderBuilder authHeaderBuilder = StaticCredentialAuthHeaderBuilder.paymeQr();
    private final Clock clock;

    public PaymeQrIntegration(Clock clock) {
        this.clock = clock;
    }

    @Override
    public GatewayKind kind() {
        return GatewayKind.PAYME_QR;
    }

    @Override
    public Class<PaymeQrCredentials> credentialsType() {
        return PaymeQrCredentials.class;
    }

    /** Receipts carry no customer payload; the shared amount and terminal checks are enough. */
    @Override
    public void validate(CreatePaymentRequest request) {
    }

    @Override
    public AuthHeader authHeader(PaymeQrCredentials credentials) {
        return authHeaderBuilder.build(credentials.getKeyPassword(), credentials.getCashboxId());
    }

    @Override
    public GatewayCall createCall(PaymeQrCredentials credentials, PaymentContext context) {
        CreatePaymentRequest request = context.getRequest();
        Map<String, Object> account = new LinkedHashMap<>();
        account.put("order_id", context.getOrderId());
        account.put("terminal_id", request.getTerminalId());
        account.put("employee_id", request.getEmployeeId());
        if (request.getAccountData() != null) {
            account.putAll(request.getAccountData());
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("amount", context.getAmountMinor());
        params.put("account", account);
        params.put("description", request.getDescription() != null
                ? request.getDescription()
                : "POS Payment - Order " + context.getOrderId());
        return rpc(credentials, "receipts.create", params);
    }

    @Override
    public GatewayCall statusCall(PaymeQrCredentials credentials, GatewayTransactionEntity transaction) {
        return rpc(credentials, "receipts.check", receiptId(transaction));
    }

    @Override
    public GatewayCall reversalCall(PaymeQrCredentials credentials, GatewayTransactionEntity transaction) {
        return rpc(credentials, "receipts.cancel", receiptId(transaction));
    }

    @Override
    public Optional<GatewayCall> fiscalizationCall(PaymeQrCredentials credentials, GatewayTransactionEntity transaction,
                                                   String fiscalUrl) {
        Map<String, Object> fiscalData = new LinkedHashMap<>();
        fiscalData.put("qr_code_url", fiscalUrl);
        fiscalData.put("terminal_id", transaction.getTerminalId());
        Map<String, Object> params = receiptId(transaction);
        params.put("fiscal_data", fiscalData);
        return Optional.of(rpc(credentials, "receipts.set_fiscal_data", params));
    }

    @Override
    public GatewayOutcome interpret(PaymeQrCredentials credentials, GatewayResponse response) {
        JsonNode body = response.getBody();
        JsonNode error = body == null ? null : body.get("error");
        if (error != null && !error.isNull()) {
            Integer code = JsonFields.integer(error, "code");
            return GatewayOutcome.builder()
                    .success(false)
                    .errorCode(code)
                    .errorMessage(errorMessage(error.get("message"), code))
                    .build();
        }
        JsonNode result = body == null ? null : body.get("result");
        if (result == null || result.isNull() || !JsonFields.is2xx(response.getHttpStatus())) {
            return GatewayOutcome.builder()
                    .success(false)
                    .errorMessage(JsonFields.unexpected(response.getHttpStatus()))
                    .build();
        }
        JsonNode receipt = result.has("receipt") ? result.get("receipt") : result;
        String receiptId = JsonFields.text(receipt, "_id");
        String state = JsonFields.text(receipt, "state");

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (state != null) {
            metadata.put("receipt_state", state);
        }
        String paymentUrl = receiptId != null ? credentials.getApiBaseUrl() + "/" + receiptId : null;
        if (paymentUrl != null) {
            metadata.put("payment_url", paymentUrl);
        }
        return GatewayOutcome.builder()
                .success(true)
                .errorCode(0)
                .paymentId(receiptId)
                .gatewayStatus(state)
                .paymentUrl(paymentUrl)
                .metadata(metadata)
                .build();
    }

    private GatewayCall rpc(PaymeQrCredentials credentials, String method, Map<String, Object> params) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", clock.millis());
        payload.put("method", method);
        payload.put("params", params);
        return GatewayCall.builder()
                .method(HttpMethod.POST)
                .endpoint(credentials.getApiBaseUrl() + "/api")
                .payload(payload)
                .build();
    }

    private static Map<String, Object> receiptId(GatewayTransactionEntity transaction) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("id", transaction.getGatewayPaymentId());
        return params;
    }

    /** Payme sends either a plain string or a per-language object. */
    private static String errorMessage(JsonNode message, Integer code) {
        if (message == null || message.isNull()) {
            return "Error code: " + code;
        }
        if (message.isTextual()) {
            return message.asText();
        }
        for (String lang : new String[]{"en", "ru", "uz"}) {
            if (message.hasNonNull(lang)) {
                return message.get(lang).asText();
            }
        }
        return message.toString();
    }
}
