package com.rockpoint.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Canonical create-payment request handed to the orchestrator by the REST
 * layer after bean validation. Gateway-specific checks (e.g. minimum QR
 * payload length) happen in the gateway integration.
 */
@Value
@Builder
public class CreatePaymentRequest {

    GatewayKind gateway;

    /** Amount in major units (UZS), at most two decimals. */
    BigDecimal amount;

    /** Scanned QR/OTP payload. Not used by receipt-style gateways. */
    String otpData;

    String employeeId;

    String terminalId;

    /** Overrides the generated cashbox code where the gateway allows it. */
    String cashboxCode;

    /** Free-text receipt description (receipt-style gateways). */
    String description;

    /** Extra account fields forwarded to receipt-style gateways. */
    Map<String, Object> accountData;
}
