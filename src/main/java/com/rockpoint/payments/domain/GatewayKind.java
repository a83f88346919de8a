package com.rockpoint.payments.domain;

/**
 * Wallet/QR payment gateways the POS backend integrates with. Each kind has
 * its own credential schema (see {@link com.rockpoint.payments.config.GatewayConfigSchema})
 * and its own merchant order id prefix.
 */
public enum GatewayKind {
    /** Uzum Bank FastPay: customer presents a bank app QR/OTP code. */
    FAST_PAY("RP"),
    /** Click Pass: card-network QR/OTP code from the Click app. */
    CLICK_PASS("CLICK"),
    /** Payme: merchant-side QR receipt paid from the Payme wallet. */
    PAYME_QR("PAYME");

    private final String orderIdPrefix;

    GatewayKind(String orderIdPrefix) {
        this.orderIdPrefix = orderIdPrefix;
    }

    public String getOrderIdPrefix() {
        return orderIdPrefix;
    }
}
