package com.rockpoint.payments.domain;

/**
 * Action tags written to the append-only audit trail.
 */
public enum AuditAction {
    PAYMENT_INITIATED("payment_initiated"),
    PAYMENT_FAILED("payment_failed"),
    PAYMENT_COMPLETED("payment_completed"),
    STATUS_CHECKED("status_checked"),
    REVERSAL_REQUESTED("reversal_requested"),
    FISCALIZATION_SENT("fiscalization_sent"),
    CONFIRMATION_SENT("confirmation_sent"),
    SALE_LINKED("sale_linked"),
    CONFIG_UPDATED("config_updated"),
    CONFIG_VALIDATED("config_validated"),
    ERROR_OCCURRED("error_occurred");

    private final String tag;

    AuditAction(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /** Actions that are also published to the payment events topic. */
    public boolean isLifecycleEvent() {
        return this == PAYMENT_COMPLETED || this == PAYMENT_FAILED
                || this == REVERSAL_REQUESTED || this == FISCALIZATION_SENT;
    }
}
