package com.rockpoint.payments.domain;

/**
 * Cashier's answer to a payment the gateway flagged as requiring confirmation.
 */
public enum ConfirmationAction {
    CONFIRM,
    /** Handled as a reversal of the already-approved payment. */
    REJECT
}
