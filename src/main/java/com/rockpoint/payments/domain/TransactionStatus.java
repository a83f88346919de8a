package com.rockpoint.payments.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a gateway payment attempt. The allowed moves form a
 * forward-only table; every status write goes through {@link #canTransitionTo}.
 * <pre>
 * PENDING    -> PROCESSING | FAILED
 * PROCESSING -> SUCCESS | FAILED
 * SUCCESS    -> REVERSED
 * </pre>
 */
public enum TransactionStatus {
    /** Row written, gateway not called yet. */
    PENDING,
    /** Gateway call in flight (possibly being retried). */
    PROCESSING,
    /** Gateway confirmed the money movement. */
    SUCCESS,
    /** Declined, exhausted retries, or failed internally. */
    FAILED,
    /** Successful payment cancelled by the merchant. */
    REVERSED;

    public Set<TransactionStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(PROCESSING, FAILED);
            case PROCESSING:
                return EnumSet.of(SUCCESS, FAILED);
            case SUCCESS:
                return EnumSet.of(REVERSED);
            default:
                return Collections.emptySet();
        }
    }

    public boolean canTransitionTo(TransactionStatus next) {
        return next != null && allowedNext().contains(next);
    }
}
