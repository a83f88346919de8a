package com.rockpoint.payments.core;

import com.rockpoint.payments.domain.TransactionStatus;
import lombok.Getter;

/**
 * A status write that is either not in the transition table or lost the
 * conditional update to a concurrent writer.
 */
@Getter
public class InvalidStatusTransitionException extends PaymentGatewayException {

    private final TransactionStatus from;
    private final TransactionStatus to;

    public InvalidStatusTransitionException(String transactionId, TransactionStatus from, TransactionStatus to) {
        super("Transaction " + transactionId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }
}
