package com.rockpoint.payments.core;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Gateway response reduced to what the orchestrator needs, independent of
 * the gateway's wire format.
 */
@Value
@Builder
public class GatewayOutcome {

    boolean success;
    Integer errorCode;
    String errorMessage;
    String paymentId;
    /** Gateway's own status value (status polls). */
    String gatewayStatus;
    String clientPhoneNumber;
    String cardType;
    String maskedCardNumber;
    boolean requiresConfirmation;
    String paymentUrl;
    /** Extra response fields returned to the caller, e.g. operation_time. */
    Map<String, Object> metadata;
}
