package com.rockpoint.payments.core;

import com.rockpoint.payments.config.GatewayCredentials;
import com.rockpoint.payments.core.auth.AuthHeader;
import com.rockpoint.payments.core.http.GatewayCall;
import com.rockpoint.payments.core.http.GatewayResponse;
import com.rockpoint.payments.domain.CreatePaymentRequest;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;

import java.util.Optional;

/**
 * Wire-level contract of one gateway: input rules, signing, endpoints,
 * payloads and response interpretation. The shared envelope (identifiers,
 * retries, persistence, audit) lives in {@link PaymentOrchestrator}.
 *
 * @param <C> credentials type loaded from the config store
 */
public interface GatewayIntegration<C extends GatewayCredentials> {

    GatewayKind kind();

    Class<C> credentialsType();

    /**
     * Gateway-specific input checks, run before any database or network work.
     *
     * @throws PaymentValidationException on the first violated rule
     */
    void validate(CreatePaymentRequest request);

    /** A fresh header; never cached across requests. */
    AuthHeader authHeader(C credentials);

    default String cashboxCode(C credentials, CreatePaymentRequest request) {
        return request.getCashboxCode();
    }

    GatewayCall createCall(C credentials, PaymentContext context);

    GatewayCall statusCall(C credentials, GatewayTransactionEntity transaction);

    GatewayCall reversalCall(C credentials, GatewayTransactionEntity transaction);

    /** Empty when the gateway has no fiscal endpoint. */
    default Optional<GatewayCall> fiscalizationCall(C credentials, GatewayTransactionEntity transaction, String fiscalUrl) {
        return Optional.empty();
    }

    /** Empty when the gateway never asks the terminal to confirm. */
    default Optional<GatewayCall> confirmationCall(C credentials, GatewayTransactionEntity transaction) {
        return Optional.empty();
    }

    GatewayOutcome interpret(C credentials, GatewayResponse response);
}
