package com.rockpoint.payments.core.http;

import com.rockpoint.payments.core.auth.AuthHeader;

/**
 * Performs a single signed request. Retries live in the orchestrator so the
 * attempt count is visible on the transaction row and in the audit trail.
 */
public interface GatewayClient {

    /**
     * @return the gateway's response, whatever its HTTP status
     * @throws GatewayTimeoutException no response within {@code timeoutMs}
     * @throws GatewayNetworkException any other failure before a response arrived
     */
    GatewayResponse call(GatewayCall call, AuthHeader authHeader, int timeoutMs);
}
