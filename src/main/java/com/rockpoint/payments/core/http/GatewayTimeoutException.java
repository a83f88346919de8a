package com.rockpoint.payments.core.http;

/**
 * The gateway did not answer within the per-call timeout.
 */
public class GatewayTimeoutException extends GatewayTransportException {

    public GatewayTimeoutException(long timeoutMs, long elapsedMs, Throwable cause) {
        super("Request timeout after " + timeoutMs + "ms", elapsedMs, cause);
    }

    @Override
    public boolean isTimeout() {
        return true;
    }
}
