package com.rockpoint.payments.core.http;

/**
 * Connection refused, reset, DNS failure or any other I/O error before a response arrived.
 */
public class GatewayNetworkException extends GatewayTransportException {

    public GatewayNetworkException(String message, long elapsedMs, Throwable cause) {
        super("Network error: " + message, elapsedMs, cause);
    }

    @Override
    public boolean isTimeout() {
        return false;
    }
}
