package com.rockpoint.payments.config;

import com.rockpoint.payments.domain.GatewayKind;

/**
 * Validated, strongly typed credentials for one gateway. Instances are only
 * produced by {@link GatewayConfigService#load} after the schema check passed.
 */
public interface GatewayCredentials {

    GatewayKind gateway();

    String getApiBaseUrl();

    int getRequestTimeoutMs();

    int getMaxRetryAttempts();

    /** Whether gateway request and response bodies may be written at debug level. */
    default boolean isLoggingEnabled() {
        return true;
    }
}
