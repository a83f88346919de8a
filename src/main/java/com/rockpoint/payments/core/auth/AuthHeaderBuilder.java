package com.rockpoint.payments.core.auth;

/**
 * Gateway-specific signing scheme.
 */
public interface AuthHeaderBuilder {

    /**
     * @param secret    shared secret or key password from the gateway credentials
     * @param principal merchant user / cashbox identifier that prefixes the header
     */
    AuthHeader build(String secret, String principal);
}
