package com.rockpoint.payments.core.auth;

import lombok.Builder;
import lombok.Value;

/**
 * Authentication header for one gateway request. Built fresh for every
 * request and never reused across requests.
 */
@Value
@Builder
public class AuthHeader {

    String headerName;
    String value;
    /** Timestamp that went into the digest; null for static credential headers. */
    Long timestamp;
    String digest;
    /** True when {@link #value} contains the raw secret and must not be stored verbatim. */
    boolean carriesSecret;

    /** Value safe to persist on the transaction row. */
    public String storableValue() {
        if (!carriesSecret || value == null) {
            return value;
        }
        int sep = value.indexOf(':');
        return sep < 0 ? "***" : value.substring(0, sep + 1) + "***";
    }
}
