package com.rockpoint.payments.config;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Listing view of a stored config entry. Encrypted values are never returned.
 */
@Value
@Builder
public class ConfigItem {

    public static final String ENCRYPTED_MASK = "[ENCRYPTED]";

    String key;
    String value;
    String description;
    boolean encrypted;
    boolean active;
    Instant updatedAt;
}
