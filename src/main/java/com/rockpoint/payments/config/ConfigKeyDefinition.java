package com.rockpoint.payments.config;

import lombok.Builder;
import lombok.Value;

/**
 * One key in a gateway's configuration schema.
 */
@Value
@Builder
public class ConfigKeyDefinition {

    String key;
    boolean required;
    /** Default for optional keys; null for required keys. */
    String defaultValue;
    String description;
    /** Stored encrypted and shown masked in listings. */
    boolean secret;
    boolean numeric;
    /** Lower bound for numeric keys, if any. */
    Long minValue;
    /** Environment/property name read by the import operation. */
    String environmentName;
}
