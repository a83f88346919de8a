package com.rockpoint.payments.config;

import com.rockpoint.payments.domain.GatewayKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Summary shown on the admin screen for one gateway.
 */
@Value
@Builder
public class ConfigStatus {

    GatewayKind gateway;
    boolean configured;
    List<String> missingKeys;
    int totalKeys;
    Instant lastUpdated;
}
