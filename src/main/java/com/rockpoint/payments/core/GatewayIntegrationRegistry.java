package com.rockpoint.payments.core;

import com.rockpoint.payments.domain.GatewayKind;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the {@link GatewayIntegration} bean for a {@link GatewayKind}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayIntegrationRegistry {

    private final List<GatewayIntegration<?>> integrations;

    private Map<GatewayKind, GatewayIntegration<?>> byKind;

    @PostConstruct
    void init() {
        Map<GatewayKind, GatewayIntegration<?>> map = new EnumMap<>(GatewayKind.class);
        for (GatewayIntegration<?> integration : integrations) {
            GatewayIntegration<?> previous = map.put(integration.kind(), integration);
            if (previous != null) {
                throw new IllegalStateException("Two integrations registered for " + integration.kind() + ": "
                        + previous.getClass().getSimpleName() + ", " + integration.getClass().getSimpleName());
            }
        }
        byKind = map;
        log.info("Registered gateway integrations: {}", byKind.keySet());
    }

    /**
     * @throws PaymentValidationException when no integration is registered for {@code kind}
     */
    public GatewayIntegration<?> get(GatewayKind kind) {
        GatewayIntegration<?> integration = kind == null ? null : byKind.get(kind);
        if (integration == null) {
            throw new PaymentValidationException("Unsupported gateway: " + kind);
        }
        return integration;
    }
}
