package com.rockpoint.payments.config;

import com.rockpoint.payments.core.PaymentValidationException;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.persistence.entity.GatewayConfigEntity;
import com.rockpoint.payments.persistence.repository.GatewayConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Persisted per-gateway key/value configuration with a process-local TTL cache.
 * <p>
 * The cache is only refreshed when an entry is older than
 * {@code payments.config.cache-ttl} at read time, or on {@link #reload}.
 * Writes do not invalidate it, so callers that just changed a credential see
 * the old value for up to one TTL unless they reload.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayConfigService {

    private final GatewayConfigRepository repository;
    private final CredentialCipher cipher;
    private final Clock clock;

    private final Map<GatewayKind, CachedValues> cache = new ConcurrentHashMap<>();

    @Value("${payments.config.cache-ttl:5m}")
    private Duration cacheTtl = Duration.ofMinutes(5);

    public Optional<String> get(GatewayKind gateway, String key) {
        return Optional.ofNullable(values(gateway).get(key));
    }

    /** All stored entries; encrypted values are replaced by {@link ConfigItem#ENCRYPTED_MASK}. */
    public List<ConfigItem> getAll(GatewayKind gateway) {
        return repository.findByGatewayOrderByConfigKeyAsc(gateway).stream()
                .map(e -> ConfigItem.builder()
                        .key(e.getConfigKey())
                        .value(e.isEncrypted() ? ConfigItem.ENCRYPTED_MASK : e.getConfigValue())
                        .description(e.getDescription())
                        .encrypted(e.isEncrypted())
                        .active(e.isActive())
                        .updatedAt(e.getUpdatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Upserts one key. When {@code encrypt} is null the schema decides (secrets
     * are encrypted).
     */
    @Transactional
    public void set(GatewayKind gateway, String key, String value, String description, Boolean encrypt) {
        if (key == null || key.isBlank()) {
            throw new PaymentValidationException("Config key is required");
        }
        if (value == null) {
            throw new PaymentValidationException("Config value is required for key " + key);
        }
        Optional<ConfigKeyDefinition> definition = GatewayConfigSchema.forGateway(gateway).definition(key);
        boolean encrypted = encrypt != null ? encrypt : definition.map(ConfigKeyDefinition::isSecret).orElse(false);

        GatewayConfigEntity entity = repository.findByGatewayAndConfigKey(gateway, key)
                .orElseGet(() -> GatewayConfigEntity.builder().gateway(gateway).configKey(key).build());
        entity.setConfigValue(encrypted ? cipher.encrypt(value) : value);
        entity.setEncrypted(encrypted);
        entity.setActive(true);
        if (description != null) {
            entity.setDescription(description);
        } else if (entity.getDescription() == null) {
            entity.setDescription(definition.map(ConfigKeyDefinition::getDescription).orElse(null));
        }
        repository.save(entity);
        log.info("Config updated gateway={} key={} encrypted={}", gateway, key, encrypted);
    }

    /** Validates what is stored right now, bypassing the cache. */
    public ConfigValidationResult validate(GatewayKind gateway) {
        return GatewayConfigSchema.forGateway(gateway).validate(readStore(gateway));
    }

    /**
     * Replaces the gateway's entries with the schema defaults; required keys get
     * {@link GatewayConfigSchema#PLACEHOLDER} so the gateway stays unusable until
     * real credentials are entered.
     */
    @Transactional
    public void resetToDefaults(GatewayKind gateway) {
        GatewayConfigSchema schema = GatewayConfigSchema.forGateway(gateway);
        repository.deleteAll(repository.findByGatewayOrderByConfigKeyAsc(gateway));
        repository.flush();
        for (ConfigKeyDefinition def : schema.getKeys()) {
            String value = def.isRequired() ? GatewayConfigSchema.PLACEHOLDER : def.getDefaultValue();
            repository.save(GatewayConfigEntity.builder()
                    .gateway(gateway)
                    .configKey(def.getKey())
                    .configValue(def.isSecret() ? cipher.encrypt(value) : value)
                    .description(def.getDescription())
                    .encrypted(def.isSecret())
                    .active(true)
                    .build());
        }
        log.warn("Config reset to defaults gateway={} keys={}", gateway, schema.getKeys().size());
    }

    /**
     * Typed credentials from the cache.
     *
     * @throws ConfigurationException when a required key is missing or a value does not parse
     */
    public <C extends GatewayCredentials> C load(GatewayKind gateway, Class<C> type) {
        return toCredentials(gateway, values(gateway), type);
    }

    /** Same as {@link #load} but straight from the store; the cache is left alone. */
    public <C extends GatewayCredentials> C loadUncached(GatewayKind gateway, Class<C> type) {
        return toCredentials(gateway, readStore(gateway), type);
    }

    public void reload(GatewayKind gateway) {
        cache.remove(gateway);
        values(gateway);
        log.info("Config cache reloaded gateway={}", gateway);
    }

    public Instant lastUpdated(GatewayKind gateway) {
        return repository.findLastUpdated(gateway);
    }

    private Map<String, String> values(GatewayKind gateway) {
        Instant now = clock.instant();
        CachedValues cached = cache.get(gateway);
        if (cached != null && now.isBefore(cached.loadedAt().plus(cacheTtl))) {
            return cached.values();
        }
        Map<String, String> fresh = readStore(gateway);
        cache.put(gateway, new CachedValues(fresh, now));
        log.debug("Config loaded from store gateway={} keys={}", gateway, fresh.size());
        return fresh;
    }

    private Map<String, String> readStore(GatewayKind gateway) {
        Map<String, String> stored = new LinkedHashMap<>();
        for (GatewayConfigEntity entity : repository.findByGatewayAndActiveTrue(gateway)) {
            String value = entity.getConfigValue();
            if (entity.isEncrypted()) {
                try {
                    value = cipher.decrypt(value);
                } catch (IllegalStateException e) {
                    throw new ConfigurationException(gateway, "Cannot decrypt config key " + entity.getConfigKey(), e);
                }
            }
            stored.put(entity.getConfigKey(), value);
        }
        return Collections.unmodifiableMap(GatewayConfigSchema.forGateway(gateway).withDefaults(stored));
    }

    private <C extends GatewayCredentials> C toCredentials(GatewayKind gateway, Map<String, String> values, Class<C> type) {
        GatewayConfigSchema schema = GatewayConfigSchema.forGateway(gateway);
        ConfigValidationResult validation = schema.validate(values);
        if (!validation.isValid()) {
            log.warn("Gateway not configured gateway={} missingKeys={} errors={}",
                    gateway, validation.getMissingKeys(), validation.getErrors());
            throw new ConfigurationException(gateway, describe(gateway, validation), validation.getMissingKeys());
        }
        GatewayCredentials credentials = schema.toCredentials(values);
        if (!type.isInstance(credentials)) {
            throw new IllegalArgumentException(gateway + " credentials are " + credentials.getClass().getSimpleName()
                    + ", not " + type.getSimpleName());
        }
        return type.cast(credentials);
    }

    private static String describe(GatewayKind gateway, ConfigValidationResult validation) {
        StringBuilder sb = new StringBuilder(gateway.name()).append(" configuration is incomplete");
        if (!validation.getMissingKeys().isEmpty()) {
            sb.append(": missing required keys ").append(String.join(", ", validation.getMissingKeys()));
        }
        if (!validation.getErrors().isEmpty()) {
            sb.append(validation.getMissingKeys().isEmpty() ? ": " : "; ").append(String.join("; ", validation.getErrors()));
        }
        return sb.toString();
    }

    private record CachedValues(Map<String, String> values, Instant loadedAt) {}
}
