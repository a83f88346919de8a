package com.rockpoint.payments.config;

import com.rockpoint.payments.domain.GatewayKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Per-gateway key schema: required keys, defaults, numeric checks and the
 * factory that turns a validated key/value map into typed credentials.
 */
public final class GatewayConfigSchema {

    /** Value written for required keys by reset; treated as missing. */
    public static final String PLACEHOLDER = "PLACEHOLDER";

    private static final String DEFAULT_TIMEOUT_MS = "15000";
    private static final String DEFAULT_MAX_RETRIES = "3";

    private static final Map<GatewayKind, GatewayConfigSchema> SCHEMAS = new EnumMap<>(GatewayKind.class);

    static {
        SCHEMAS.put(GatewayKind.FAST_PAY, new GatewayConfigSchema(GatewayKind.FAST_PAY, List.of(
                required("merchant_service_user_id", "Cash register id issued by Uzum Bank", false, false, "UZUM_MERCHANT_SERVICE_USER_ID"),
                required("secret_key", "Secret key issued by Uzum Bank", true, false, "UZUM_SECRET_KEY"),
                required("service_id", "Branch/service identifier issued by Uzum Bank", false, true, "UZUM_SERVICE_ID"),
                optional("api_base_url", "https://mobile.apelsin.uz", "FastPay API base URL", false, null, "UZUM_API_BASE_URL"),
                optional("request_timeout_ms", DEFAULT_TIMEOUT_MS, "HTTP request timeout in milliseconds", true, 1000L, "UZUM_REQUEST_TIMEOUT_MS"),
                optional("cashbox_code_prefix", "RockPoint", "Prefix for cash register codes", false, null, "UZUM_CASHBOX_CODE_PREFIX"),
                optional("max_retry_attempts", DEFAULT_MAX_RETRIES, "Attempts per payment on network failure", true, 1L, "UZUM_MAX_RETRY_ATTEMPTS"),
                optional("enable_logging", "true", "Verbose payload logging", false, null, "UZUM_ENABLE_LOGGING")
        ), FastPayCredentials::from));

        SCHEMAS.put(GatewayKind.CLICK_PASS, new GatewayConfigSchema(GatewayKind.CLICK_PASS, List.of(
                required("service_id", "Service id issued by Click", false, true, "CLICK_SERVICE_ID"),
                required("merchant_id", "Merchant id issued by Click", false, true, "CLICK_MERCHANT_ID"),
                required("merchant_user_id", "Merchant user id issued by Click", false, true, "CLICK_MERCHANT_USER_ID"),
                required("secret_key", "Secret key issued by Click", true, false, "CLICK_SECRET_KEY"),
                optional("api_base_url", "https://api.click.uz", "Click API base URL", false, null, "CLICK_API_BASE_URL"),
                optional("request_timeout_ms", DEFAULT_TIMEOUT_MS, "HTTP request timeout in milliseconds", true, 1000L, "CLICK_REQUEST_TIMEOUT_MS"),
                optional("max_retry_attempts", DEFAULT_MAX_RETRIES, "Attempts per payment on network failure", true, 1L, "CLICK_MAX_RETRY_ATTEMPTS")
        ), ClickPassCredentials::from));

        SCHEMAS.put(GatewayKind.PAYME_QR, new GatewayConfigSchema(GatewayKind.PAYME_QR, List.of(
                required("cashbox_id", "Cashbox id from the Payme merchant cabinet", false, false, "PAYME_CASHBOX_ID"),
                required("key_password", "Cashbox key password", true, false, "PAYME_KEY_PASSWORD"),
                optional("api_base_url", "https://checkout.paycom.uz", "Payme API base URL", false, null, "PAYME_API_BASE_URL"),
                optional("request_timeout_ms", DEFAULT_TIMEOUT_MS, "HTTP request timeout in milliseconds", true, 1000L, "PAYME_REQUEST_TIMEOUT_MS"),
                optional("max_retry_attempts", DEFAULT_MAX_RETRIES, "Attempts per payment on network failure", true, 1L, "PAYME_MAX_RETRY_ATTEMPTS")
        ), PaymeQrCredentials::from));
    }

    private final GatewayKind gateway;
    private final List<ConfigKeyDefinition> keys;
    private final Function<Map<String, String>, ? extends GatewayCredentials> factory;

    private GatewayConfigSchema(GatewayKind gateway, List<ConfigKeyDefinition> keys,
                                Function<Map<String, String>, ? extends GatewayCredentials> factory) {
        this.gateway = gateway;
        this.keys = keys;
        this.factory = factory;
    }

    public static GatewayConfigSchema forGateway(GatewayKind gateway) {
        return SCHEMAS.get(gateway);
    }

    public GatewayKind getGateway() {
        return gateway;
    }

    public List<ConfigKeyDefinition> getKeys() {
        return keys;
    }

    public Optional<ConfigKeyDefinition> definition(String key) {
        return keys.stream().filter(k -> k.getKey().equals(key)).findFirst();
    }

    /** Stored values overlaid on the schema defaults. Unknown stored keys are kept. */
    public Map<String, String> withDefaults(Map<String, String> stored) {
        Map<String, String> merged = new LinkedHashMap<>();
        for (ConfigKeyDefinition def : keys) {
            if (def.getDefaultValue() != null) {
                merged.put(def.getKey(), def.getDefaultValue());
            }
        }
        stored.forEach((k, v) -> {
            if (v != null && !v.isBlank()) {
                merged.put(k, v);
            }
        });
        return merged;
    }

    public ConfigValidationResult validate(Map<String, String> values) {
        List<String> missing = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (ConfigKeyDefinition def : keys) {
            String value = values.get(def.getKey());
            boolean absent = value == null || value.isBlank() || PLACEHOLDER.equals(value);
            if (absent) {
                if (def.isRequired()) {
                    missing.add(def.getKey());
                }
                continue;
            }
            if (def.isNumeric()) {
                try {
                    long parsed = Long.parseLong(value.trim());
                    if (def.getMinValue() != null && parsed < def.getMinValue()) {
                        errors.add(def.getKey() + " must be a number >= " + def.getMinValue());
                    }
                } catch (NumberFormatException e) {
                    errors.add(def.getKey() + " must be a valid number");
                }
            }
        }
        return ConfigValidationResult.builder()
                .valid(missing.isEmpty() && errors.isEmpty())
                .missingKeys(Collections.unmodifiableList(missing))
                .errors(Collections.unmodifiableList(errors))
                .build();
    }

    /** Caller must have checked {@link #validate} first. */
    GatewayCredentials toCredentials(Map<String, String> values) {
        return factory.apply(values);
    }

    private static ConfigKeyDefinition required(String key, String description, boolean secret,
                                                boolean numeric, String environmentName) {
        return ConfigKeyDefinition.builder()
                .key(key)
                .required(true)
                .description(description)
                .secret(secret)
                .numeric(numeric)
                .environmentName(environmentName)
                .build();
    }

    private static ConfigKeyDefinition optional(String key, String defaultValue, String description,
                                                boolean numeric, Long minValue, String environmentName) {
        return ConfigKeyDefinition.builder()
                .key(key)
                .defaultValue(defaultValue)
                .description(description)
                .numeric(numeric)
                .minValue(minValue)
                .environmentName(environmentName)
                .build();
    }
}
