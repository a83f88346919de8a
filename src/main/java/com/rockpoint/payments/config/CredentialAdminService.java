package com.rockpoint.payments.config;

import com.rockpoint.payments.compliance.AuditLogger;
import com.rockpoint.payments.compliance.AuditRecord;
import com.rockpoint.payments.domain.AuditAction;
import com.rockpoint.payments.domain.GatewayKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Management operations used by the back-office credential screens.
 * Every write and validation is audited; secret values never reach the audit trail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialAdminService {

    private final GatewayConfigService configService;
    private final AuditLogger auditLogger;
    private final Environment environment;

    public List<ConfigItem> getAll(GatewayKind gateway) {
        return configService.getAll(gateway);
    }

    public void set(GatewayKind gateway, String key, String value, String description, Boolean encrypt, String updatedBy) {
        configService.set(gateway, key, value, description, encrypt);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", "set");
        details.put("key", key);
        details.put("updated_by", updatedBy);
        audit(gateway, AuditAction.CONFIG_UPDATED, details);
    }

    public ConfigValidationResult validate(GatewayKind gateway) {
        ConfigValidationResult result = configService.validate(gateway);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("valid", result.isValid());
        details.put("missing_keys", result.getMissingKeys());
        details.put("errors", result.getErrors());
        audit(gateway, AuditAction.CONFIG_VALIDATED, details);
        return result;
    }

    public void resetToDefaults(GatewayKind gateway, String updatedBy) {
        configService.resetToDefaults(gateway);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", "reset_to_defaults");
        details.put("updated_by", updatedBy);
        audit(gateway, AuditAction.CONFIG_UPDATED, details);
    }

    /** Loads typed credentials straight from the store, as a live payment would after the cache expires. */
    public ConfigValidationResult test(GatewayKind gateway) {
        try {
            configService.loadUncached(gateway, GatewayCredentials.class);
            log.info("Config test passed gateway={}", gateway);
            return ConfigValidationResult.builder().valid(true).missingKeys(List.of()).errors(List.of()).build();
        } catch (ConfigurationException e) {
            log.warn("Config test failed gateway={}: {}", gateway, e.getMessage());
            return ConfigValidationResult.builder()
                    .valid(false)
                    .missingKeys(e.getMissingKeys())
                    .errors(List.of(e.getMessage()))
                    .build();
        }
    }

    public ConfigStatus status(GatewayKind gateway) {
        ConfigValidationResult validation = configService.validate(gateway);
        return ConfigStatus.builder()
                .gateway(gateway)
                .configured(validation.isValid())
                .missingKeys(validation.getMissingKeys())
                .totalKeys(configService.getAll(gateway).size())
                .lastUpdated(configService.lastUpdated(gateway))
                .build();
    }

    /**
     * Copies values from environment variables / properties (e.g.
     * {@code UZUM_SECRET_KEY}) into the store. Keys without a value in the
     * environment keep what is stored.
     */
    public ConfigImportResult importFromEnvironment(GatewayKind gateway, String updatedBy) {
        List<String> imported = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (ConfigKeyDefinition def : GatewayConfigSchema.forGateway(gateway).getKeys()) {
            String value = environment.getProperty(def.getEnvironmentName());
            if (value == null || value.isBlank()) {
                log.debug("Environment variable {} not set, keeping stored {}", def.getEnvironmentName(), def.getKey());
                skipped.add(def.getKey());
                continue;
            }
            configService.set(gateway, def.getKey(), value, "Configuration from " + def.getEnvironmentName(), def.isSecret());
            imported.add(def.getKey());
        }
        ConfigValidationResult validation = configService.validate(gateway);
        if (!validation.isValid()) {
            log.warn("Config imported from environment is incomplete gateway={} missingKeys={} errors={}",
                    gateway, validation.getMissingKeys(), validation.getErrors());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", "import_from_environment");
        details.put("imported_keys", imported);
        details.put("updated_by", updatedBy);
        audit(gateway, AuditAction.CONFIG_UPDATED, details);
        return ConfigImportResult.builder()
                .importedKeys(imported)
                .skippedKeys(skipped)
                .validation(validation)
                .build();
    }

    public void reload(GatewayKind gateway) {
        configService.reload(gateway);
    }

    private void audit(GatewayKind gateway, AuditAction action, Map<String, Object> details) {
        auditLogger.record(AuditRecord.builder()
                .gateway(gateway)
                .action(action)
                .details(details)
                .build());
    }
}
