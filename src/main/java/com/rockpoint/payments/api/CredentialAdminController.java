package com.rockpoint.payments.api;

import com.rockpoint.payments.config.ConfigImportResult;
import com.rockpoint.payments.config.ConfigItem;
import com.rockpoint.payments.config.ConfigStatus;
import com.rockpoint.payments.config.ConfigValidationResult;
import com.rockpoint.payments.config.CredentialAdminService;
import com.rockpoint.payments.domain.GatewayKind;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Back-office management of gateway credentials. Encrypted values are always
 * returned masked.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/gateways/{gateway}/config")
@RequiredArgsConstructor
@Tag(name = "Gateway credentials", description = "View, update, validate and import gateway configuration")
public class CredentialAdminController {

    private final CredentialAdminService adminService;

    @GetMapping
    @Operation(summary = "List config keys", description = "Active keys ordered by name; encrypted values shown as [ENCRYPTED].")
    public ResponseEntity<List<ConfigItem>> getAll(@PathVariable GatewayKind gateway) {
        return ResponseEntity.ok(adminService.getAll(gateway));
    }

    @PutMapping("/{key}")
    @Operation(summary = "Set config key", description = "Creates or replaces one key. Cached credentials refresh after the cache TTL or on reload.")
    public ResponseEntity<Void> set(@PathVariable GatewayKind gateway, @PathVariable String key,
                                    @Valid @RequestBody ConfigUpdateRequestDto dto) {
        log.info("Config update requested gateway={} key={} updatedBy={}", gateway, key, dto.getUpdatedBy());
        adminService.set(gateway, key, dto.getValue(), dto.getDescription(), dto.getEncrypt(), dto.getUpdatedBy());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/validation")
    @Operation(summary = "Validate stored config")
    public ResponseEntity<ConfigValidationResult> validate(@PathVariable GatewayKind gateway) {
        return ResponseEntity.ok(adminService.validate(gateway));
    }

    @PostMapping("/test")
    @Operation(summary = "Test config", description = "Loads typed credentials bypassing the cache.")
    public ResponseEntity<ConfigValidationResult> test(@PathVariable GatewayKind gateway) {
        return ResponseEntity.ok(adminService.test(gateway));
    }

    @GetMapping("/status")
    @Operation(summary = "Config status")
    public ResponseEntity<ConfigStatus> status(@PathVariable GatewayKind gateway) {
        return ResponseEntity.ok(adminService.status(gateway));
    }

    @PostMapping("/reset")
    @Operation(summary = "Reset to defaults", description = "Required keys become PLACEHOLDER, optional keys get their defaults.")
    public ResponseEntity<Void> reset(@PathVariable GatewayKind gateway, @RequestParam String updatedBy) {
        adminService.resetToDefaults(gateway, updatedBy);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/import")
    @Operation(summary = "Import from environment", description = "Copies UZUM_*, CLICK_* or PAYME_* environment values into the store.")
    public ResponseEntity<ConfigImportResult> importFromEnvironment(@PathVariable GatewayKind gateway,
                                                                    @RequestParam String updatedBy) {
        return ResponseEntity.ok(adminService.importFromEnvironment(gateway, updatedBy));
    }

    @PostMapping("/reload")
    @Operation(summary = "Reload cache")
    public ResponseEntity<Void> reload(@PathVariable GatewayKind gateway) {
        adminService.reload(gateway);
        return ResponseEntity.noContent().build();
    }
}
