package com.rockpoint.payments.config;

import com.rockpoint.payments.compliance.AuditLogger;
import com.rockpoint.payments.compliance.AuditRecord;
import com.rockpoint.payments.domain.AuditAction;
import com.rockpoint.payments.domain.GatewayKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.env.MockEnvironment;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialAdminServiceTest {

    @Mock private GatewayConfigService configService;
    @Mock private AuditLogger auditLogger;

    private MockEnvironment environment;
    private CredentialAdminService adminService;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        adminService = new CredentialAdminService(configService, auditLogger, environment);
    }

    private static ConfigValidationResult valid() {
        return ConfigValidationResult.builder().valid(true).missingKeys(List.of()).errors(List.of()).build();
    }

    @Test
    void setIsAuditedWithoutTheValue() {
        adminService.set(GatewayKind.CLICK_PASS, "secret_key", "s3cret", null, null, "admin-1");

        verify(configService).set(GatewayKind.CLICK_PASS, "secret_key", "s3cret", null, null);
        ArgumentCaptor<AuditRecord> audit = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditLogger).record(audit.capture());
        assertThat(audit.getValue().getAction()).isEqualTo(AuditAction.CONFIG_UPDATED);
        assertThat(audit.getValue().getDetails())
                .containsEntry("key", "secret_key")
                .containsEntry("updated_by", "admin-1")
                .doesNotContainValue("s3cret");
    }

    @Test
    void importCopiesOnlyVariablesThatAreSet() {
        environment.setProperty("PAYME_CASHBOX_ID", "cashbox-9");
        environment.setProperty("PAYME_KEY_PASSWORD", "pw");
        environment.setProperty("PAYME_REQUEST_TIMEOUT_MS", " ");
        when(configService.validate(GatewayKind.PAYME_QR)).thenReturn(valid());

        ConfigImportResult result = adminService.importFromEnvironment(GatewayKind.PAYME_QR, "admin-1");

        assertThat(result.getImportedKeys()).containsExactly("cashbox_id", "key_password");
        assertThat(result.getSkippedKeys()).containsExactly("api_base_url", "request_timeout_ms", "max_retry_attempts");
        assertThat(result.getValidation().isValid()).isTrue();
        verify(configService).set(GatewayKind.PAYME_QR, "cashbox_id", "cashbox-9",
                "Configuration from PAYME_CASHBOX_ID", false);
        verify(configService).set(GatewayKind.PAYME_QR, "key_password", "pw",
                "Configuration from PAYME_KEY_PASSWORD", true);
        verify(auditLogger).record(any());
    }

    @Test
    void importWithNothingSetStillReportsValidation() {
        ConfigValidationResult incomplete = ConfigValidationResult.builder()
                .valid(false).missingKeys(List.of("cashbox_id", "key_password")).errors(List.of()).build();
        when(configService.validate(GatewayKind.PAYME_QR)).thenReturn(incomplete);

        ConfigImportResult result = adminService.importFromEnvironment(GatewayKind.PAYME_QR, "admin-1");

        assertThat(result.getImportedKeys()).isEmpty();
        assertThat(result.getValidation().getMissingKeys()).containsExactly("cashbox_id", "key_password");
        verify(configService, never()).set(any(), anyString(), anyString(), anyString(), anyBoolean());
    }

    @Test
    void testReportsConfigurationProblemsInsteadOfThrowing() {
        when(configService.loadUncached(GatewayKind.FAST_PAY, GatewayCredentials.class))
                .thenThrow(new ConfigurationException(GatewayKind.FAST_PAY,
                        "FAST_PAY configuration is incomplete: missing required keys secret_key", List.of("secret_key")));

        ConfigValidationResult result = adminService.test(GatewayKind.FAST_PAY);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getMissingKeys()).containsExactly("secret_key");
        assertThat(result.getErrors()).singleElement().asString().contains("secret_key");
    }

    @Test
    void validationIsAudited() {
        when(configService.validate(GatewayKind.FAST_PAY)).thenReturn(valid());

        assertThat(adminService.validate(GatewayKind.FAST_PAY).isValid()).isTrue();

        ArgumentCaptor<AuditRecord> audit = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditLogger).record(audit.capture());
        assertThat(audit.getValue().getAction()).isEqualTo(AuditAction.CONFIG_VALIDATED);
        assertThat(audit.getValue().getDetails()).containsEntry("valid", true);
    }

    @Test
    void statusCombinesValidationAndStoredKeys() {
        when(configService.validate(GatewayKind.FAST_PAY)).thenReturn(valid());
        when(configService.getAll(GatewayKind.FAST_PAY)).thenReturn(List.of(
                ConfigItem.builder().key("secret_key").value(ConfigItem.ENCRYPTED_MASK).encrypted(true).active(true).build(),
                ConfigItem.builder().key("service_id").value("101").active(true).build()));

        ConfigStatus status = adminService.status(GatewayKind.FAST_PAY);

        assertThat(status.isConfigured()).isTrue();
        assertThat(status.getTotalKeys()).isEqualTo(2);
        verify(auditLogger, never()).record(any());
        verify(configService, never()).set(eq(GatewayKind.FAST_PAY), any(), any(), any(), any());
    }
}
