package com.rockpoint.payments.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Body for setting one gateway config key. {@code encrypt} defaults to the
 * key's schema flag when omitted.
 */
@Data
public class ConfigUpdateRequestDto {

    @NotNull(message = "value is required")
    private String value;

    private String description;

    private Boolean encrypt;

    @NotBlank(message = "updatedBy is required")
    private String updatedBy;
}
