package com.rockpoint.payments.config;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ConfigImportResult {

    List<String> importedKeys;
    List<String> skippedKeys;
    ConfigValidationResult validation;
}
