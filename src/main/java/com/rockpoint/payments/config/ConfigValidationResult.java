package com.rockpoint.payments.config;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ConfigValidationResult {

    boolean valid;
    List<String> missingKeys;
    List<String> errors;
}
