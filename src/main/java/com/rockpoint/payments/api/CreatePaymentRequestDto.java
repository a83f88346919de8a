package com.rockpoint.payments.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Map;

/**
 * REST request body for creating a QR/OTP payment. The gateway comes from the path.
 */
@Data
public class CreatePaymentRequestDto {

    /** Amount in UZS, at most two decimals. */
    @NotNull(message = "amount is required")
    @DecimalMin(value = "0.01", message = "amount must be greater than zero")
    @Digits(integer = 16, fraction = 2, message = "amount must have at most 16 integer digits and two decimal places")
    private BigDecimal amount;

    /** Scanned QR/OTP payload; required by FAST_PAY and CLICK_PASS. */
    @Size(max = 500, message = "otpData must be at most 500 characters")
    private String otpData;

    @NotBlank(message = "employeeId is required")
    private String employeeId;

    @NotBlank(message = "terminalId is required")
    private String terminalId;

    private String cashboxCode;
    private String description;
    private Map<String, Object> accountData;
}
