package com.rockpoint.payments.api;

import com.rockpoint.payments.domain.ConfirmationAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ConfirmationRequestDto {

    @NotNull(message = "action is required")
    private ConfirmationAction action;

    @NotBlank(message = "employeeId is required")
    private String employeeId;
}
