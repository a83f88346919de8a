package com.rockpoint.payments.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ReversalRequestDto {

    @Size(max = 500)
    private String reason;

    @NotBlank(message = "requestedBy is required")
    private String requestedBy;
}
