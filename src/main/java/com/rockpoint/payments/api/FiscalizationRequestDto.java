package com.rockpoint.payments.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class FiscalizationRequestDto {

    /** Link to the fiscal receipt issued by the cash register. */
    @NotBlank(message = "fiscalUrl is required")
    @Size(max = 1000)
    private String fiscalUrl;
}
