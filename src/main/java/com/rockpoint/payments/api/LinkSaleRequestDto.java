package com.rockpoint.payments.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LinkSaleRequestDto {

    @NotBlank(message = "posTransactionId is required")
    private String posTransactionId;
}
