package com.rockpoint.payments.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rockpoint.payments.domain.PaymentData;
import com.rockpoint.payments.domain.PaymentResult;
import lombok.Builder;
import lombok.Value;

/**
 * REST response for a create-payment call. Declines are 200 with {@code success=false}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentResponseDto {

    boolean success;
    PaymentData data;
    String error;
    String message;
    boolean retryable;

    public static PaymentResponseDto from(PaymentResult result) {
        if (result == null) {
            throw new IllegalArgumentException("PaymentResult cannot be null");
        }
        return PaymentResponseDto.builder()
                .success(result.isSuccess())
                .data(result.getData())
                .error(result.getError())
                .message(result.getMessage())
                .retryable(result.isRetryable())
                .build();
    }
}
