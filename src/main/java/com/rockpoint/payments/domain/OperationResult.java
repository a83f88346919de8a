package com.rockpoint.payments.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Result of a follow-up operation (reversal, fiscalization, confirmation, sale link).
 */
@Value
@Builder
public class OperationResult {

    boolean success;
    String error;
    Integer errorCode;
    /** Id of the reversal/fiscalization record, when one was written. */
    String recordId;

    public static OperationResult ok(String recordId) {
        return OperationResult.builder().success(true).recordId(recordId).build();
    }

    public static OperationResult rejected(String error) {
        return OperationResult.builder().success(false).error(error).build();
    }
}
