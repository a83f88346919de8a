package com.rockpoint.payments.domain;

/**
 * Status of a follow-up operation record (reversal, fiscalization).
 */
public enum OperationStatus {
    PENDING,
    SUCCESS,
    FAILED
}
