package com.flagship.flight_cover.exception;

/**
 * Broad classes of failure a cover operation can report to its caller.
 *
 * None of them are retried by the service itself; whether and when to retry
 * is the caller's decision.
 */
public enum ErrorCategory {
    /**
     * Bad input. Rejected before any state change; retry with corrected input.
     */
    VALIDATION,

    /**
     * Caller identity is not allowed to perform the operation.
     */
    AUTHORIZATION,

    /**
     * The policy is not in a state that allows the operation.
     * Re-read the policy before retrying.
     */
    STATE,

    /**
     * The pooled balance cannot cover the movement. Retryable once funded.
     */
    RESOURCE,

    /**
     * Funds transfer failed after the state change was staged.
     * The staged change is rolled back.
     */
    TRANSFER
}
