package com.flagship.flight_cover.exception;

import lombok.Getter;

/**
 * Machine readable error codes returned with every rejected operation.
 */
@Getter
public enum ErrorCode {
    INVALID_REQUEST(ErrorCategory.VALIDATION),
    INVALID_PREMIUM(ErrorCategory.VALIDATION),
    INVALID_SCHEDULE(ErrorCategory.VALIDATION),
    INSUFFICIENT_COVERAGE_RATIO(ErrorCategory.VALIDATION),
    INVALID_TIER(ErrorCategory.VALIDATION),

    UNAUTHORIZED(ErrorCategory.AUTHORIZATION),

    POLICY_NOT_FOUND(ErrorCategory.STATE),
    POLICY_NOT_ACTIVE(ErrorCategory.STATE),
    ALREADY_PAID(ErrorCategory.STATE),
    DELAY_BELOW_THRESHOLD(ErrorCategory.STATE),
    DEPARTURE_ALREADY_PASSED(ErrorCategory.STATE),
    DEPARTURE_NOT_PASSED(ErrorCategory.STATE),
    PAYOUT_ELIGIBLE(ErrorCategory.STATE),

    INSUFFICIENT_POOL(ErrorCategory.RESOURCE),

    TRANSFER_FAILED(ErrorCategory.TRANSFER);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }
}
