package com.flagship.flight_cover.exception;

/**
 * Raised for malformed input: non-positive premium, departure not in the future,
 * coverage ratio below 2x, malformed tier.
 */
public class PolicyValidationException extends PolicyException {

    public PolicyValidationException(ErrorCode code, String message) {
        super(code, message);
        if (code.getCategory() != ErrorCategory.VALIDATION) {
            throw new IllegalArgumentException("Not a validation error code: " + code);
        }
    }
}
