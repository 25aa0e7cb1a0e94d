package com.flagship.flight_cover.exception;

import lombok.Getter;

/**
 * Raised when a policy exists but its current state rejects the operation.
 */
@Getter
public class PolicyStateException extends PolicyException {

    private final Long policyId;

    public PolicyStateException(ErrorCode code, Long policyId, String message) {
        super(code, message);
        if (code.getCategory() != ErrorCategory.STATE) {
            throw new IllegalArgumentException("Not a state error code: " + code);
        }
        this.policyId = policyId;
    }
}
