package com.flagship.flight_cover.exception;

public class PolicyNotFoundException extends PolicyStateException {

    public PolicyNotFoundException(Long policyId) {
        super(ErrorCode.POLICY_NOT_FOUND, policyId, "Policy not found: " + policyId);
    }
}
