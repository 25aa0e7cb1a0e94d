package com.flagship.flight_cover.exception;

import lombok.Getter;

/**
 * Base type for every failure raised by the cover ledger.
 */
@Getter
public abstract class PolicyException extends RuntimeException {

    private final ErrorCode code;

    protected PolicyException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected PolicyException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
