package com.flagship.flight_cover.exception;

import lombok.Getter;

@Getter
public class UnauthorizedCallerException extends PolicyException {

    private final String caller;
    private final String operation;

    public UnauthorizedCallerException(String caller, String operation) {
        super(ErrorCode.UNAUTHORIZED,
                String.format("Caller '%s' is not allowed to %s", caller, operation));
        this.caller = caller;
        this.operation = operation;
    }
}
