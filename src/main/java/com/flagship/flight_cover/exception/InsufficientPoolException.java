package com.flagship.flight_cover.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Raised when the pooled balance cannot cover a payout, refund or withdrawal.
 * Nothing has been changed when this is thrown.
 */
@Getter
public class InsufficientPoolException extends PolicyException {

    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientPoolException(BigDecimal requested, BigDecimal available) {
        super(ErrorCode.INSUFFICIENT_POOL,
                String.format("Pooled balance %s cannot cover %s", available, requested));
        this.requested = requested;
        this.available = available;
    }
}
