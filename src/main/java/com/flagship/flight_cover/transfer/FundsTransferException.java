package com.flagship.flight_cover.transfer;

/**
 * Signals that the transfer rail did not deliver the funds.
 */
public class FundsTransferException extends Exception {

    public FundsTransferException(String message) {
        super(message);
    }

    public FundsTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
