package com.flagship.flight_cover.exception;

import lombok.Getter;

/**
 * Raised when the funds transfer rail rejects a disbursement after the
 * settlement has been staged. The enclosing transaction is rolled back, so the
 * policy is left exactly as it was before the operation.
 */
@Getter
public class TransferFailedException extends PolicyException {

    private final String transferReference;

    public TransferFailedException(String transferReference, Throwable cause) {
        super(ErrorCode.TRANSFER_FAILED,
                "Funds transfer failed for " + transferReference + ": " + cause.getMessage(), cause);
        this.transferReference = transferReference;
    }
}
