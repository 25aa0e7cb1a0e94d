package com.flagship.flight_cover.transfer;

import java.math.BigDecimal;

/**
 * Outbound rail that delivers payouts, refunds and withdrawals out of the pool.
 *
 * Implementations must treat {@code reference} as an idempotency key: a second
 * call with a reference that was already delivered must not move funds again.
 * References are deterministic ({@code payout-<policyId>}, {@code refund-<policyId>},
 * {@code withdrawal-<caller key>}), so a retry after an ambiguous failure cannot pay twice.
 */
public interface FundsTransferGateway {

    /**
     * Delivers {@code amount} to {@code recipient}.
     *
     * @throws FundsTransferException if the funds were not delivered
     */
    void transfer(String recipient, BigDecimal amount, String reference) throws FundsTransferException;
}
