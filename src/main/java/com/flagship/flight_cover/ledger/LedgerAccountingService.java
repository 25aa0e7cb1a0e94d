package com.flagship.flight_cover.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only aggregate view over the pool journal.
 *
 * Totals are derived from committed journal lines only, so they always equal
 * the sum of the individually committed premiums and payouts.
 */
@Service
@RequiredArgsConstructor
public class LedgerAccountingService {

    private final PoolLedgerService poolLedger;

    @Transactional(readOnly = true)
    public LedgerTotals getTotals() {
        return new LedgerTotals(
            poolLedger.sumByType(PoolEntryType.PREMIUM),
            poolLedger.sumByType(PoolEntryType.PAYOUT)
        );
    }
}
