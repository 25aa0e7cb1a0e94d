package com.flagship.flight_cover.observability;

import com.flagship.flight_cover.ledger.LedgerAccountingService;
import com.flagship.flight_cover.ledger.LedgerTotals;
import com.flagship.flight_cover.ledger.PoolLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Refreshes the gauges that need database queries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final PolicyMetrics policyMetrics;
    private final PoolLedgerService poolLedger;
    private final LedgerAccountingService accountingService;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshMetrics() {
        outboxMetrics.refreshMetrics();
        refreshPoolMetrics();
    }

    void refreshPoolMetrics() {
        try {
            BigDecimal balance = poolLedger.getBalance();
            LedgerTotals totals = accountingService.getTotals();
            policyMetrics.updatePoolGauges(balance, totals.getPremiumsCollected(), totals.getPayoutsProcessed());
        } catch (Exception e) {
            log.warn("Failed to refresh pool metrics: {}", e.getMessage());
        }
    }
}
