package com.flagship.flight_cover.ledger;

import com.flagship.flight_cover.ledger.dto.PoolFundsRequest;
import com.flagship.flight_cover.ledger.dto.PoolSummaryResponse;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Pool queries and authority funding operations.
 */
@RestController
@RequestMapping("/api/pool")
@RequiredArgsConstructor
public class PoolController {

    private static final String CALLER_HEADER = "X-Caller-Id";
    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PoolLedgerService poolLedger;
    private final LedgerAccountingService accountingService;
    private final PoolFundingService fundingService;

    @GetMapping
    public PoolSummaryResponse getPool() {
        return PoolSummaryResponse.of(poolLedger.getBalance(), accountingService.getTotals());
    }

    @PostMapping("/deposits")
    public PoolSummaryResponse deposit(@Valid @RequestBody PoolFundsRequest request,
                                       @RequestHeader(CALLER_HEADER) String caller) {
        BigDecimal balance = fundingService.depositFunds(request.getAmount(), caller);
        return PoolSummaryResponse.of(balance, accountingService.getTotals());
    }

    /**
     * Requires {@code Idempotency-Key}; a replay with the same key moves no funds.
     */
    @PostMapping("/withdrawals")
    public PoolSummaryResponse withdraw(@Valid @RequestBody PoolFundsRequest request,
                                        @RequestHeader(CALLER_HEADER) String caller,
                                        @RequestHeader(IDEMPOTENCY_KEY_HEADER) String withdrawalKey) {
        BigDecimal balance = fundingService.withdrawExcess(request.getAmount(), caller, withdrawalKey);
        return PoolSummaryResponse.of(balance, accountingService.getTotals());
    }
}
