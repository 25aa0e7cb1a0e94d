package com.flagship.flight_cover.ledger;

import com.flagship.flight_cover.auth.AuthorityPolicy;
import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.PolicyValidationException;
import com.flagship.flight_cover.exception.TransferFailedException;
import com.flagship.flight_cover.observability.PolicyMetrics;
import com.flagship.flight_cover.transfer.FundsTransferException;
import com.flagship.flight_cover.transfer.FundsTransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Administrative funding of the pool: top-ups and withdrawal of excess funds.
 * Both are reserved to the authority.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolFundingService {

    private static final int MAX_KEY_LENGTH = 128;

    private final PoolLedgerService poolLedger;
    private final AuthorityPolicy authorityPolicy;
    private final FundsTransferGateway transferGateway;
    private final PolicyMetrics policyMetrics;

    /**
     * Adds funds to the pool.
     *
     * @return the new pooled balance
     */
    @Transactional
    public BigDecimal depositFunds(BigDecimal amount, String caller) {
        authorityPolicy.requireAuthority(caller, "deposit pool funds");
        requirePositive(amount);

        poolLedger.credit(PoolEntryType.DEPOSIT, null, amount, "Authority deposit");
        policyMetrics.recordPoolMovement(PoolEntryType.DEPOSIT.name());

        BigDecimal balance = poolLedger.getBalance();
        log.info("Pool funded: amount={}, balance={}", amount, balance);
        return balance;
    }

    /**
     * Withdraws funds from the pool to the authority.
     *
     * {@code withdrawalKey} makes the withdrawal replay-safe: the transfer
     * reference is {@code withdrawal-<key>}, and a second call with the same key
     * and amount returns the current balance without moving funds again.
     *
     * @return the new pooled balance
     * @throws com.flagship.flight_cover.exception.InsufficientPoolException if amount exceeds the balance
     * @throws PolicyValidationException if the key is missing or was used for a different amount
     * @throws TransferFailedException if the transfer rail refuses the withdrawal; nothing is recorded
     */
    @Transactional
    public BigDecimal withdrawExcess(BigDecimal amount, String caller, String withdrawalKey) {
        authorityPolicy.requireAuthority(caller, "withdraw pool funds");
        requirePositive(amount);
        if (withdrawalKey == null || withdrawalKey.isBlank() || withdrawalKey.length() > MAX_KEY_LENGTH) {
            throw new PolicyValidationException(ErrorCode.INVALID_REQUEST,
                "Withdrawal key is required and at most " + MAX_KEY_LENGTH + " characters");
        }

        String reference = "withdrawal-" + withdrawalKey;
        poolLedger.lockPool();
        Optional<PoolEntry> earlier = poolLedger.findByTransferReference(reference);
        if (earlier.isPresent()) {
            if (earlier.get().getAmount().compareTo(amount) != 0) {
                throw new PolicyValidationException(ErrorCode.INVALID_REQUEST,
                    String.format("Withdrawal key %s was already used for %s", withdrawalKey,
                        earlier.get().getAmount()));
            }
            log.info("Withdrawal replayed, no funds moved: reference={}, amount={}", reference, amount);
            return poolLedger.getBalance();
        }

        poolLedger.debit(PoolEntryType.WITHDRAWAL, null, amount, "Authority withdrawal", reference);

        try {
            transferGateway.transfer(authorityPolicy.getIdentity(), amount, reference);
        } catch (FundsTransferException e) {
            policyMetrics.recordTransferFailure("withdraw");
            log.error("Withdrawal transfer failed, rolling back: reference={}, amount={}", reference, amount, e);
            throw new TransferFailedException(reference, e);
        }
        policyMetrics.recordPoolMovement(PoolEntryType.WITHDRAWAL.name());

        BigDecimal balance = poolLedger.getBalance();
        log.info("Pool withdrawal: amount={}, balance={}, reference={}", amount, balance, reference);
        return balance;
    }

    private void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new PolicyValidationException(ErrorCode.INVALID_REQUEST, "Amount must be positive");
        }
    }
}
