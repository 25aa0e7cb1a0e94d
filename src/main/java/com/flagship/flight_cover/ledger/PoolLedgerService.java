package com.flagship.flight_cover.ledger;

import com.flagship.flight_cover.exception.InsufficientPoolException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The pooled balance, kept as an append-only journal of movements.
 *
 * Invariants:
 * 1. The balance is derived from the journal, never stored.
 * 2. Entries are never updated or deleted (also enforced by a database trigger).
 * 3. Every debit locks the single pool row first, so check-then-debit is atomic
 *    across concurrent settlements; the lock is held until the caller's
 *    transaction ends.
 *
 * Writes must join the caller's transaction so a movement commits or rolls
 * back together with the policy transition that caused it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolLedgerService {

    private static final int POOL_ID = 1;

    private static final String INFLOW_TYPES = PoolEntryType.inflows().stream()
            .map(type -> "'" + type.name() + "'")
            .collect(Collectors.joining(", "));

    private static final String BALANCE_SQL =
            "SELECT COALESCE(SUM(CASE WHEN entry_type IN (" + INFLOW_TYPES + ") " +
            "THEN amount ELSE -amount END), 0) FROM pool_entries";

    private static final String ENTRY_COLUMNS =
            "SELECT id, policy_id, entry_type, amount, description, created_at, sequence_number, " +
            "transfer_reference ";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Locks the pool row until the current transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockPool() {
        jdbcTemplate.queryForObject("SELECT id FROM pool WHERE id = ? FOR UPDATE", Integer.class, POOL_ID);
    }

    @Transactional(readOnly = true)
    public BigDecimal getBalance() {
        BigDecimal balance = jdbcTemplate.queryForObject(BALANCE_SQL, BigDecimal.class);
        return balance != null ? balance : BigDecimal.ZERO;
    }

    /**
     * Locks the pool and verifies it can cover {@code amount}.
     *
     * Throwing here does not mark the caller's transaction for rollback, so a
     * caller may catch the failure and still commit unrelated work.
     *
     * @return the balance observed under the lock
     * @throws InsufficientPoolException if the balance is below {@code amount}
     */
    @Transactional(propagation = Propagation.MANDATORY, noRollbackFor = InsufficientPoolException.class)
    public BigDecimal requireAvailable(BigDecimal amount) {
        lockPool();
        BigDecimal balance = getBalance();
        if (balance.compareTo(amount) < 0) {
            log.warn("Pool cannot cover {}: balance={}", amount, balance);
            throw new InsufficientPoolException(amount, balance);
        }
        return balance;
    }

    /**
     * Records a premium or deposit flowing into the pool.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID credit(PoolEntryType type, Long policyId, BigDecimal amount, String description) {
        if (!type.isInflow()) {
            throw new IllegalArgumentException(type + " is not an inflow");
        }
        return insertEntry(type, policyId, amount, description, null);
    }

    /**
     * Records a payout, refund or withdrawal leaving the pool, after checking
     * the balance under the pool lock.
     *
     * @throws InsufficientPoolException if the balance is below {@code amount}
     */
    @Transactional(propagation = Propagation.MANDATORY, noRollbackFor = InsufficientPoolException.class)
    public UUID debit(PoolEntryType type, Long policyId, BigDecimal amount, String description) {
        return debit(type, policyId, amount, description, null);
    }

    /**
     * As {@link #debit(PoolEntryType, Long, BigDecimal, String)}, recording the
     * transfer reference that paid the movement out. A reference is stored at
     * most once.
     */
    @Transactional(propagation = Propagation.MANDATORY, noRollbackFor = InsufficientPoolException.class)
    public UUID debit(PoolEntryType type, Long policyId, BigDecimal amount, String description,
                      String transferReference) {
        if (type.isInflow()) {
            throw new IllegalArgumentException(type + " is not an outflow");
        }
        requireAvailable(amount);
        return insertEntry(type, policyId, amount, description, transferReference);
    }

    /**
     * The journal line paid out under {@code transferReference}, if any.
     */
    @Transactional(readOnly = true)
    public Optional<PoolEntry> findByTransferReference(String transferReference) {
        return jdbcTemplate.query(
            ENTRY_COLUMNS + "FROM pool_entries WHERE transfer_reference = ?",
            poolEntryRowMapper(),
            transferReference
        ).stream().findFirst();
    }

    /**
     * Journal lines for one policy in posting order.
     */
    @Transactional(readOnly = true)
    public List<PoolEntry> getEntriesForPolicy(Long policyId) {
        return jdbcTemplate.query(
            ENTRY_COLUMNS + "FROM pool_entries WHERE policy_id = ? ORDER BY sequence_number",
            poolEntryRowMapper(),
            policyId
        );
    }

    /**
     * Sum of all journal lines of one type.
     */
    @Transactional(readOnly = true)
    public BigDecimal sumByType(PoolEntryType type) {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM pool_entries WHERE entry_type = ?",
            BigDecimal.class,
            type.name()
        );
        return total != null ? total : BigDecimal.ZERO;
    }

    private UUID insertEntry(PoolEntryType type, Long policyId, BigDecimal amount, String description,
                             String transferReference) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Pool movement amount must be positive");
        }
        UUID entryId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO pool_entries (id, policy_id, entry_type, amount, description, created_at, " +
            "transfer_reference) VALUES (?, ?, ?, ?, ?, ?, ?)",
            entryId,
            policyId,
            type.name(),
            amount,
            description,
            Timestamp.from(clock.instant()),
            transferReference
        );
        log.debug("Pool entry posted: id={}, type={}, policyId={}, amount={}", entryId, type, policyId, amount);
        return entryId;
    }

    private RowMapper<PoolEntry> poolEntryRowMapper() {
        return (rs, rowNum) -> new PoolEntry(
            UUID.fromString(rs.getString("id")),
            rs.getObject("policy_id") != null ? rs.getLong("policy_id") : null,
            PoolEntryType.valueOf(rs.getString("entry_type")),
            rs.getBigDecimal("amount"),
            rs.getString("description"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number"),
            rs.getString("transfer_reference")
        );
    }
}
