package com.flagship.flight_cover.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One immutable line of the pool journal.
 * {@code policyId} is null for administrative deposits and withdrawals;
 * {@code transferReference} is set only on keyed withdrawals.
 */
@Value
public class PoolEntry {
    UUID id;
    Long policyId;
    PoolEntryType entryType;
    BigDecimal amount;
    String description;
    Instant createdAt;
    Long sequenceNumber;
    String transferReference;
}
