package com.flagship.flight_cover.ledger;

import com.flagship.flight_cover.auth.AuthorityPolicy;
import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.InsufficientPoolException;
import com.flagship.flight_cover.exception.PolicyValidationException;
import com.flagship.flight_cover.exception.UnauthorizedCallerException;
import com.flagship.flight_cover.policy.Policy;
import com.flagship.flight_cover.policy.PolicyLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pool journal and administrative funding against a real database.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PoolLedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("flight_cover_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("cover.expiry.enabled", () -> "false");
    }

    @Autowired
    private PoolLedgerService poolLedger;

    @Autowired
    private PoolFundingService fundingService;

    @Autowired
    private LedgerAccountingService accountingService;

    @Autowired
    private AuthorityPolicy authorityPolicy;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private PolicyLifecycleService lifecycleService;

    private String authority;

    @BeforeEach
    void setUp() {
        authority = authorityPolicy.getIdentity();
    }

    private static String newKey() {
        return "w-" + UUID.randomUUID();
    }

    @Test
    @DisplayName("Deposits raise the balance and return the new balance")
    void testDeposit_IncreasesBalance() {
        BigDecimal before = poolLedger.getBalance();

        BigDecimal after = fundingService.depositFunds(new BigDecimal("250.5000"), authority);

        assertEquals(0, before.add(new BigDecimal("250.5000")).compareTo(after));
        assertEquals(0, after.compareTo(poolLedger.getBalance()));
    }

    @Test
    @DisplayName("Withdrawals lower the balance")
    void testWithdraw_DecreasesBalance() {
        fundingService.depositFunds(new BigDecimal("100.00"), authority);
        BigDecimal before = poolLedger.getBalance();

        BigDecimal after = fundingService.withdrawExcess(new BigDecimal("40.00"), authority, newKey());

        assertEquals(0, before.subtract(new BigDecimal("40.00")).compareTo(after));
    }

    @Test
    @DisplayName("Replaying a withdrawal key with the same amount moves nothing")
    void testWithdraw_ReplayedKey_MovesNothing() {
        fundingService.depositFunds(new BigDecimal("100.00"), authority);
        String key = newKey();

        BigDecimal afterFirst = fundingService.withdrawExcess(new BigDecimal("25.00"), authority, key);
        BigDecimal afterReplay = fundingService.withdrawExcess(new BigDecimal("25.00"), authority, key);

        assertEquals(0, afterFirst.compareTo(afterReplay));
        assertEquals(0, afterFirst.compareTo(poolLedger.getBalance()));

        PoolEntry line = poolLedger.findByTransferReference("withdrawal-" + key).orElseThrow();
        assertEquals(PoolEntryType.WITHDRAWAL, line.getEntryType());
        assertEquals(0, new BigDecimal("25.00").compareTo(line.getAmount()));
        assertNull(line.getPolicyId());
    }

    @Test
    @DisplayName("A withdrawal key reused for another amount is rejected")
    void testWithdraw_ReusedKeyDifferentAmount() {
        fundingService.depositFunds(new BigDecimal("100.00"), authority);
        String key = newKey();
        fundingService.withdrawExcess(new BigDecimal("10.00"), authority, key);
        BigDecimal before = poolLedger.getBalance();

        PolicyValidationException e = assertThrows(PolicyValidationException.class,
            () -> fundingService.withdrawExcess(new BigDecimal("11.00"), authority, key));

        assertEquals(ErrorCode.INVALID_REQUEST, e.getCode());
        assertEquals(0, before.compareTo(poolLedger.getBalance()));
    }

    @Test
    @DisplayName("Withdrawals without a key are rejected")
    void testWithdraw_RequiresKey() {
        BigDecimal before = poolLedger.getBalance();

        PolicyValidationException missing = assertThrows(PolicyValidationException.class,
            () -> fundingService.withdrawExcess(BigDecimal.ONE, authority, null));
        PolicyValidationException blank = assertThrows(PolicyValidationException.class,
            () -> fundingService.withdrawExcess(BigDecimal.ONE, authority, " "));

        assertEquals(ErrorCode.INVALID_REQUEST, missing.getCode());
        assertEquals(ErrorCode.INVALID_REQUEST, blank.getCode());
        assertEquals(0, before.compareTo(poolLedger.getBalance()));
        assertTrue(poolLedger.findByTransferReference("withdrawal- ").isEmpty());
    }

    @Test
    @DisplayName("Withdrawing more than the balance fails with INSUFFICIENT_POOL and changes nothing")
    void testWithdraw_MoreThanBalance() {
        BigDecimal before = poolLedger.getBalance();

        InsufficientPoolException e = assertThrows(InsufficientPoolException.class,
            () -> fundingService.withdrawExcess(before.add(BigDecimal.ONE), authority, newKey()));

        assertEquals(ErrorCode.INSUFFICIENT_POOL, e.getCode());
        assertEquals(0, before.compareTo(e.getAvailable()));
        assertEquals(0, before.compareTo(poolLedger.getBalance()));
    }

    @Test
    @DisplayName("Only the authority can move pool funds")
    void testFunding_RequiresAuthority() {
        BigDecimal before = poolLedger.getBalance();

        assertThrows(UnauthorizedCallerException.class,
            () -> fundingService.depositFunds(BigDecimal.TEN, "alice"));
        assertThrows(UnauthorizedCallerException.class,
            () -> fundingService.withdrawExcess(BigDecimal.ONE, "alice", newKey()));

        assertEquals(0, before.compareTo(poolLedger.getBalance()));
    }

    @Test
    @DisplayName("Non-positive amounts are rejected")
    void testFunding_RejectsNonPositiveAmounts() {
        PolicyValidationException zero = assertThrows(PolicyValidationException.class,
            () -> fundingService.depositFunds(BigDecimal.ZERO, authority));
        assertEquals(ErrorCode.INVALID_REQUEST, zero.getCode());

        assertThrows(PolicyValidationException.class,
            () -> fundingService.withdrawExcess(new BigDecimal("-5"), authority, newKey()));
    }

    @Test
    @DisplayName("Balance is derived from every journal line")
    void testBalance_DerivedFromJournal() {
        BigDecimal before = poolLedger.getBalance();

        transactionTemplate.executeWithoutResult(status -> {
            poolLedger.credit(PoolEntryType.PREMIUM, null, new BigDecimal("12.00"), "premium");
            poolLedger.debit(PoolEntryType.REFUND, null, new BigDecimal("10.80"), "refund");
        });

        assertEquals(0, before.add(new BigDecimal("1.20")).compareTo(poolLedger.getBalance()));
    }

    @Test
    @DisplayName("Journal lines of a policy come back in posting order")
    void testEntriesForPolicy_InPostingOrder() {
        Policy policy = lifecycleService.createPolicy("carol", "FC100",
            Instant.now().plus(Duration.ofDays(2)), new BigDecimal("40.00"), new BigDecimal("10.00"));
        lifecycleService.cancelPolicy(policy.getId(), "carol");

        List<PoolEntry> entries = poolLedger.getEntriesForPolicy(policy.getId());

        assertEquals(2, entries.size());
        assertEquals(PoolEntryType.PREMIUM, entries.get(0).getEntryType());
        assertEquals(PoolEntryType.REFUND, entries.get(1).getEntryType());
        assertEquals(0, new BigDecimal("9.00").compareTo(entries.get(1).getAmount()));
        assertTrue(entries.get(0).getSequenceNumber() < entries.get(1).getSequenceNumber());
        assertEquals(policy.getId(), entries.get(0).getPolicyId());
    }

    @Test
    @DisplayName("Totals count premiums and payouts only")
    void testTotals_CountPremiumsAndPayouts() {
        LedgerTotals before = accountingService.getTotals();

        fundingService.depositFunds(new BigDecimal("500.00"), authority);
        transactionTemplate.executeWithoutResult(status -> {
            poolLedger.credit(PoolEntryType.PREMIUM, null, new BigDecimal("8.00"), "premium");
            poolLedger.debit(PoolEntryType.PAYOUT, null, new BigDecimal("16.00"), "payout");
        });

        LedgerTotals after = accountingService.getTotals();
        assertEquals(0, before.getPremiumsCollected().add(new BigDecimal("8.00"))
            .compareTo(after.getPremiumsCollected()));
        assertEquals(0, before.getPayoutsProcessed().add(new BigDecimal("16.00"))
            .compareTo(after.getPayoutsProcessed()));
    }

    @Test
    @DisplayName("Journal writes require an enclosing transaction")
    void testCredit_RequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> poolLedger.credit(PoolEntryType.DEPOSIT, null, BigDecimal.ONE, "no tx"));
    }

    @Test
    @DisplayName("Entry types are routed by direction")
    void testCredit_RejectsOutflowType() {
        assertThrows(IllegalArgumentException.class, () -> transactionTemplate.executeWithoutResult(
            status -> poolLedger.credit(PoolEntryType.PAYOUT, null, BigDecimal.ONE, "wrong way")));
    }
}
