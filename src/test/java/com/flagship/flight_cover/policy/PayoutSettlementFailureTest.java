package com.flagship.flight_cover.policy;

import com.flagship.flight_cover.auth.AuthorityPolicy;
import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.TransferFailedException;
import com.flagship.flight_cover.ledger.PoolEntry;
import com.flagship.flight_cover.ledger.PoolEntryType;
import com.flagship.flight_cover.ledger.PoolFundingService;
import com.flagship.flight_cover.ledger.PoolLedgerService;
import com.flagship.flight_cover.outbox.OutboxService;
import com.flagship.flight_cover.policy.event.FlightStatusUpdatedEvent;
import com.flagship.flight_cover.policy.event.PayoutTriggeredEvent;
import com.flagship.flight_cover.policy.event.PolicyCancelledEvent;
import com.flagship.flight_cover.transfer.FundsTransferException;
import com.flagship.flight_cover.transfer.FundsTransferGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * A refused disbursement must leave the policy and the pool exactly as they
 * were before the operation.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PayoutSettlementFailureTest {

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

    private static final String HOLDER = "bob";
    private static final BigDecimal PREMIUM = new BigDecimal("10.00");
    private static final BigDecimal MAX_PAYOUT = new BigDecimal("100.00");

    @MockBean
    private Clock clock;

    @MockBean
    private FundsTransferGateway transferGateway;

    @Autowired
    private PolicyLifecycleService lifecycleService;

    @Autowired
    private PoolLedgerService poolLedger;

    @Autowired
    private PoolFundingService fundingService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AuthorityPolicy authorityPolicy;

    private Instant departure;

    @BeforeEach
    void setUp() throws FundsTransferException {
        Instant now = Instant.parse("2030-06-01T08:00:00Z");
        when(clock.instant()).thenReturn(now);
        departure = now.plus(Duration.ofDays(1));

        doThrow(new FundsTransferException("rail down"))
            .when(transferGateway).transfer(anyString(), any(), anyString());

        fundingService.depositFunds(new BigDecimal("1000.00"), authorityPolicy.getIdentity());
    }

    private Policy newPolicy() {
        return lifecycleService.createPolicy(HOLDER, "FC900", departure, MAX_PAYOUT, PREMIUM);
    }

    private int eventCount(Policy policy, String eventType) {
        return outboxService.getPolicyEvents(policy.getId(), eventType).size();
    }

    @Test
    @DisplayName("Failed automatic payout rolls back the flight status report too")
    void testAutoPayout_TransferFailure_RollsBackReport() {
        Policy policy = newPolicy();
        BigDecimal balanceBefore = poolLedger.getBalance();

        TransferFailedException e = assertThrows(TransferFailedException.class,
            () -> lifecycleService.updateFlightStatus(policy.getId(), FlightStatus.DELAYED,
                departure.plus(Duration.ofMinutes(200)), authorityPolicy.getIdentity()));

        assertEquals(ErrorCode.TRANSFER_FAILED, e.getCode());
        assertEquals("payout-" + policy.getId(), e.getTransferReference());

        Policy reloaded = lifecycleService.getPolicy(policy.getId());
        assertEquals(PolicyStatus.ACTIVE, reloaded.getStatus());
        assertEquals(FlightStatus.ON_TIME, reloaded.getFlightStatus());
        assertEquals(0L, reloaded.getDelayMinutes());
        assertFalse(reloaded.isPayoutProcessed());
        assertNull(reloaded.getPayoutAmount());

        assertEquals(0, balanceBefore.compareTo(poolLedger.getBalance()));
        assertEquals(1, poolLedger.getEntriesForPolicy(policy.getId()).size());
        assertEquals(0, eventCount(policy, FlightStatusUpdatedEvent.EVENT_TYPE));
        assertEquals(0, eventCount(policy, PayoutTriggeredEvent.EVENT_TYPE));
    }

    @Test
    @DisplayName("Payout journal line and PayoutTriggered are written before the transfer runs")
    void testAutoPayout_EventWrittenBeforeTransfer() throws FundsTransferException {
        Policy policy = newPolicy();
        AtomicInteger eventsAtTransfer = new AtomicInteger(-1);
        AtomicReference<List<PoolEntry>> entriesAtTransfer = new AtomicReference<>();
        doAnswer(invocation -> {
            eventsAtTransfer.set(eventCount(policy, PayoutTriggeredEvent.EVENT_TYPE));
            entriesAtTransfer.set(poolLedger.getEntriesForPolicy(policy.getId()));
            return null;
        }).when(transferGateway).transfer(anyString(), any(), anyString());

        Policy paid = lifecycleService.updateFlightStatus(policy.getId(), FlightStatus.DELAYED,
            departure.plus(Duration.ofMinutes(200)), authorityPolicy.getIdentity());

        assertTrue(paid.isPayoutProcessed());
        assertEquals(1, eventsAtTransfer.get());
        assertEquals(2, entriesAtTransfer.get().size());
        assertEquals(PoolEntryType.PAYOUT, entriesAtTransfer.get().get(1).getEntryType());
    }

    @Test
    @DisplayName("Refund journal line and PolicyCancelled are written before the transfer runs")
    void testCancel_EventWrittenBeforeTransfer() throws FundsTransferException {
        Policy policy = newPolicy();
        AtomicInteger eventsAtTransfer = new AtomicInteger(-1);
        AtomicReference<List<PoolEntry>> entriesAtTransfer = new AtomicReference<>();
        doAnswer(invocation -> {
            eventsAtTransfer.set(eventCount(policy, PolicyCancelledEvent.EVENT_TYPE));
            entriesAtTransfer.set(poolLedger.getEntriesForPolicy(policy.getId()));
            return null;
        }).when(transferGateway).transfer(anyString(), any(), anyString());

        Policy cancelled = lifecycleService.cancelPolicy(policy.getId(), HOLDER);

        assertEquals(PolicyStatus.CANCELLED, cancelled.getStatus());
        assertEquals(1, eventsAtTransfer.get());
        assertEquals(2, entriesAtTransfer.get().size());
        assertEquals(PoolEntryType.REFUND, entriesAtTransfer.get().get(1).getEntryType());
    }

    @Test
    @DisplayName("Failed manual claim leaves the policy claimable")
    void testManualPayout_TransferFailure_LeavesPolicyClaimable() throws FundsTransferException {
        String authority = authorityPolicy.getIdentity();

        // Empty the pool so the report defers the payout
        doNothing().when(transferGateway).transfer(anyString(), any(), anyString());
        fundingService.withdrawExcess(poolLedger.getBalance(), authority, "drain-" + UUID.randomUUID());
        Policy policy = newPolicy();
        Policy deferred = lifecycleService.updateFlightStatus(policy.getId(), FlightStatus.DELAYED,
            departure.plus(Duration.ofMinutes(300)), authority);
        assertFalse(deferred.isPayoutProcessed());

        fundingService.depositFunds(new BigDecimal("100.00"), authority);
        BigDecimal balanceBefore = poolLedger.getBalance();
        doThrow(new FundsTransferException("rail down"))
            .when(transferGateway).transfer(anyString(), any(), anyString());

        assertThrows(TransferFailedException.class, () -> lifecycleService.processPayout(policy.getId(), HOLDER));

        Policy reloaded = lifecycleService.getPolicy(policy.getId());
        assertEquals(PolicyStatus.ACTIVE, reloaded.getStatus());
        assertFalse(reloaded.isPayoutProcessed());
        assertTrue(reloaded.isPayoutEligible());
        assertEquals(0, balanceBefore.compareTo(poolLedger.getBalance()));
        assertEquals(0, eventCount(policy, PayoutTriggeredEvent.EVENT_TYPE));

        doNothing().when(transferGateway).transfer(anyString(), any(), anyString());
        Policy settled = lifecycleService.processPayout(policy.getId(), HOLDER);

        assertEquals(PolicyStatus.CLAIMED, settled.getStatus());
        assertEquals(0, new BigDecimal("30.00").compareTo(settled.getPayoutAmount()));
        assertEquals(1, eventCount(policy, PayoutTriggeredEvent.EVENT_TYPE));
    }

    @Test
    @DisplayName("Failed refund leaves the policy ACTIVE and the premium in the pool")
    void testCancel_TransferFailure_RollsBack() {
        Policy policy = newPolicy();
        BigDecimal balanceBefore = poolLedger.getBalance();

        TransferFailedException e = assertThrows(TransferFailedException.class,
            () -> lifecycleService.cancelPolicy(policy.getId(), HOLDER));

        assertEquals("refund-" + policy.getId(), e.getTransferReference());
        assertEquals(PolicyStatus.ACTIVE, lifecycleService.getPolicy(policy.getId()).getStatus());
        assertEquals(0, balanceBefore.compareTo(poolLedger.getBalance()));
        assertEquals(0, eventCount(policy, PolicyCancelledEvent.EVENT_TYPE));
    }

    @Test
    @DisplayName("Failed withdrawal leaves the balance unchanged")
    void testWithdraw_TransferFailure_RollsBack() {
        BigDecimal balanceBefore = poolLedger.getBalance();

        assertThrows(TransferFailedException.class,
            () -> fundingService.withdrawExcess(new BigDecimal("5.00"), authorityPolicy.getIdentity(),
                "w-" + UUID.randomUUID()));

        assertEquals(0, balanceBefore.compareTo(poolLedger.getBalance()));
    }
}
