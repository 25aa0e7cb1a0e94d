package com.flagship.flight_cover.payout;

import com.flagship.flight_cover.auth.AuthorityPolicy;
import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.PolicyValidationException;
import com.flagship.flight_cover.exception.UnauthorizedCallerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PayoutTierTableTest {

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
    private PayoutTierTable tierTable;

    @Autowired
    private AuthorityPolicy authorityPolicy;

    @Test
    @DisplayName("The default schedule is seeded in scan order")
    void testDefaultTiers_Seeded() {
        List<PayoutTier> tiers = tierTable.listTiers();

        assertTrue(tiers.size() >= 3);
        assertEquals(120, tiers.get(0).getMinDelay());
        assertEquals(240L, tiers.get(0).getMaxDelay());
        assertEquals(200, tiers.get(0).getMultiplier());
        assertEquals(300, tiers.get(1).getMultiplier());
        assertEquals(480, tiers.get(2).getMinDelay());
        assertTrue(tiers.get(2).isOpenEnded());
        assertEquals(500, tiers.get(2).getMultiplier());
    }

    @Test
    @DisplayName("Appended tiers go to the end of the table")
    void testAddTier_AppendsLast() {
        int sizeBefore = tierTable.listTiers().size();

        PayoutTier added = tierTable.addTier(2000, 3000L, 750, authorityPolicy.getIdentity());

        List<PayoutTier> tiers = tierTable.listTiers();
        assertNotNull(added.getId());
        assertEquals(sizeBefore + 1, tiers.size());
        assertEquals(added, tiers.get(tiers.size() - 1));
    }

    @Test
    @DisplayName("Only the authority can add tiers")
    void testAddTier_RequiresAuthority() {
        int sizeBefore = tierTable.listTiers().size();

        assertThrows(UnauthorizedCallerException.class, () -> tierTable.addTier(0, 60L, 100, "alice"));

        assertEquals(sizeBefore, tierTable.listTiers().size());
    }

    @Test
    @DisplayName("Malformed tiers are rejected with INVALID_TIER")
    void testAddTier_RejectsMalformedTiers() {
        String authority = authorityPolicy.getIdentity();

        PolicyValidationException emptyRange = assertThrows(PolicyValidationException.class,
            () -> tierTable.addTier(300, 300L, 100, authority));
        assertEquals(ErrorCode.INVALID_TIER, emptyRange.getCode());

        assertThrows(PolicyValidationException.class, () -> tierTable.addTier(-1, 60L, 100, authority));
        assertThrows(PolicyValidationException.class, () -> tierTable.addTier(0, 60L, 0, authority));
    }
}
