package com.flagship.flight_cover.health;

import com.flagship.flight_cover.ledger.PoolLedgerService;
import com.flagship.flight_cover.payout.PayoutTierTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Readiness endpoint for load balancers. Unlike Actuator health it needs no
 * authorization. The service is ready when the database answers, the pool
 * balance can be derived and at least one payout tier is configured; without
 * tiers every delayed flight would settle at zero.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final PoolLedgerService poolLedger;
    private final PayoutTierTable tierTable;
    private final Clock clock;

    public HealthController(DataSource dataSource, PoolLedgerService poolLedger,
                            PayoutTierTable tierTable, Clock clock) {
        this.dataSource = dataSource;
        this.poolLedger = poolLedger;
        this.tierTable = tierTable;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        boolean ready = dbHealthy;
        if (dbHealthy) {
            boolean poolReadable = checkPool();
            int tierCount = countTiers();
            response.put("pool", poolReadable ? "UP" : "DOWN");
            response.put("payout_tiers", tierCount);
            ready = poolReadable && tierCount > 0;
        }

        if (!ready) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private int countTiers() {
        try {
            return tierTable.listTiers().size();
        } catch (Exception e) {
            log.warn("Payout tier check failed: {}", e.getMessage());
            return 0;
        }
    }

    private boolean checkPool() {
        try {
            poolLedger.getBalance();
            return true;
        } catch (Exception e) {
            log.warn("Pool health check failed: {}", e.getMessage());
            return false;
        }
    }
}
