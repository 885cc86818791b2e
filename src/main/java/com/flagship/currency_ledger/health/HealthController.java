package com.flagship.currency_ledger.health;

import com.flagship.currency_ledger.rate.ExchangeRateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness/readiness probe. Reports DOWN only when the database is unreachable;
 * the newest stored rate date is informational.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final ExchangeRateRepository rateRepository;
    private final Clock clock;

    public HealthController(DataSource dataSource, ExchangeRateRepository rateRepository, Clock clock) {
        this.dataSource = dataSource;
        this.rateRepository = rateRepository;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        try {
            response.put("newest_rate_date", rateRepository.findNewestRateDate()
                    .map(Object::toString)
                    .orElse("none"));
        } catch (DataAccessException e) {
            log.warn("Rate freshness check failed: {}", e.getMessage());
            response.put("newest_rate_date", "unknown");
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
