package com.flagship.currency_ledger.observability;

import com.flagship.currency_ledger.outbox.OutboxEventRepository;
import com.flagship.currency_ledger.rate.ExchangeRateRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Actuator health contributors for the ledger's dependencies.
 */
public class HealthIndicators {

    /**
     * DOWN once the unpublished backlog passes the critical threshold.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();
                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Reports how old the newest stored exchange rate is. Stale rates do not stop
     * the ledger, but payments in foreign currencies start failing with rate errors.
     */
    @Component("rateFreshnessHealth")
    public static class RateFreshnessHealthIndicator implements HealthIndicator {

        private final ExchangeRateRepository rateRepository;
        private final Clock clock;
        private final long maxAgeDays;

        public RateFreshnessHealthIndicator(ExchangeRateRepository rateRepository, Clock clock,
                                            @Value("${ledger.rates.max-age-days:3}") long maxAgeDays) {
            this.rateRepository = rateRepository;
            this.clock = clock;
            this.maxAgeDays = maxAgeDays;
        }

        @Override
        public Health health() {
            try {
                Optional<LocalDate> newest = rateRepository.findNewestRateDate();
                if (newest.isEmpty()) {
                    return Health.status("WARNING")
                            .withDetail("newestRateDate", "none")
                            .build();
                }
                long ageDays = ChronoUnit.DAYS.between(newest.get(), LocalDate.now(clock));
                Health.Builder builder = ageDays <= maxAgeDays ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("newestRateDate", newest.get().toString())
                        .withDetail("ageDays", ageDays)
                        .withDetail("maxAgeDays", maxAgeDays)
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis only carries the confirmation-token fast path, so an outage degrades
     * rather than fails the service.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final Optional<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(Optional<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            if (redisTemplate.isEmpty()) {
                return degraded("Redis is not configured");
            }
            try {
                var connectionFactory = redisTemplate.get().getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : degraded("Unexpected ping response: " + result);
                }
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Confirmation tokens fall back to the database")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka producer connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }
}
