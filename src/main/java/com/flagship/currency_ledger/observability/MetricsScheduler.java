package com.flagship.currency_ledger.observability;

import com.flagship.currency_ledger.rate.ExchangeRateRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Refreshes the cached gauges: outbox backlog and the age of the newest stored rate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final ExchangeRateRepository rateRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // -1 until a rate has been stored
    private final AtomicLong newestRateAgeDays = new AtomicLong(-1);

    @PostConstruct
    public void init() {
        Gauge.builder("ledger.rates.newest.age.days", newestRateAgeDays, AtomicLong::get)
                .description("Days since the newest stored exchange rate")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshRateAge() {
        try {
            LocalDate today = LocalDate.now(clock);
            newestRateAgeDays.set(rateRepository.findNewestRateDate()
                    .map(newest -> Math.max(0, ChronoUnit.DAYS.between(newest, today)))
                    .orElse(-1L));
        } catch (DataAccessException e) {
            log.warn("Failed to refresh rate age metric: {}", e.getMessage());
        }
    }

    long getNewestRateAgeDays() {
        return newestRateAgeDays.get();
    }
}
