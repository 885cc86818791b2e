package com.flagship.currency_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ledger writes and rate lookups.
 *
 * <ul>
 *   <li>{@code ledger.payments} - payment writes by operation, type, currency and outcome</li>
 *   <li>{@code ledger.transfers} - transfers by currency pair and outcome</li>
 *   <li>{@code ledger.operation.latency} - write latency per operation</li>
 *   <li>{@code ledger.rates.recorded}, {@code ledger.rates.missing} - rate store traffic</li>
 *   <li>{@code ledger.concurrency.conflicts} - lock waits that gave up</li>
 * </ul>
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPayment(String operation, String paymentType, String currency, String outcome) {
        registry.counter("ledger.payments",
                "operation", sanitizeTag(operation),
                "type", sanitizeTag(paymentType),
                "currency", sanitizeTag(currency),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordTransfer(String fromCurrency, String toCurrency, String outcome) {
        registry.counter("ledger.transfers",
                "from_currency", sanitizeTag(fromCurrency),
                "to_currency", sanitizeTag(toCurrency),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordRateRecorded(String currency, String source) {
        registry.counter("ledger.rates.recorded",
                "currency", sanitizeTag(currency),
                "source", sanitizeTag(source)
        ).increment();
    }

    public void recordRateMiss(String currency) {
        registry.counter("ledger.rates.missing",
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void recordConcurrencyConflict(String operation) {
        registry.counter("ledger.concurrency.conflicts",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordDeletionToken(String targetType, String result) {
        registry.counter("ledger.deletion.tokens",
                "target_type", sanitizeTag(targetType),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordRateEventConsumed(String result) {
        registry.counter("ledger.rates.events",
                "result", sanitizeTag(result)
        ).increment();
    }

    /**
     * Keeps tag values short and free of punctuation to bound cardinality.
     */
    static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
