package com.flagship.currency_ledger.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMetricsTest {

    @Test
    @DisplayName("Tag values are stripped of punctuation and capped at 50 characters")
    void sanitizeTag() {
        assertEquals("unknown", LedgerMetrics.sanitizeTag(null));
        assertEquals("USD_TRY", LedgerMetrics.sanitizeTag("USD/TRY"));
        assertEquals(50, LedgerMetrics.sanitizeTag("x".repeat(80)).length());
    }

    @Test
    @DisplayName("Transfers are counted per currency pair and outcome")
    void recordTransfer() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        LedgerMetrics metrics = new LedgerMetrics(registry);

        metrics.recordTransfer("USD", "TRY", "success");
        metrics.recordTransfer("USD", "TRY", "success");
        metrics.recordTransfer("USD", null, "ValidationException");

        assertEquals(2.0, registry.get("ledger.transfers")
                .tag("from_currency", "USD").tag("to_currency", "TRY").tag("outcome", "success")
                .counter().count());
        assertEquals(1.0, registry.get("ledger.transfers")
                .tag("to_currency", "unknown").counter().count());
    }
}
