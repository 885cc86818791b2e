package com.flagship.currency_ledger.profit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of a profit/loss aggregation.
 *
 * Per-currency blocks hold exact sums in the original currency. The normalized block
 * is in the reporting currency and is {@code complete} only when every line could be
 * converted; otherwise its sums cover the convertible lines and
 * {@code unavailableLines} counts the rest.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProfitLossSummary {

    GroupBy groupBy;
    String reportingCurrency;
    List<Group> groups;
    NormalizedTotals total;

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Group {
        String key;
        int lineCount;
        List<CurrencyTotals> byCurrency;
        NormalizedTotals normalized;
    }

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class CurrencyTotals {
        String currency;
        BigDecimal quantity;
        BigDecimal revenue;
        BigDecimal cost;
        BigDecimal profit;
        BigDecimal marginPct;
    }

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class NormalizedTotals {
        String currency;
        BigDecimal revenue;
        BigDecimal cost;
        BigDecimal profit;
        BigDecimal marginPct;
        boolean complete;
        int unavailableLines;
    }
}
