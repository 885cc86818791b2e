package com.flagship.currency_ledger.profit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Money held and moved per currency over a period.
 * {@code normalizedTotalBalance} sums only the convertible balances; {@code complete} says whether that is all of them.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CurrencySummary {

    LocalDate from;
    LocalDate to;
    String reportingCurrency;
    List<Line> currencies;
    BigDecimal normalizedTotalBalance;
    boolean complete;

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Line {
        String currency;
        long accountCount;
        BigDecimal totalBalance;
        BigDecimal incoming;
        BigDecimal outgoing;
        BigDecimal net;
        NormalizedAmount normalizedBalance;
    }
}
