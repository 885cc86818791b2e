package com.flagship.currency_ledger.profit;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived values of a line, fixed when the line is written.
 */
@Value
public class LineProfit {
    BigDecimal lineTotal;
    BigDecimal lineCost;
    BigDecimal lineProfit;
    BigDecimal marginPct;
}
