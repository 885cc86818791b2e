package com.flagship.currency_ledger.profit;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Converts an amount dated {@code date} into {@code reportingCurrency}.
 */
@FunctionalInterface
public interface AmountNormalizer {

    NormalizedAmount normalize(BigDecimal amount, String currency, LocalDate date, String reportingCurrency);
}
