package com.flagship.currency_ledger.rate;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One day's quote for a currency against the base currency:
 * 1 unit of {@code currency} buys {@code buyingRate} units of base.
 */
@Value
public class ExchangeRate {
    String currency;
    LocalDate rateDate;
    BigDecimal buyingRate;
    BigDecimal sellingRate;
    String source;
    Instant createdAt;
    Instant updatedAt;
}
