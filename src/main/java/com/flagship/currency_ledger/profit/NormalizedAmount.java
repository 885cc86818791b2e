package com.flagship.currency_ledger.profit;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * An amount converted to a reporting currency, or the record that it could not be.
 * An unavailable result never carries a made-up value: {@code amount} and {@code rate} are null.
 */
@Value
public class NormalizedAmount {

    @JsonProperty("original_amount")
    BigDecimal originalAmount;

    @JsonProperty("original_currency")
    String originalCurrency;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("rate")
    BigDecimal rate;

    @JsonProperty("available")
    boolean available;

    public static NormalizedAmount available(BigDecimal originalAmount, String originalCurrency,
                                             String currency, BigDecimal amount, BigDecimal rate) {
        return new NormalizedAmount(originalAmount, originalCurrency, currency, amount, rate, true);
    }

    public static NormalizedAmount unavailable(BigDecimal originalAmount, String originalCurrency, String currency) {
        return new NormalizedAmount(originalAmount, originalCurrency, currency, null, null, false);
    }
}
