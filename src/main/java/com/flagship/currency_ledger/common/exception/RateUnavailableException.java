package com.flagship.currency_ledger.common.exception;

import java.time.LocalDate;

/**
 * No exchange rate could be resolved for a conversion.
 * A missing rate never falls back to 1.
 */
public class RateUnavailableException extends LedgerException {

    public static final String CODE = "RATE_UNAVAILABLE";

    private final String currency;
    private final LocalDate date;

    public RateUnavailableException(String currency, LocalDate date) {
        super(CODE, date != null
                ? String.format("No exchange rate for %s on %s", currency, date)
                : String.format("No exchange rate recorded for %s", currency));
        this.currency = currency;
        this.date = date;
    }

    public RateUnavailableException(String fromCurrency, String toCurrency, LocalDate date, Throwable cause) {
        super(CODE, date != null
                ? String.format("No exchange rate for %s -> %s on %s", fromCurrency, toCurrency, date)
                : String.format("No exchange rate for %s -> %s", fromCurrency, toCurrency), cause);
        this.currency = fromCurrency;
        this.date = date;
    }

    public String getCurrency() {
        return currency;
    }

    public LocalDate getDate() {
        return date;
    }
}
