package com.flagship.currency_ledger.common.exception;

import java.util.UUID;

/**
 * A payment declared in one currency was pointed at an account held in another.
 * Cross-currency movements must go through a transfer, which converts explicitly.
 */
public class CurrencyMismatchException extends LedgerException {

    public static final String CODE = "CURRENCY_MISMATCH";

    private final String expectedCurrency;
    private final String actualCurrency;

    public CurrencyMismatchException(UUID accountId, String accountCurrency, String paymentCurrency) {
        super(CODE, String.format("Account %s is denominated in %s but the payment is in %s",
                accountId, accountCurrency, paymentCurrency));
        this.expectedCurrency = accountCurrency;
        this.actualCurrency = paymentCurrency;
    }

    public String getExpectedCurrency() {
        return expectedCurrency;
    }

    public String getActualCurrency() {
        return actualCurrency;
    }
}
