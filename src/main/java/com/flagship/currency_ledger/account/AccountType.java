package com.flagship.currency_ledger.account;

public enum AccountType {
    CASH,
    BANK,
    CRYPTO,
    PAYMENT_GATEWAY
}
