package com.flagship.currency_ledger.ledger;

public enum BalanceEventType {
    OPENING,
    PAYMENT,
    PAYMENT_REVERSAL,
    TRANSFER_OUT,
    TRANSFER_IN
}
