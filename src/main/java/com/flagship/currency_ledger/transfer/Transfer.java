package com.flagship.currency_ledger.transfer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Money moved between two accounts of possibly different currencies.
 * {@code exchangeRate} is units of the target currency per unit of the source currency.
 */
@Value
public class Transfer {
    UUID id;
    String transferNo;
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal fromAmount;
    BigDecimal toAmount;
    BigDecimal exchangeRate;
    String description;
    String referenceNo;
    Instant transferDate;
    Instant createdAt;
}
