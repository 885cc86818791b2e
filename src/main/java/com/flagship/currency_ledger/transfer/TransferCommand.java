package com.flagship.currency_ledger.transfer;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Input of a transfer. {@code toAmount} and {@code exchangeRate} are optional;
 * {@code transferDate} defaults to now.
 */
@Value
@Builder
public class TransferCommand {
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal fromAmount;
    BigDecimal toAmount;
    BigDecimal exchangeRate;
    String description;
    String referenceNo;
    Instant transferDate;
}
