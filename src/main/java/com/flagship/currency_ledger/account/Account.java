package com.flagship.currency_ledger.account;

import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A money-holding account. The balance is always expressed in {@code currency}
 * and only changes through payments and transfers, each of which leaves a
 * balance event behind.
 */
@Value
public class Account {
    UUID id;
    String code;
    String name;
    String currency;
    AccountType type;
    @With
    BigDecimal balance;
    UUID companyId;
    boolean active;
    Instant createdAt;
    Instant updatedAt;
}
