package com.flagship.currency_ledger.ledger;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of one balance change.
 * {@code amount} is signed: the exact delta applied to the account.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BalanceEvent {
    UUID id;
    long sequenceNumber;
    UUID accountId;
    BalanceEventType eventType;
    BigDecimal amount;
    BigDecimal balanceAfter;
    String referenceType;
    UUID referenceId;
    String description;
    Instant occurredAt;
}
