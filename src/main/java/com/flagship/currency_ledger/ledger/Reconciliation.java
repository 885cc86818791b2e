package com.flagship.currency_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Stored balance compared with the sum of every balance event of the account.
 */
@Value
public class Reconciliation {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("event_sum")
    BigDecimal eventSum;

    @JsonProperty("event_count")
    long eventCount;

    @JsonProperty("difference")
    BigDecimal difference;

    @JsonProperty("balanced")
    public boolean isBalanced() {
        return difference.signum() == 0;
    }
}
