package com.flagship.currency_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class BalanceHistoryPage {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("total_events")
    long totalEvents;

    /** Newest first. */
    @JsonProperty("events")
    List<BalanceEvent> events;
}
