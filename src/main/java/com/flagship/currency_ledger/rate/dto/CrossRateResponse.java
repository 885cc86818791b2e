package com.flagship.currency_ledger.rate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class CrossRateResponse {

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    /** Null when the latest rates were used. */
    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("rate")
    BigDecimal rate;
}
