package com.flagship.currency_ledger.consumer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.common.Amounts;
import lombok.Value;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A daily quote published by a rate provider adapter on the {@code exchange-rates} topic.
 *
 * Providers quote some currencies per {@code unit} (e.g. 100 JPY); the stored rate is per single unit.
 */
@Value
public class RateRecordedEvent {

    public static final String EVENT_TYPE = "ExchangeRateRecorded";

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("rate_date")
    LocalDate rateDate;

    @JsonProperty("buying_rate")
    BigDecimal buyingRate;

    @JsonProperty("selling_rate")
    BigDecimal sellingRate;

    @JsonProperty("unit")
    Integer unit;

    @JsonProperty("source")
    String source;

    /**
     * Stable id of the (currency, date) quote the event targets.
     */
    public UUID aggregateId() {
        String key = String.valueOf(Amounts.normalizeCurrency(currency)) + ":" + rateDate;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }

    public int effectiveUnit() {
        return unit != null && unit > 0 ? unit : 1;
    }
}
