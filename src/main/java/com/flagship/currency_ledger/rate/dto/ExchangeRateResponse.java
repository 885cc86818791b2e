package com.flagship.currency_ledger.rate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.rate.ExchangeRate;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class ExchangeRateResponse {

    @JsonProperty("currency")
    String currency;

    @JsonProperty("rate_date")
    LocalDate rateDate;

    @JsonProperty("buying_rate")
    BigDecimal buyingRate;

    @JsonProperty("selling_rate")
    BigDecimal sellingRate;

    @JsonProperty("source")
    String source;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ExchangeRateResponse from(ExchangeRate rate) {
        return ExchangeRateResponse.builder()
            .currency(rate.getCurrency())
            .rateDate(rate.getRateDate())
            .buyingRate(rate.getBuyingRate())
            .sellingRate(rate.getSellingRate())
            .source(rate.getSource())
            .updatedAt(rate.getUpdatedAt())
            .build();
    }
}
