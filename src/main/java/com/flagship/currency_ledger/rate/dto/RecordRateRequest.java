package com.flagship.currency_ledger.rate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class RecordRateRequest {

    @NotNull(message = "Buying rate is required")
    @DecimalMin(value = "0", inclusive = false, message = "Buying rate must be positive")
    @JsonProperty("buying_rate")
    BigDecimal buyingRate;

    @NotNull(message = "Selling rate is required")
    @DecimalMin(value = "0", inclusive = false, message = "Selling rate must be positive")
    @JsonProperty("selling_rate")
    BigDecimal sellingRate;

    @Size(max = 50)
    @JsonProperty("source")
    String source;
}
