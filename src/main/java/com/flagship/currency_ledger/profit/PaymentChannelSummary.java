package com.flagship.currency_ledger.profit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.currency_ledger.payment.PaymentChannel;
import com.flagship.currency_ledger.payment.PaymentType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Payment count and volume per channel and type over a period. Amounts are kept
 * per currency; {@code totalBaseAmount} is the same volume in the base currency
 * at each payment's own rate, so channels can be compared across currencies.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentChannelSummary {

    LocalDate from;
    LocalDate to;
    List<Line> channels;

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Line {
        PaymentChannel channel;
        PaymentType type;
        String currency;
        long count;
        BigDecimal totalAmount;
        BigDecimal totalBaseAmount;
    }
}
