package com.flagship.currency_ledger.profit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.currency_ledger.payment.PaymentChannel;
import com.flagship.currency_ledger.payment.PaymentType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Daily payment flows, oldest day first. {@code accountId} is null when the report covers every account.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CashFlowReport {

    LocalDate from;
    LocalDate to;
    UUID accountId;
    List<Line> flows;

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Line {
        LocalDate date;
        PaymentType type;
        PaymentChannel channel;
        String currency;
        long count;
        BigDecimal amount;
    }
}
