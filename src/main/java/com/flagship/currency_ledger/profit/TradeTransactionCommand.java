package com.flagship.currency_ledger.profit;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TradeTransactionCommand {
    TradeTransactionType type;
    UUID companyId;
    UUID contactId;
    String currency;
    Instant transactionDate;
    String notes;
    @Singular
    List<Line> lines;

    @Value
    @Builder
    public static class Line {
        UUID productId;
        String description;
        BigDecimal quantity;
        BigDecimal unitPrice;
        BigDecimal costPrice;
    }
}
