package com.flagship.currency_ledger.profit;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class TransactionItem {
    UUID id;
    int lineNumber;
    UUID productId;
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal costPrice;
    BigDecimal lineTotal;
    BigDecimal lineCost;
    BigDecimal lineProfit;
    BigDecimal marginPct;
}
