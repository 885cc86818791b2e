package com.flagship.currency_ledger.profit;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A sale, purchase or return. Header totals are the sums of the persisted line values.
 */
@Value
public class TradeTransaction {
    UUID id;
    String transactionNo;
    TradeTransactionType type;
    UUID companyId;
    UUID contactId;
    String currency;
    Instant transactionDate;
    BigDecimal subtotal;
    BigDecimal totalCost;
    BigDecimal totalProfit;
    String notes;
    List<TransactionItem> items;
    Instant createdAt;
}
