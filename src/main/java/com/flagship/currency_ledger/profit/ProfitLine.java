package com.flagship.currency_ledger.profit;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A persisted line with the header fields reports group by.
 * {@code transactionDate} is the business date in the ledger zone.
 */
@Value
@Builder
public class ProfitLine {
    UUID transactionId;
    String transactionNo;
    LocalDate transactionDate;
    UUID companyId;
    UUID contactId;
    UUID productId;
    String currency;
    BigDecimal quantity;
    BigDecimal lineTotal;
    BigDecimal lineCost;
    BigDecimal lineProfit;
}
