package com.flagship.currency_ledger.profit;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One sold or bought product line, before its derived values are computed.
 */
@Value
@Builder
public class LineItem {
    UUID productId;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal costPrice;
    String currency;
}
