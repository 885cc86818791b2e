package com.flagship.currency_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded payment. Exactly one account is affected, in the account's own currency.
 * {@code baseAmount} is {@code amount} valued in the base currency at entry time.
 */
@Value
public class Payment {
    UUID id;
    String paymentNo;
    PaymentType type;
    PaymentChannel channel;
    BigDecimal amount;
    String currency;
    BigDecimal exchangeRate;
    BigDecimal baseAmount;
    UUID contactId;
    UUID accountId;
    String description;
    String referenceNo;
    Instant paymentDate;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Signed effect of this payment on its account's balance.
     */
    public BigDecimal balanceEffect() {
        return type.signedAmount(amount);
    }
}
