package com.flagship.currency_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Input of {@code createPayment} and {@code updatePayment}.
 *
 * On update every null field keeps the stored value. A null exchange rate keeps
 * the stored rate unless the currency or payment date changed, in which case
 * the rate is resolved again from the rate store.
 */
@Value
@Builder(toBuilder = true)
public class PaymentCommand {
    PaymentType type;
    PaymentChannel channel;
    BigDecimal amount;
    String currency;
    UUID accountId;
    UUID contactId;
    BigDecimal exchangeRate;
    String description;
    String referenceNo;
    Instant paymentDate;
}
