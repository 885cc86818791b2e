package com.flagship.currency_ledger.payment.event;

import com.flagship.currency_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Old and new balance effect of an edited payment.
 */
@Value
public class PaymentUpdatedEvent implements PaymentEvent {

    public static final String EVENT_TYPE = "PaymentUpdated";

    UUID eventId;
    UUID paymentId;
    String paymentNo;
    UUID previousAccountId;
    BigDecimal previousEffect;
    UUID accountId;
    BigDecimal effect;
    String currency;
    BigDecimal baseAmount;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentUpdatedEvent from(Payment previous, Payment updated) {
        return new PaymentUpdatedEvent(
            UUID.randomUUID(),
            updated.getId(),
            updated.getPaymentNo(),
            previous.getAccountId(),
            previous.balanceEffect(),
            updated.getAccountId(),
            updated.balanceEffect(),
            updated.getCurrency(),
            updated.getBaseAmount(),
            Instant.now()
        );
    }
}
