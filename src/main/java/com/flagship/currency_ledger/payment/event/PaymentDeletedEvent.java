package com.flagship.currency_ledger.payment.event;

import com.flagship.currency_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentDeletedEvent implements PaymentEvent {

    public static final String EVENT_TYPE = "PaymentDeleted";

    UUID eventId;
    UUID paymentId;
    String paymentNo;
    UUID accountId;
    BigDecimal reversedEffect;
    BigDecimal balanceAfter;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentDeletedEvent from(Payment payment, BigDecimal balanceAfter) {
        return new PaymentDeletedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getPaymentNo(),
            payment.getAccountId(),
            payment.balanceEffect().negate(),
            balanceAfter,
            Instant.now()
        );
    }
}
