package com.flagship.currency_ledger.payment.event;

import com.flagship.currency_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentRecordedEvent implements PaymentEvent {

    public static final String EVENT_TYPE = "PaymentRecorded";

    UUID eventId;
    UUID paymentId;
    String paymentNo;
    String paymentType;
    String channel;
    UUID accountId;
    BigDecimal amount;
    String currency;
    BigDecimal exchangeRate;
    BigDecimal baseAmount;
    BigDecimal balanceAfter;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentRecordedEvent from(Payment payment, BigDecimal balanceAfter) {
        return new PaymentRecordedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getPaymentNo(),
            payment.getType().getCode(),
            payment.getChannel().getCode(),
            payment.getAccountId(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getExchangeRate(),
            payment.getBaseAmount(),
            balanceAfter,
            Instant.now()
        );
    }
}
