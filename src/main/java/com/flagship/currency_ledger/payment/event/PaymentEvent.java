package com.flagship.currency_ledger.payment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of the payment facts published on the ledger topic.
 * {@code eventId} is what consumers deduplicate on.
 */
public interface PaymentEvent {

    UUID getEventId();

    UUID getPaymentId();

    Instant getOccurredAt();

    String getEventType();
}
