package com.flagship.currency_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One event handled by one consumer group. Its presence blocks redelivered copies.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant at) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                at, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant at, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                at, ProcessingResult.SKIPPED, reason);
    }

    /**
     * A permanent rejection, e.g. a rate that fails validation. Never retried.
     */
    public static ProcessedEvent failed(UUID eventId, String eventType, String aggregateType,
                                        UUID aggregateId, String consumerGroup, Instant at, String errorMessage) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                at, ProcessingResult.FAILED, errorMessage);
    }
}
