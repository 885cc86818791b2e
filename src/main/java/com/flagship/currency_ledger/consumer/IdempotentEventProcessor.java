package com.flagship.currency_ledger.consumer;

import com.flagship.currency_ledger.common.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs an event handler at most once per consumer group.
 *
 * The handler and its {@code SUCCESS} record commit together. A handler that fails
 * with a non-retryable {@link LedgerException} is rolled back and a {@code FAILED}
 * record is written in a separate transaction, so the event is not retried. Any
 * other failure is rethrown without a record, and the redelivered copy runs again.
 */
@Service
@Slf4j
public class IdempotentEventProcessor {

    public enum Outcome {
        PROCESSED,
        DUPLICATE,
        REJECTED
    }

    private final ProcessedEventRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate failureTemplate;
    private final Clock clock;

    public IdempotentEventProcessor(ProcessedEventRepository repository,
                                    PlatformTransactionManager transactionManager,
                                    Clock clock) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.failureTemplate = new TransactionTemplate(transactionManager);
        this.failureTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public Outcome processEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        try {
            Outcome outcome = transactionTemplate.execute(status -> {
                if (repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup)) {
                    return Outcome.DUPLICATE;
                }
                handler.run();
                repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
                        eventId, eventType, aggregateType, aggregateId, consumerGroup, clock.instant())));
                return Outcome.PROCESSED;
            });
            if (outcome == Outcome.DUPLICATE) {
                log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            }
            return outcome;

        } catch (LedgerException e) {
            if (e.isRetryable()) {
                throw e;
            }
            log.warn("Rejected event {} for consumer group {}: {}", eventId, consumerGroup, e.getMessage());
            record(ProcessedEvent.failed(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                    clock.instant(), e.getMessage()));
            return Outcome.REJECTED;
        }
    }

    /**
     * Records an event this consumer does not handle, so replays skip it too.
     */
    public void skipEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        failureTemplate.executeWithoutResult(status -> {
            if (!repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup)) {
                repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
                        eventId, eventType, aggregateType, aggregateId, consumerGroup, clock.instant(), reason)));
            }
        });
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void record(ProcessedEvent event) {
        failureTemplate.executeWithoutResult(status ->
                repository.save(ProcessedEventEntity.fromDomain(event)));
    }
}
