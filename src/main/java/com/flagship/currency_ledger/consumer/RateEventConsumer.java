package com.flagship.currency_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.currency_ledger.common.Amounts;
import com.flagship.currency_ledger.observability.LedgerMetrics;
import com.flagship.currency_ledger.rate.ExchangeRateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Feeds daily quotes from the {@code exchange-rates} topic into the rate store.
 *
 * Offsets are acknowledged only after the quote is stored, rejected, or found to be
 * a duplicate. Unparseable messages are acknowledged and dropped.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RateEventConsumer {

    static final String CONSUMER_GROUP = "exchange-rate-ingestion";
    static final String AGGREGATE_TYPE = "ExchangeRate";

    private final IdempotentEventProcessor eventProcessor;
    private final ExchangeRateService rateService;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;

    @KafkaListener(
        topics = "${kafka.topic.exchange-rates:exchange-rates}",
        groupId = "${spring.kafka.consumer.group-id:currency-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received rate message: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        RateRecordedEvent event = parse(record.value());
        if (event == null) {
            metrics.recordRateEventConsumed("unparseable");
            ack.acknowledge();
            return;
        }

        IdempotentEventProcessor.Outcome outcome = handle(event);
        ack.acknowledge();
        metrics.recordRateEventConsumed(outcome.name().toLowerCase(Locale.ROOT));
        log.info("Rate event {}: eventId={}, currency={}, date={}",
                outcome, event.getEventId(), event.getCurrency(), event.getRateDate());
    }

    IdempotentEventProcessor.Outcome handle(RateRecordedEvent event) {
        return eventProcessor.processEvent(
            event.getEventId(), RateRecordedEvent.EVENT_TYPE,
            AGGREGATE_TYPE, event.aggregateId(),
            CONSUMER_GROUP,
            () -> rateService.recordRate(
                event.getCurrency(),
                event.getRateDate(),
                perUnit(event.getBuyingRate(), event.effectiveUnit()),
                perUnit(event.getSellingRate(), event.effectiveUnit()),
                event.getSource()
            )
        );
    }

    private static BigDecimal perUnit(BigDecimal rate, int unit) {
        if (rate == null || unit == 1) {
            return rate;
        }
        return rate.divide(BigDecimal.valueOf(unit), Amounts.RATE_SCALE, Amounts.ROUNDING);
    }

    private RateRecordedEvent parse(String json) {
        try {
            RateRecordedEvent event = objectMapper.readValue(json, RateRecordedEvent.class);
            if (event.getEventId() == null) {
                log.warn("Rate event without event_id, dropping: {}", json);
                return null;
            }
            return event;
        } catch (JsonProcessingException e) {
            log.warn("Could not parse rate event, dropping: {}", e.getOriginalMessage());
            return null;
        }
    }
}
