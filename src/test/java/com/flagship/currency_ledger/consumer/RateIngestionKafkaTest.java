package com.flagship.currency_ledger.consumer;

import com.flagship.currency_ledger.rate.ExchangeRate;
import com.flagship.currency_ledger.rate.ExchangeRateService;
import com.flagship.currency_ledger.support.FullStackIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Quotes published on the rates topic end up in the rate store through the listener.
 */
class RateIngestionKafkaTest extends FullStackIntegrationTest {

    @Autowired
    private KafkaTemplate<String, String> kafkaTemplate;

    @Autowired
    private ExchangeRateService rateService;

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Value("${kafka.topic.exchange-rates:exchange-rates}")
    private String exchangeRatesTopic;

    @Test
    @DisplayName("Published quote is stored once even when delivered twice")
    void testQuoteFromTopic_StoredOnce() throws Exception {
        printTestHeader("Rate Ingestion Over Kafka");

        String currency = "Z" + UUID.randomUUID().toString().replace("-", "").substring(0, 7).toUpperCase(Locale.ROOT);
        LocalDate date = LocalDate.of(2024, 6, 3);
        UUID eventId = UUID.randomUUID();
        String json = "{\"event_id\":\"" + eventId + "\",\"currency\":\"" + currency + "\","
                + "\"rate_date\":\"" + date + "\",\"buying_rate\":34.1,\"selling_rate\":34.3,"
                + "\"source\":\"central-bank\"}";

        kafkaTemplate.send(exchangeRatesTopic, currency, json).get();
        kafkaTemplate.send(exchangeRatesTopic, currency, json).get();

        assertTrue(waitUntil(() -> rateService.getRate(currency, date).isPresent(), 30_000),
                "Quote should be stored by the listener");
        assertTrue(waitUntil(() -> eventProcessor.isAlreadyProcessed(eventId, RateEventConsumer.CONSUMER_GROUP),
                10_000));

        ExchangeRate stored = rateService.getRate(currency, date).orElseThrow();
        assertEquals(0, new BigDecimal("34.1").compareTo(stored.getBuyingRate()));
        assertEquals(0, new BigDecimal("34.3").compareTo(stored.getSellingRate()));

        printSuccess("Quote for " + currency + " ingested from the topic");
    }
}
