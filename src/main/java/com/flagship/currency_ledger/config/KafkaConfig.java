package com.flagship.currency_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by the ledger: outgoing ledger events and incoming exchange rates.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.exchange-rates:exchange-rates}")
    private String exchangeRatesTopic;

    /**
     * Keyed by account or aggregate id, so 3 partitions keep per-aggregate order.
     */
    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic exchangeRatesTopic() {
        return TopicBuilder.name(exchangeRatesTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
