package com.flagship.currency_ledger.outbox;

import com.flagship.currency_ledger.account.Account;
import com.flagship.currency_ledger.payment.Payment;
import com.flagship.currency_ledger.payment.PaymentChannel;
import com.flagship.currency_ledger.payment.PaymentCommand;
import com.flagship.currency_ledger.payment.PaymentLedgerService;
import com.flagship.currency_ledger.payment.PaymentType;
import com.flagship.currency_ledger.support.FullStackIntegrationTest;
import com.flagship.currency_ledger.transfer.Transfer;
import com.flagship.currency_ledger.transfer.TransferCommand;
import com.flagship.currency_ledger.transfer.TransferService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox events reach Kafka keyed by aggregate id and are then marked published.
 */
class OutboxPublisherTest extends FullStackIntegrationTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private PaymentLedgerService paymentLedgerService;

    @Autowired
    private TransferService transferService;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    private List<ConsumerRecord<String, String>> pollFor(KafkaConsumer<String, String> consumer, String key,
                                                         int expected) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 30_000;
        while (matching.size() < expected && System.currentTimeMillis() < deadline) {
            for (ConsumerRecord<String, String> record : consumer.poll(Duration.ofMillis(500))) {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            }
        }
        return matching;
    }

    private boolean allPublished(String aggregateType, UUID aggregateId) {
        List<OutboxEvent> events = outboxService.getEventsForAggregate(aggregateType, aggregateId);
        return !events.isEmpty() && events.stream().allMatch(OutboxEvent::isPublished);
    }

    @Test
    @DisplayName("Recorded payment is published to Kafka and marked published")
    void testPaymentEvent_PublishedToKafka() throws Exception {
        printTestHeader("Outbox Publisher - Payment");

        Account account = openAccount("TRY", "100");
        try (KafkaConsumer<String, String> consumer = subscribe(ledgerEventsTopic)) {
            Payment payment = paymentLedgerService.createPayment(PaymentCommand.builder()
                    .type(PaymentType.INCOMING)
                    .channel(PaymentChannel.BANK_TRANSFER)
                    .amount(new BigDecimal("75"))
                    .currency("TRY")
                    .accountId(account.getId())
                    .build());
            System.out.println("Payment: " + payment.getPaymentNo());

            List<ConsumerRecord<String, String>> records = pollFor(consumer, payment.getId().toString(), 1);

            assertEquals(1, records.size(), "Payment event should be on the topic");
            assertTrue(records.get(0).value().contains(payment.getPaymentNo()));
            assertTrue(waitUntil(() -> allPublished(PaymentLedgerService.AGGREGATE_TYPE, payment.getId()), 10_000),
                    "Outbox event should be marked published");
        }

        printSuccess("Payment event delivered and marked published");
    }

    @Test
    @DisplayName("Events of one payment keep their order on one partition")
    void testPaymentEvents_KeepOrder() throws Exception {
        printTestHeader("Outbox Publisher - Ordering");

        Account account = openAccount("TRY", "0");
        try (KafkaConsumer<String, String> consumer = subscribe(ledgerEventsTopic)) {
            Payment payment = paymentLedgerService.createPayment(PaymentCommand.builder()
                    .type(PaymentType.INCOMING)
                    .channel(PaymentChannel.CASH)
                    .amount(new BigDecimal("10"))
                    .currency("TRY")
                    .accountId(account.getId())
                    .build());
            paymentLedgerService.updatePayment(payment.getId(), PaymentCommand.builder()
                    .amount(new BigDecimal("12"))
                    .build());

            List<ConsumerRecord<String, String>> records = pollFor(consumer, payment.getId().toString(), 2);

            assertEquals(2, records.size());
            assertEquals(records.get(0).partition(), records.get(1).partition());
            assertTrue(records.get(0).offset() < records.get(1).offset());
            assertTrue(records.get(0).value().contains("\"amount\":10"));
            assertTrue(records.get(1).value().contains("12"));
        }

        printSuccess("Recorded event precedes the update on the same partition");
    }

    @Test
    @DisplayName("Completed transfer is published under the transfer id")
    void testTransferEvent_PublishedToKafka() throws Exception {
        Account from = openAccount("TRY", "100");
        Account to = openAccount("TRY", "0");

        try (KafkaConsumer<String, String> consumer = subscribe(ledgerEventsTopic)) {
            Transfer transfer = transferService.transfer(TransferCommand.builder()
                    .fromAccountId(from.getId())
                    .toAccountId(to.getId())
                    .fromAmount(new BigDecimal("40"))
                    .build());

            List<ConsumerRecord<String, String>> records = pollFor(consumer, transfer.getId().toString(), 1);

            assertEquals(1, records.size());
            assertTrue(records.get(0).value().contains(transfer.getTransferNo()));
            assertTrue(waitUntil(() -> allPublished(TransferService.AGGREGATE_TYPE, transfer.getId()), 10_000));
        }
    }
}
