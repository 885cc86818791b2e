package com.flagship.currency_ledger.payment;

import com.flagship.currency_ledger.account.Account;
import com.flagship.currency_ledger.common.exception.CurrencyMismatchException;
import com.flagship.currency_ledger.common.exception.NotFoundException;
import com.flagship.currency_ledger.common.exception.RateUnavailableException;
import com.flagship.currency_ledger.common.exception.ValidationException;
import com.flagship.currency_ledger.confirmation.DeletionRequest;
import com.flagship.currency_ledger.ledger.BalanceEvent;
import com.flagship.currency_ledger.ledger.BalanceEventType;
import com.flagship.currency_ledger.ledger.LedgerService;
import com.flagship.currency_ledger.outbox.OutboxEvent;
import com.flagship.currency_ledger.outbox.OutboxService;
import com.flagship.currency_ledger.payment.event.PaymentDeletedEvent;
import com.flagship.currency_ledger.payment.event.PaymentRecordedEvent;
import com.flagship.currency_ledger.payment.event.PaymentUpdatedEvent;
import com.flagship.currency_ledger.rate.ExchangeRateService;
import com.flagship.currency_ledger.support.LedgerIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payment recording against a real database: balance effects, rate resolution,
 * re-booking on update and the two-step deletion.
 */
class PaymentLedgerServiceTest extends LedgerIntegrationTest {

    @Autowired
    private PaymentLedgerService paymentLedgerService;

    @Autowired
    private ExchangeRateService rateService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    private PaymentCommand.PaymentCommandBuilder payment(PaymentType type, String amount, Account account) {
        return PaymentCommand.builder()
                .type(type)
                .channel(PaymentChannel.BANK_TRANSFER)
                .amount(new BigDecimal(amount))
                .currency(account.getCurrency())
                .accountId(account.getId());
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                "Expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Incoming payment in the base currency increases the balance at rate 1")
    void testIncomingPayment_IncreasesBalance() {
        printTestHeader("Incoming Payment - Base Currency");

        Account account = openAccount("TRY", "1000.00");
        printInput("Opening balance", account.getBalance());

        Payment payment = paymentLedgerService.createPayment(
                payment(PaymentType.INCOMING, "500.00", account).description("Invoice 42").build());

        printOutput("Payment", payment);
        printOutput("Balance", reload(account).getBalance());

        assertAmount("1500.00", reload(account).getBalance());
        assertAmount("1", payment.getExchangeRate());
        assertAmount("500.00", payment.getBaseAmount());
        assertTrue(payment.getPaymentNo().matches("PMI\\d{8}\\d{4}"),
                "Unexpected payment number " + payment.getPaymentNo());

        List<BalanceEvent> events = ledgerService.eventsForReference(PaymentLedgerService.AGGREGATE_TYPE,
                payment.getId());
        assertEquals(1, events.size());
        assertEquals(BalanceEventType.PAYMENT, events.get(0).getEventType());
        assertAmount("1500.00", events.get(0).getBalanceAfter());

        List<OutboxEvent> outbox = outboxService.getEventsForAggregate(PaymentLedgerService.AGGREGATE_TYPE,
                payment.getId());
        assertEquals(1, outbox.size());
        assertEquals(PaymentRecordedEvent.EVENT_TYPE, outbox.get(0).getEventType());

        printSuccess("Balance 1000 + 500 = 1500 with one balance event and one outbox event");
    }

    @Test
    @DisplayName("Outgoing payment uses the prefix PMO and decreases the balance")
    void testOutgoingPayment_DecreasesBalance() {
        printTestHeader("Outgoing Payment");

        Account account = openAccount("TRY", "300");
        Payment payment = paymentLedgerService.createPayment(
                payment(PaymentType.CURRENCY_SALE, "120.5", account).build());

        printOutput("Payment", payment);

        assertAmount("179.5", reload(account).getBalance());
        assertTrue(payment.getPaymentNo().startsWith("PMO"));
        assertAmount("-120.5", payment.balanceEffect());

        printSuccess("Outgoing payment subtracted from the balance");
    }

    @Test
    @DisplayName("Payment in another currency than the account is rejected")
    void testCurrencyMismatch_Rejected() {
        printTestHeader("Currency Mismatch");

        Account account = openAccount("TRY", "1000");
        PaymentCommand command = payment(PaymentType.INCOMING, "10", account).currency("USD").build();
        printInput("Command", command);

        CurrencyMismatchException e = assertThrows(CurrencyMismatchException.class,
                () -> paymentLedgerService.createPayment(command));

        printOutput("Error", e.getMessage());
        assertEquals("TRY", e.getExpectedCurrency());
        assertEquals("USD", e.getActualCurrency());
        assertAmount("1000", reload(account).getBalance());

        printSuccess("Mismatched payment rejected without touching the balance");
    }

    @Test
    @DisplayName("Missing rate for a foreign currency rolls the payment back")
    void testMissingRate_RollsBack() {
        printTestHeader("Missing Rate - Rollback");

        String currency = uniqueCurrency();
        Account account = openAccount(currency, "100");
        printInput("Currency", currency);

        assertThrows(RateUnavailableException.class, () -> paymentLedgerService.createPayment(
                payment(PaymentType.INCOMING, "50", account).build()));

        assertAmount("100", reload(account).getBalance());
        assertTrue(ledgerService.reconcile(account.getId()).isBalanced());

        printSuccess("No balance change and no orphan balance event");
    }

    @Test
    @DisplayName("Stored rate on or before the payment date values a foreign payment")
    void testForeignPayment_UsesStoredRate() {
        printTestHeader("Foreign Payment - Stored Rate");

        String currency = uniqueCurrency();
        rateService.recordRate(currency, rateService.today().minusDays(1),
                new BigDecimal("32.5"), new BigDecimal("32.7"), "manual");
        Account account = openAccount(currency, "0");

        Payment payment = paymentLedgerService.createPayment(
                payment(PaymentType.INCOMING, "10", account).build());

        printOutput("Payment", payment);

        assertAmount("32.5", payment.getExchangeRate());
        assertAmount("325", payment.getBaseAmount());
        assertAmount("10", reload(account).getBalance());

        printSuccess("Yesterday's buying rate applied");
    }

    @Test
    @DisplayName("Base currency payment with a rate other than 1 is rejected")
    void testBaseCurrencyWithRate_Rejected() {
        printTestHeader("Base Currency - Explicit Rate");

        Account account = openAccount("TRY", "0");

        assertThrows(ValidationException.class, () -> paymentLedgerService.createPayment(
                payment(PaymentType.INCOMING, "10", account).exchangeRate(new BigDecimal("2")).build()));
        assertThrows(ValidationException.class, () -> paymentLedgerService.createPayment(
                payment(PaymentType.INCOMING, "0", account).build()));

        printSuccess("Invalid payments rejected");
    }

    @Test
    @DisplayName("Payment amounts finer than the stored scale are rejected before anything is written")
    void testSubScaleAmount_Rejected() {
        printTestHeader("Sub-Scale Payment Amount");

        Account account = openAccount("TRY", "100");

        ValidationException tiny = assertThrows(ValidationException.class, () -> paymentLedgerService.createPayment(
                payment(PaymentType.INCOMING, "0.00004", account).build()));
        assertThrows(ValidationException.class, () -> paymentLedgerService.createPayment(
                payment(PaymentType.OUTGOING, "12.34567", account).build()));

        Payment payment = paymentLedgerService.createPayment(payment(PaymentType.INCOMING, "5", account).build());
        assertThrows(ValidationException.class, () -> paymentLedgerService.updatePayment(payment.getId(),
                PaymentCommand.builder().amount(new BigDecimal("0.00001")).build()));

        printOutput("Error", tiny.getMessage());
        assertAmount("105", reload(account).getBalance());
        assertEquals(2, ledgerService.history(account.getId(), 0, 10).getTotalEvents());
        assertAmount("5", paymentLedgerService.getPayment(payment.getId()).getAmount());

        printSuccess("Nothing rounded to zero reached the ledger");
    }

    @Test
    @DisplayName("Updating a payment with its own values leaves the balance unchanged")
    void testIdentityUpdate_BalanceUnchanged() {
        printTestHeader("Identity Update");

        Account account = openAccount("TRY", "1000");
        Payment created = paymentLedgerService.createPayment(
                payment(PaymentType.INCOMING, "250", account).build());

        Payment updated = paymentLedgerService.updatePayment(created.getId(), PaymentCommand.builder().build());

        printOutput("Updated", updated);

        assertAmount("1250", reload(account).getBalance());
        assertEquals(created.getPaymentNo(), updated.getPaymentNo());
        assertAmount(created.getExchangeRate().toPlainString(), updated.getExchangeRate());
        assertEquals(3, ledgerService.eventsForReference(PaymentLedgerService.AGGREGATE_TYPE,
                created.getId()).size());
        assertTrue(ledgerService.reconcile(account.getId()).isBalanced());

        printSuccess("Reversal and re-application cancel out");
    }

    @Test
    @DisplayName("Updating amount and account re-books the payment on the new account")
    void testUpdate_MovesToAnotherAccount() {
        printTestHeader("Update - Move Account");

        Account first = openAccount("TRY", "1000");
        Account second = openAccount("TRY", "50");
        Payment created = paymentLedgerService.createPayment(
                payment(PaymentType.INCOMING, "200", first).build());

        Payment updated = paymentLedgerService.updatePayment(created.getId(), PaymentCommand.builder()
                .accountId(second.getId())
                .amount(new BigDecimal("300"))
                .build());

        printOutput("First balance", reload(first).getBalance());
        printOutput("Second balance", reload(second).getBalance());

        assertAmount("1000", reload(first).getBalance());
        assertAmount("350", reload(second).getBalance());
        assertEquals(second.getId(), updated.getAccountId());
        assertAmount("300", updated.getBaseAmount());

        List<OutboxEvent> outbox = outboxService.getEventsForAggregate(PaymentLedgerService.AGGREGATE_TYPE,
                created.getId());
        assertEquals(List.of(PaymentRecordedEvent.EVENT_TYPE, PaymentUpdatedEvent.EVENT_TYPE),
                outbox.stream().map(OutboxEvent::getEventType).toList());

        printSuccess("Old effect reversed on the first account, new effect applied on the second");
    }

    @Test
    @DisplayName("Updating a payment into a mismatching account fails and changes nothing")
    void testUpdate_MismatchRollsBack() {
        printTestHeader("Update - Mismatch Rollback");

        Account account = openAccount("TRY", "100");
        Account usd = openAccount("USD", "0");
        Payment created = paymentLedgerService.createPayment(
                payment(PaymentType.INCOMING, "40", account).build());

        assertThrows(CurrencyMismatchException.class, () -> paymentLedgerService.updatePayment(created.getId(),
                PaymentCommand.builder().accountId(usd.getId()).build()));

        assertAmount("140", reload(account).getBalance());
        assertAmount("0", reload(usd).getBalance());
        assertEquals(account.getId(), paymentLedgerService.getPayment(created.getId()).getAccountId());

        printSuccess("Failed update left both accounts untouched");
    }

    @Test
    @DisplayName("Deletion requires a valid confirmation token and reverses the balance effect")
    void testDeletion_RequiresToken() {
        printTestHeader("Two-Step Deletion");

        Account account = openAccount("TRY", "1000");
        Payment created = paymentLedgerService.createPayment(
                payment(PaymentType.OUTGOING, "400", account).build());
        assertAmount("600", reload(account).getBalance());

        DeletionRequest request = paymentLedgerService.requestDeletion(created.getId());
        printOutput("Deletion request", request);
        assertEquals(PaymentLedgerService.AGGREGATE_TYPE, request.getTargetType());
        assertEquals(created.getId(), request.getTargetId());

        assertThrows(ValidationException.class,
                () -> paymentLedgerService.deletePayment(created.getId(), "not-the-token"));
        assertThrows(ValidationException.class,
                () -> paymentLedgerService.deletePayment(created.getId(), null));
        assertAmount("600", reload(account).getBalance());

        paymentLedgerService.deletePayment(created.getId(), request.getToken());

        assertAmount("1000", reload(account).getBalance());
        assertThrows(NotFoundException.class, () -> paymentLedgerService.getPayment(created.getId()));
        assertThrows(NotFoundException.class,
                () -> paymentLedgerService.deletePayment(created.getId(), request.getToken()));
        assertTrue(ledgerService.reconcile(account.getId()).isBalanced());

        List<OutboxEvent> outbox = outboxService.getEventsForAggregate(PaymentLedgerService.AGGREGATE_TYPE,
                created.getId());
        assertEquals(PaymentDeletedEvent.EVENT_TYPE, outbox.get(outbox.size() - 1).getEventType());

        printSuccess("Wrong token rejected, correct token reversed the payment once");
    }

    @Test
    @DisplayName("A token issued for one payment cannot delete another")
    void testDeletion_TokenBoundToTarget() {
        printTestHeader("Token Bound To Target");

        Account account = openAccount("TRY", "0");
        Payment first = paymentLedgerService.createPayment(payment(PaymentType.INCOMING, "10", account).build());
        Payment second = paymentLedgerService.createPayment(payment(PaymentType.INCOMING, "20", account).build());

        DeletionRequest request = paymentLedgerService.requestDeletion(first.getId());

        assertThrows(ValidationException.class,
                () -> paymentLedgerService.deletePayment(second.getId(), request.getToken()));
        assertAmount("30", reload(account).getBalance());

        paymentLedgerService.deletePayment(first.getId(), request.getToken());
        assertAmount("20", reload(account).getBalance());

        printSuccess("Token only works for the payment it was issued for");
    }

    @Test
    @DisplayName("Requesting deletion of an unknown payment is a not-found error")
    void testRequestDeletion_UnknownPayment() {
        assertThrows(NotFoundException.class,
                () -> paymentLedgerService.requestDeletion(java.util.UUID.randomUUID()));
    }
}
