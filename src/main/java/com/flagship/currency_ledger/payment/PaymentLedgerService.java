package com.flagship.currency_ledger.payment;

import com.flagship.currency_ledger.account.Account;
import com.flagship.currency_ledger.account.AccountService;
import com.flagship.currency_ledger.common.Amounts;
import com.flagship.currency_ledger.common.DocumentNumberGenerator;
import com.flagship.currency_ledger.common.exception.CurrencyMismatchException;
import com.flagship.currency_ledger.common.exception.NotFoundException;
import com.flagship.currency_ledger.common.exception.RateUnavailableException;
import com.flagship.currency_ledger.common.exception.ValidationException;
import com.flagship.currency_ledger.confirmation.ConfirmationTokenService;
import com.flagship.currency_ledger.confirmation.DeletionRequest;
import com.flagship.currency_ledger.config.LedgerProperties;
import com.flagship.currency_ledger.ledger.BalanceEvent;
import com.flagship.currency_ledger.ledger.BalanceEventType;
import com.flagship.currency_ledger.ledger.LedgerService;
import com.flagship.currency_ledger.observability.CorrelationContext;
import com.flagship.currency_ledger.observability.LedgerMetrics;
import com.flagship.currency_ledger.outbox.OutboxService;
import com.flagship.currency_ledger.payment.event.PaymentDeletedEvent;
import com.flagship.currency_ledger.payment.event.PaymentRecordedEvent;
import com.flagship.currency_ledger.payment.event.PaymentUpdatedEvent;
import com.flagship.currency_ledger.rate.ExchangeRate;
import com.flagship.currency_ledger.rate.ExchangeRateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Records, edits and deletes payments. Each payment moves the balance of one
 * account by {@code +amount} (incoming) or {@code -amount} (outgoing).
 *
 * Every operation is a single transaction: account lock, payment row, balance
 * event and outbox event commit together or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentLedgerService {

    public static final String AGGREGATE_TYPE = "Payment";

    private final PaymentRepository repository;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final ExchangeRateService rateService;
    private final DocumentNumberGenerator documentNumbers;
    private final ConfirmationTokenService confirmationTokens;
    private final OutboxService outboxService;
    private final LedgerProperties properties;
    private final Clock clock;
    private final LedgerMetrics metrics;

    @Transactional
    public Payment createPayment(PaymentCommand command) {
        return measured("create", command.getType(), command.getCurrency(), () -> {
            validateRequiredFields(command.getType(), command.getChannel(), command.getAmount(),
                    command.getCurrency(), command.getAccountId());

            String currency = Amounts.normalizeCurrency(command.getCurrency());
            Instant paymentDate = command.getPaymentDate() != null ? command.getPaymentDate() : clock.instant();

            Account account = accountService.lockInOrder(List.of(command.getAccountId()))
                    .get(command.getAccountId());
            requireUsable(account, currency);
            BigDecimal rate = resolveRate(currency, command.getExchangeRate(), paymentDate);

            BigDecimal amount = Amounts.amount(command.getAmount());
            Payment payment = new Payment(
                UUID.randomUUID(),
                documentNumbers.next(command.getType().getDirection().getDocumentPrefix()),
                command.getType(),
                command.getChannel(),
                amount,
                currency,
                rate,
                Amounts.amount(amount.multiply(rate)),
                command.getContactId(),
                account.getId(),
                command.getDescription(),
                command.getReferenceNo(),
                paymentDate,
                null,
                null
            );
            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, payment.getId().toString());
            MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, account.getId().toString());

            Payment saved = repository.save(PaymentEntity.fromDomain(payment)).toDomain();
            BalanceEvent balanceEvent = ledgerService.post(account.getId(), saved.balanceEffect(),
                    BalanceEventType.PAYMENT, AGGREGATE_TYPE, saved.getId(), "Payment " + saved.getPaymentNo());
            outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(), PaymentRecordedEvent.EVENT_TYPE,
                    PaymentRecordedEvent.from(saved, balanceEvent.getBalanceAfter()));

            log.info("Payment recorded: paymentNo={}, type={}, amount={} {}, rate={}, balanceAfter={}",
                    saved.getPaymentNo(), saved.getType().getCode(), amount, currency, rate,
                    balanceEvent.getBalanceAfter());
            return saved;
        });
    }

    /**
     * Re-books a payment: the old effect is reversed on the old account and the
     * new effect applied on the (possibly different) new account. Submitting the
     * stored values unchanged leaves every balance where it was.
     */
    @Transactional
    public Payment updatePayment(UUID id, PaymentCommand changes) {
        return measured("update", changes.getType(), changes.getCurrency(), () -> {
            PaymentEntity entity = repository.findByIdForUpdate(id)
                    .orElseThrow(() -> NotFoundException.of(AGGREGATE_TYPE, id));
            Payment previous = entity.toDomain();
            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, id.toString());

            PaymentType type = orElse(changes.getType(), previous.getType());
            PaymentChannel channel = orElse(changes.getChannel(), previous.getChannel());
            BigDecimal requestedAmount = orElse(changes.getAmount(), previous.getAmount());
            String currency = Amounts.normalizeCurrency(orElse(changes.getCurrency(), previous.getCurrency()));
            UUID accountId = orElse(changes.getAccountId(), previous.getAccountId());
            Instant paymentDate = orElse(changes.getPaymentDate(), previous.getPaymentDate());
            validateRequiredFields(type, channel, requestedAmount, currency, accountId);

            Map<UUID, Account> locked = accountService.lockInOrder(List.of(previous.getAccountId(), accountId));
            Account account = locked.get(accountId);
            requireUsable(account, currency);

            BigDecimal rate;
            if (changes.getExchangeRate() == null
                    && currency.equals(previous.getCurrency())
                    && paymentDate.equals(previous.getPaymentDate())) {
                rate = previous.getExchangeRate();
            } else {
                rate = resolveRate(currency, changes.getExchangeRate(), paymentDate);
            }

            BigDecimal amount = Amounts.amount(requestedAmount);
            Payment updated = new Payment(
                previous.getId(),
                previous.getPaymentNo(),
                type,
                channel,
                amount,
                currency,
                rate,
                Amounts.amount(amount.multiply(rate)),
                orElse(changes.getContactId(), previous.getContactId()),
                accountId,
                orElse(changes.getDescription(), previous.getDescription()),
                orElse(changes.getReferenceNo(), previous.getReferenceNo()),
                paymentDate,
                previous.getCreatedAt(),
                previous.getUpdatedAt()
            );

            ledgerService.post(previous.getAccountId(), previous.balanceEffect().negate(),
                    BalanceEventType.PAYMENT_REVERSAL, AGGREGATE_TYPE, id,
                    "Reversal for update of " + previous.getPaymentNo());
            ledgerService.post(accountId, updated.balanceEffect(), BalanceEventType.PAYMENT,
                    AGGREGATE_TYPE, id, "Payment " + previous.getPaymentNo() + " (updated)");

            entity.updateFromDomain(updated);
            Payment saved = repository.saveAndFlush(entity).toDomain();
            outboxService.saveEvent(AGGREGATE_TYPE, id, PaymentUpdatedEvent.EVENT_TYPE,
                    PaymentUpdatedEvent.from(previous, saved));

            log.info("Payment updated: paymentNo={}, previousEffect={} on {}, newEffect={} on {}",
                    saved.getPaymentNo(), previous.balanceEffect(), previous.getAccountId(),
                    saved.balanceEffect(), accountId);
            return saved;
        });
    }

    /**
     * First step of a deletion: issues the confirmation token that
     * {@link #deletePayment} requires.
     */
    @Transactional
    public DeletionRequest requestDeletion(UUID id) {
        if (!repository.existsById(id)) {
            throw NotFoundException.of(AGGREGATE_TYPE, id);
        }
        return confirmationTokens.requestDeletion(AGGREGATE_TYPE, id);
    }

    /**
     * Second step of a deletion: burns the token, reverses the balance effect and
     * removes the payment row. An invalid token leaves everything untouched.
     */
    @Transactional
    public void deletePayment(UUID id, String confirmationToken) {
        measured("delete", null, null, () -> {
            PaymentEntity entity = repository.findByIdForUpdate(id)
                    .orElseThrow(() -> NotFoundException.of(AGGREGATE_TYPE, id));
            Payment payment = entity.toDomain();
            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, id.toString());

            confirmationTokens.consume(AGGREGATE_TYPE, id, confirmationToken);
            accountService.lockInOrder(List.of(payment.getAccountId()));

            BalanceEvent reversal = ledgerService.post(payment.getAccountId(), payment.balanceEffect().negate(),
                    BalanceEventType.PAYMENT_REVERSAL, AGGREGATE_TYPE, id,
                    "Reversal for deletion of " + payment.getPaymentNo());
            repository.delete(entity);
            outboxService.saveEvent(AGGREGATE_TYPE, id, PaymentDeletedEvent.EVENT_TYPE,
                    PaymentDeletedEvent.from(payment, reversal.getBalanceAfter()));

            log.info("Payment deleted: paymentNo={}, reversedEffect={}, balanceAfter={}",
                    payment.getPaymentNo(), payment.balanceEffect().negate(), reversal.getBalanceAfter());
            return payment;
        });
    }

    @Transactional(readOnly = true)
    public Payment getPayment(UUID id) {
        return repository.findById(id)
                .map(PaymentEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of(AGGREGATE_TYPE, id));
    }

    /**
     * Payments matching {@code filter}, newest payment date first.
     */
    @Transactional(readOnly = true)
    public Page<Payment> listPayments(PaymentFilter filter, int page, int size) {
        if (page < 0 || size <= 0 || size > 500) {
            throw new ValidationException("Page must be >= 0 and size between 1 and 500");
        }
        PageRequest pageRequest = PageRequest.of(page, size,
                Sort.by(Sort.Order.desc("paymentDate"), Sort.Order.desc("paymentNo")));
        return repository.findAll(filter.toSpecification(), pageRequest).map(PaymentEntity::toDomain);
    }

    /**
     * Rate of 1 unit of {@code currency} in the base currency for a payment:
     * the explicit rate when given, 1 for the base currency, otherwise the
     * stored rate on the payment date or the latest one before it.
     */
    BigDecimal resolveRate(String currency, BigDecimal explicitRate, Instant paymentDate) {
        boolean base = rateService.isBaseCurrency(currency);
        if (explicitRate != null) {
            if (explicitRate.signum() <= 0) {
                throw new ValidationException("Exchange rate must be positive: " + explicitRate);
            }
            if (base && explicitRate.compareTo(BigDecimal.ONE) != 0) {
                throw new ValidationException("Payments in " + currency + " must use an exchange rate of 1");
            }
            return Amounts.rate(explicitRate);
        }
        if (base) {
            return Amounts.rate(BigDecimal.ONE);
        }
        LocalDate day = LocalDate.ofInstant(paymentDate, properties.getZone());
        return rateService.getRateOnOrBefore(currency, day)
                .map(ExchangeRate::getBuyingRate)
                .map(Amounts::rate)
                .orElseThrow(() -> {
                    metrics.recordRateMiss(currency);
                    return new RateUnavailableException(currency, day);
                });
    }

    private void validateRequiredFields(PaymentType type, PaymentChannel channel, BigDecimal amount,
                                        String currency, UUID accountId) {
        if (type == null) {
            throw new ValidationException("Payment type is required");
        }
        if (channel == null) {
            throw new ValidationException("Payment channel is required");
        }
        if (currency == null || currency.isBlank()) {
            throw new ValidationException("Currency is required");
        }
        if (accountId == null) {
            throw new ValidationException("Account is required");
        }
        Amounts.requirePositiveAmount(amount, "Payment amount");
    }

    private void requireUsable(Account account, String currency) {
        if (!account.getCurrency().equals(currency)) {
            throw new CurrencyMismatchException(account.getId(), account.getCurrency(), currency);
        }
        if (!account.isActive()) {
            throw new ValidationException("Account " + account.getCode() + " is inactive");
        }
    }

    private static <T> T orElse(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private <T> T measured(String operation, PaymentType type, String currency, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        String typeTag = type != null ? type.getCode() : "any";
        try {
            T result = body.get();
            metrics.recordPayment(operation, typeTag, currency, "success");
            return result;
        } catch (RuntimeException e) {
            metrics.recordPayment(operation, typeTag, currency, e.getClass().getSimpleName());
            log.warn("Payment {} failed: {}", operation, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("payment_" + operation, System.currentTimeMillis() - startTime);
        }
    }
}
