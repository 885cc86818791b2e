package com.flagship.currency_ledger.transfer;

import com.flagship.currency_ledger.account.Account;
import com.flagship.currency_ledger.account.AccountService;
import com.flagship.currency_ledger.common.Amounts;
import com.flagship.currency_ledger.common.DocumentNumberGenerator;
import com.flagship.currency_ledger.common.exception.NotFoundException;
import com.flagship.currency_ledger.common.exception.ValidationException;
import com.flagship.currency_ledger.config.LedgerProperties;
import com.flagship.currency_ledger.ledger.BalanceEvent;
import com.flagship.currency_ledger.ledger.BalanceEventType;
import com.flagship.currency_ledger.ledger.LedgerService;
import com.flagship.currency_ledger.observability.CorrelationContext;
import com.flagship.currency_ledger.observability.LedgerMetrics;
import com.flagship.currency_ledger.outbox.OutboxService;
import com.flagship.currency_ledger.rate.ExchangeRateService;
import com.flagship.currency_ledger.transfer.event.TransferCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Moves money between two accounts, converting between their currencies.
 *
 * Both accounts are locked in ascending id order, so two transfers in opposite
 * directions over the same pair serialize instead of deadlocking. The debit, the
 * credit, the transfer row and both balance events commit together.
 *
 * Balances may go negative; overdraft policy belongs to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferService {

    public static final String AGGREGATE_TYPE = "Transfer";
    static final String DOCUMENT_PREFIX = "VRM";

    private final TransferRepository repository;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final ExchangeRateService rateService;
    private final DocumentNumberGenerator documentNumbers;
    private final OutboxService outboxService;
    private final LedgerProperties properties;
    private final Clock clock;
    private final LedgerMetrics metrics;

    /**
     * Books a transfer. The credited amount comes from, in order of precedence:
     * <ol>
     *   <li>{@code toAmount} when supplied; the stored rate is then {@code toAmount / fromAmount}
     *       and any {@code exchangeRate} in the command is not used</li>
     *   <li>{@code fromAmount × exchangeRate} when a rate is supplied</li>
     *   <li>{@code fromAmount ×} the stored cross rate, taken on the transfer date when one is
     *       given (falling back to the newest earlier quote), otherwise the latest rates</li>
     * </ol>
     */
    @Transactional
    public Transfer transfer(TransferCommand command) {
        long startTime = System.currentTimeMillis();
        String fromCurrency = null;
        String toCurrency = null;
        try {
            validate(command);

            Map<UUID, Account> locked = accountService.lockInOrder(
                    List.of(command.getFromAccountId(), command.getToAccountId()));
            Account from = locked.get(command.getFromAccountId());
            Account to = locked.get(command.getToAccountId());
            fromCurrency = from.getCurrency();
            toCurrency = to.getCurrency();
            requireActive(from);
            requireActive(to);

            BigDecimal fromAmount = Amounts.amount(command.getFromAmount());
            Instant transferDate = command.getTransferDate() != null ? command.getTransferDate() : clock.instant();
            BigDecimal rate;
            BigDecimal toAmount;
            if (fromCurrency.equals(toCurrency)) {
                if (command.getToAmount() != null && command.getToAmount().compareTo(command.getFromAmount()) != 0) {
                    throw new ValidationException("Same-currency transfers must credit exactly the debited amount");
                }
                if (command.getExchangeRate() != null && command.getExchangeRate().compareTo(BigDecimal.ONE) != 0) {
                    throw new ValidationException("Same-currency transfers must use an exchange rate of 1");
                }
                rate = Amounts.rate(BigDecimal.ONE);
                toAmount = fromAmount;
            } else if (command.getToAmount() != null) {
                if (command.getExchangeRate() != null) {
                    log.debug("Target amount {} supplied; exchange rate {} not used",
                            command.getToAmount(), command.getExchangeRate());
                }
                toAmount = Amounts.amount(command.getToAmount());
                rate = toAmount.divide(fromAmount, Amounts.RATE_SCALE, Amounts.ROUNDING);
            } else {
                BigDecimal resolved = command.getExchangeRate() != null
                        ? command.getExchangeRate()
                        : resolveRate(fromCurrency, toCurrency, command.getTransferDate());
                rate = Amounts.rate(resolved);
                toAmount = Amounts.amount(fromAmount.multiply(rate));
            }
            if (toAmount.signum() <= 0) {
                throw new ValidationException("Converted amount rounds to zero for " + fromAmount + " " + fromCurrency);
            }

            Transfer transfer = new Transfer(
                UUID.randomUUID(),
                documentNumbers.next(DOCUMENT_PREFIX),
                from.getId(),
                to.getId(),
                fromAmount,
                toAmount,
                rate,
                command.getDescription(),
                command.getReferenceNo(),
                transferDate,
                null
            );
            MDC.put(CorrelationContext.TRANSFER_ID_MDC_KEY, transfer.getId().toString());

            Transfer saved = repository.save(TransferEntity.fromDomain(transfer)).toDomain();
            BalanceEvent debit = ledgerService.post(from.getId(), fromAmount.negate(), BalanceEventType.TRANSFER_OUT,
                    AGGREGATE_TYPE, saved.getId(), "Transfer " + saved.getTransferNo() + " to " + to.getCode());
            BalanceEvent credit = ledgerService.post(to.getId(), toAmount, BalanceEventType.TRANSFER_IN,
                    AGGREGATE_TYPE, saved.getId(), "Transfer " + saved.getTransferNo() + " from " + from.getCode());
            outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(), TransferCompletedEvent.EVENT_TYPE,
                    TransferCompletedEvent.from(saved, fromCurrency, debit.getBalanceAfter(),
                            toCurrency, credit.getBalanceAfter()));

            metrics.recordTransfer(fromCurrency, toCurrency, "success");
            log.info("Transfer completed: transferNo={}, {} {} -> {} {}, rate={}",
                    saved.getTransferNo(), fromAmount, fromCurrency, toAmount, toCurrency, rate);
            return saved;

        } catch (RuntimeException e) {
            metrics.recordTransfer(fromCurrency, toCurrency, e.getClass().getSimpleName());
            log.warn("Transfer failed: from={}, to={}, error={}",
                    command.getFromAccountId(), command.getToAccountId(), e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("transfer", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TRANSFER_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Transfer getTransfer(UUID id) {
        return repository.findById(id)
                .map(TransferEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of(AGGREGATE_TYPE, id));
    }

    /**
     * Transfers touching {@code accountId} on either side, or all transfers when null. Newest first.
     */
    @Transactional(readOnly = true)
    public List<Transfer> listTransfers(UUID accountId) {
        List<TransferEntity> entities = accountId != null
                ? repository.findByAccount(accountId)
                : repository.findAllByOrderByTransferDateDesc();
        return entities.stream().map(TransferEntity::toDomain).toList();
    }

    private BigDecimal resolveRate(String fromCurrency, String toCurrency, Instant transferDate) {
        if (transferDate == null) {
            return rateService.crossRate(fromCurrency, toCurrency, null);
        }
        return rateService.crossRateAsOf(fromCurrency, toCurrency,
                LocalDate.ofInstant(transferDate, properties.getZone()));
    }

    private void validate(TransferCommand command) {
        if (command.getFromAccountId() == null || command.getToAccountId() == null) {
            throw new ValidationException("Both source and target accounts are required");
        }
        if (command.getFromAccountId().equals(command.getToAccountId())) {
            throw new ValidationException("Cannot transfer to the same account");
        }
        Amounts.requirePositiveAmount(command.getFromAmount(), "Transfer amount");
        if (command.getToAmount() != null) {
            Amounts.requirePositiveAmount(command.getToAmount(), "Target amount");
        }
        if (command.getExchangeRate() != null && command.getExchangeRate().signum() <= 0) {
            throw new ValidationException("Exchange rate must be positive, got " + command.getExchangeRate());
        }
    }

    private void requireActive(Account account) {
        if (!account.isActive()) {
            throw new ValidationException("Account " + account.getCode() + " is inactive");
        }
    }
}
