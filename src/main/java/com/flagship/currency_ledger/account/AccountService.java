package com.flagship.currency_ledger.account;

import com.flagship.currency_ledger.common.Amounts;
import com.flagship.currency_ledger.common.exception.ConcurrencyConflictException;
import com.flagship.currency_ledger.common.exception.NotFoundException;
import com.flagship.currency_ledger.common.exception.ValidationException;
import com.flagship.currency_ledger.config.LedgerProperties;
import com.flagship.currency_ledger.ledger.BalanceEventType;
import com.flagship.currency_ledger.ledger.LedgerService;
import com.flagship.currency_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Account lifecycle, reads, and the row-locking protocol every balance write goes through.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    static final String REFERENCE_TYPE = "Account";

    private final AccountRepository repository;
    private final LedgerService ledgerService;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    /**
     * Opens an account at zero and, when {@code openingBalance} is non-zero,
     * posts it as an {@code OPENING} balance event.
     */
    @Transactional
    public Account openAccount(String code, String name, String currency, AccountType type,
                               UUID companyId, BigDecimal openingBalance) {
        String currencyCode = Amounts.normalizeCurrency(currency);
        if (code == null || code.isBlank() || name == null || name.isBlank()) {
            throw new ValidationException("Account code and name are required");
        }
        if (currencyCode == null || currencyCode.isBlank()) {
            throw new ValidationException("Account currency is required");
        }
        if (type == null || companyId == null) {
            throw new ValidationException("Account type and company are required");
        }
        if (repository.existsByCompanyIdAndCode(companyId, code)) {
            throw new ValidationException("Account code " + code + " already exists for company " + companyId);
        }

        AccountEntity entity = repository.saveAndFlush(
                AccountEntity.open(code, name, currencyCode, type, companyId));

        BigDecimal balance = Amounts.amount(BigDecimal.ZERO);
        if (openingBalance != null && openingBalance.signum() != 0) {
            balance = ledgerService.post(entity.getId(), Amounts.amount(openingBalance), BalanceEventType.OPENING,
                    REFERENCE_TYPE, entity.getId(), "Opening balance").getBalanceAfter();
        }

        log.info("Opened account: id={}, code={}, currency={}, type={}, openingBalance={}",
                entity.getId(), code, currencyCode, type, balance);
        return entity.toDomain().withBalance(balance);
    }

    @Transactional(readOnly = true)
    public Account getAccount(UUID id) {
        return repository.findById(id)
                .map(AccountEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Account", id));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(UUID companyId, AccountType type) {
        List<AccountEntity> entities;
        if (companyId != null && type != null) {
            entities = repository.findByCompanyIdAndTypeOrderByCodeAsc(companyId, type);
        } else if (companyId != null) {
            entities = repository.findByCompanyIdOrderByCodeAsc(companyId);
        } else if (type != null) {
            entities = repository.findByTypeOrderByCodeAsc(type);
        } else {
            entities = repository.findAllByOrderByCodeAsc();
        }
        return entities.stream().map(AccountEntity::toDomain).toList();
    }

    /**
     * Accounts are never deleted; a deactivated account keeps its history.
     */
    @Transactional
    public Account deactivateAccount(UUID id) {
        AccountEntity entity = repository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Account", id));
        entity.deactivate();
        log.info("Deactivated account: id={}, code={}", id, entity.getCode());
        return repository.saveAndFlush(entity).toDomain();
    }

    /**
     * Takes {@code SELECT ... FOR UPDATE} locks on the given accounts, always in
     * ascending id order, so two writers touching the same pair cannot deadlock.
     *
     * Duplicate and null ids are ignored. A lock wait longer than the configured
     * lock timeout, or a transaction timeout, aborts the write with a retryable
     * {@link ConcurrencyConflictException}.
     *
     * @return the locked accounts keyed by id, in lock order
     * @throws NotFoundException when any of the accounts does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<UUID, Account> lockInOrder(Collection<UUID> accountIds) {
        List<UUID> ordered = accountIds.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();

        Map<UUID, Account> locked = new LinkedHashMap<>();
        try {
            jdbcTemplate.execute("SET LOCAL lock_timeout = '" + properties.getLockTimeout().toMillis() + "ms'");
            for (UUID id : ordered) {
                AccountEntity entity = repository.findByIdForUpdate(id)
                        .orElseThrow(() -> NotFoundException.of("Account", id));
                locked.put(id, entity.toDomain());
            }
        } catch (PessimisticLockingFailureException | QueryTimeoutException | TransactionTimedOutException e) {
            metrics.recordConcurrencyConflict("lock_accounts");
            log.warn("Could not lock accounts {}: {}", ordered, e.getMessage());
            throw new ConcurrencyConflictException("Accounts " + ordered + " are busy, retry the request", e);
        }
        return locked;
    }
}
