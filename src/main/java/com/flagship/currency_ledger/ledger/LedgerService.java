package com.flagship.currency_ledger.ledger;

import com.flagship.currency_ledger.common.exception.NotFoundException;
import com.flagship.currency_ledger.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Moves account balances and keeps the append-only trail of balance events.
 *
 * Invariants:
 * 1. Every balance change writes exactly one event carrying the signed delta
 *    and the resulting balance, in the same statement pair.
 * 2. Events are never updated or deleted (a database trigger rejects both).
 * 3. For every account, balance minus the sum of its event amounts is zero.
 *
 * JDBC rather than JPA, so the balance update and its snapshot read happen
 * in one {@code UPDATE ... RETURNING} round trip.
 */
@Service
@Slf4j
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Applies {@code delta} to the account and records the matching balance event.
     *
     * Must run inside the caller's transaction, after the caller has locked the
     * account row through {@code AccountService.lockInOrder}.
     *
     * @return the recorded event, including the balance after the change
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceEvent post(UUID accountId, BigDecimal delta, BalanceEventType eventType,
                             String referenceType, UUID referenceId, String description) {
        if (delta == null) {
            throw new ValidationException("Balance delta is required");
        }

        List<BigDecimal> updated = jdbcTemplate.queryForList(
            "UPDATE accounts SET balance = balance + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? RETURNING balance",
            BigDecimal.class,
            delta,
            accountId
        );
        if (updated.isEmpty()) {
            throw NotFoundException.of("Account", accountId);
        }
        BigDecimal balanceAfter = updated.get(0);

        BalanceEvent event = jdbcTemplate.queryForObject(
            "INSERT INTO account_balance_events " +
            "(account_id, event_type, amount, balance_after, reference_type, reference_id, description) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?) " +
            "RETURNING id, sequence_number, account_id, event_type, amount, balance_after, " +
            "reference_type, reference_id, description, occurred_at",
            eventRowMapper(),
            accountId,
            eventType.name(),
            delta,
            balanceAfter,
            referenceType,
            referenceId,
            description
        );

        log.debug("Posted balance event: accountId={}, type={}, amount={}, balanceAfter={}",
                accountId, eventType, delta, balanceAfter);
        return event;
    }

    /**
     * Balance events of one account, newest first.
     */
    @Transactional(readOnly = true)
    public BalanceHistoryPage history(UUID accountId, int page, int size) {
        if (page < 0 || size <= 0 || size > 500) {
            throw new ValidationException("Page must be >= 0 and size between 1 and 500");
        }
        requireAccount(accountId);

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM account_balance_events WHERE account_id = ?",
            Long.class,
            accountId
        );
        List<BalanceEvent> events = jdbcTemplate.query(
            "SELECT id, sequence_number, account_id, event_type, amount, balance_after, " +
            "reference_type, reference_id, description, occurred_at " +
            "FROM account_balance_events WHERE account_id = ? " +
            "ORDER BY sequence_number DESC LIMIT ? OFFSET ?",
            eventRowMapper(),
            accountId,
            size,
            (long) page * size
        );
        return new BalanceHistoryPage(accountId, page, size, total != null ? total : 0L, events);
    }

    /**
     * Events written for one payment or transfer, oldest first.
     */
    @Transactional(readOnly = true)
    public List<BalanceEvent> eventsForReference(String referenceType, UUID referenceId) {
        return jdbcTemplate.query(
            "SELECT id, sequence_number, account_id, event_type, amount, balance_after, " +
            "reference_type, reference_id, description, occurred_at " +
            "FROM account_balance_events WHERE reference_type = ? AND reference_id = ? " +
            "ORDER BY sequence_number",
            eventRowMapper(),
            referenceType,
            referenceId
        );
    }

    @Transactional(readOnly = true)
    public Reconciliation reconcile(UUID accountId) {
        BigDecimal balance = requireAccount(accountId);

        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) AS event_sum, COUNT(*) AS event_count " +
            "FROM account_balance_events WHERE account_id = ?",
            (rs, rowNum) -> {
                BigDecimal eventSum = rs.getBigDecimal("event_sum");
                return new Reconciliation(accountId, balance, eventSum,
                        rs.getLong("event_count"), balance.subtract(eventSum));
            },
            accountId
        );
    }

    private BigDecimal requireAccount(UUID accountId) {
        List<BigDecimal> balance = jdbcTemplate.queryForList(
            "SELECT balance FROM accounts WHERE id = ?",
            BigDecimal.class,
            accountId
        );
        if (balance.isEmpty()) {
            throw NotFoundException.of("Account", accountId);
        }
        return balance.get(0);
    }

    private RowMapper<BalanceEvent> eventRowMapper() {
        return (rs, rowNum) -> {
            String referenceId = rs.getString("reference_id");
            Timestamp occurredAt = rs.getTimestamp("occurred_at");
            return new BalanceEvent(
                UUID.fromString(rs.getString("id")),
                rs.getLong("sequence_number"),
                UUID.fromString(rs.getString("account_id")),
                BalanceEventType.valueOf(rs.getString("event_type")),
                rs.getBigDecimal("amount"),
                rs.getBigDecimal("balance_after"),
                rs.getString("reference_type"),
                referenceId != null ? UUID.fromString(referenceId) : null,
                rs.getString("description"),
                occurredAt != null ? occurredAt.toInstant() : null
            );
        };
    }
}
