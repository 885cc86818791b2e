package com.flagship.currency_ledger.rate;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Rate store over the {@code exchange_rates} table. Plain JDBC: rates are
 * looked up by (currency, date) far more often than they are written.
 */
@Repository
public class ExchangeRateRepository {

    private static final String COLUMNS =
        "currency, rate_date, buying_rate, selling_rate, source, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public ExchangeRateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<ExchangeRate> findByCurrencyAndDate(String currency, LocalDate date) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM exchange_rates WHERE currency = ? AND rate_date = ?",
            rowMapper(),
            currency,
            date
        ).stream().findFirst();
    }

    /**
     * Most recent quote dated on or before {@code date}.
     */
    public Optional<ExchangeRate> findLatestOnOrBefore(String currency, LocalDate date) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM exchange_rates WHERE currency = ? AND rate_date <= ? " +
            "ORDER BY rate_date DESC LIMIT 1",
            rowMapper(),
            currency,
            date
        ).stream().findFirst();
    }

    public List<ExchangeRate> findInRange(String currency, LocalDate from, LocalDate to) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM exchange_rates WHERE currency = ? AND rate_date BETWEEN ? AND ? " +
            "ORDER BY rate_date DESC",
            rowMapper(),
            currency,
            from,
            to
        );
    }

    /**
     * Inserts the quote or overwrites the existing one for the same (currency, date).
     */
    public ExchangeRate upsert(String currency, LocalDate date, BigDecimal buying,
                               BigDecimal selling, String source) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO exchange_rates (currency, rate_date, buying_rate, selling_rate, source) " +
            "VALUES (?, ?, ?, ?, ?) " +
            "ON CONFLICT (currency, rate_date) DO UPDATE SET " +
            "buying_rate = EXCLUDED.buying_rate, selling_rate = EXCLUDED.selling_rate, " +
            "source = EXCLUDED.source, updated_at = CURRENT_TIMESTAMP " +
            "RETURNING " + COLUMNS,
            rowMapper(),
            currency,
            date,
            buying,
            selling,
            source
        );
    }

    /**
     * Newest rate date across all currencies, used for freshness checks.
     */
    public Optional<LocalDate> findNewestRateDate() {
        LocalDate newest = jdbcTemplate.queryForObject(
            "SELECT MAX(rate_date) FROM exchange_rates", LocalDate.class);
        return Optional.ofNullable(newest);
    }

    private RowMapper<ExchangeRate> rowMapper() {
        return (rs, rowNum) -> new ExchangeRate(
            rs.getString("currency"),
            rs.getObject("rate_date", LocalDate.class),
            rs.getBigDecimal("buying_rate"),
            rs.getBigDecimal("selling_rate"),
            rs.getString("source"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static java.time.Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
