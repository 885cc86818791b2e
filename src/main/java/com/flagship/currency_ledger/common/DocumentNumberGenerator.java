package com.flagship.currency_ledger.common;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Issues document numbers of the form {@code PREFIX + yyyyMMdd + 4-digit counter},
 * e.g. {@code PMI202406010001}.
 *
 * The counter row is incremented with a single upsert, so two concurrent writers
 * never receive the same number. The row lock is held until the caller commits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentNumberGenerator {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public String next(String prefix) {
        return next(prefix, LocalDate.now(clock));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String next(String prefix, LocalDate day) {
        Integer value = jdbcTemplate.queryForObject(
            "INSERT INTO document_counters (prefix, counter_day, last_value) VALUES (?, ?, 1) " +
            "ON CONFLICT (prefix, counter_day) DO UPDATE SET last_value = document_counters.last_value + 1 " +
            "RETURNING last_value",
            Integer.class,
            prefix,
            day
        );
        if (value == null) {
            throw new IllegalStateException("Document counter returned no value for prefix " + prefix);
        }
        String number = prefix + DAY_FORMAT.format(day) + String.format("%04d", value);
        log.debug("Issued document number {}", number);
        return number;
    }
}
