package com.flagship.currency_ledger.rate;

import com.flagship.currency_ledger.common.Amounts;
import com.flagship.currency_ledger.common.exception.RateUnavailableException;
import com.flagship.currency_ledger.common.exception.ValidationException;
import com.flagship.currency_ledger.config.LedgerProperties;
import com.flagship.currency_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Single source of truth for exchange rates and currency conversion.
 *
 * Rates are stored per currency against the base currency. A cross rate between
 * two non-base currencies goes through base: {@code buying(from) / buying(to)}.
 * A missing leg is always reported as {@link RateUnavailableException}; no lookup
 * in this class ever substitutes 1 for an unknown rate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangeRateService {

    private final ExchangeRateRepository repository;
    private final LedgerProperties properties;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public String baseCurrency() {
        return properties.getBaseCurrency();
    }

    public boolean isBaseCurrency(String currency) {
        return properties.getBaseCurrency().equalsIgnoreCase(currency);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    @Transactional(readOnly = true)
    public Optional<ExchangeRate> getRate(String currency, LocalDate date) {
        return repository.findByCurrencyAndDate(Amounts.normalizeCurrency(currency), date);
    }

    /**
     * Most recent quote dated today or earlier.
     */
    @Transactional(readOnly = true)
    public Optional<ExchangeRate> getLatestRate(String currency) {
        return repository.findLatestOnOrBefore(Amounts.normalizeCurrency(currency), today());
    }

    /**
     * Quote on {@code date}, else the newest quote before it.
     */
    @Transactional(readOnly = true)
    public Optional<ExchangeRate> getRateOnOrBefore(String currency, LocalDate date) {
        return repository.findLatestOnOrBefore(Amounts.normalizeCurrency(currency), date);
    }

    @Transactional(readOnly = true)
    public List<ExchangeRate> listRates(String currency, LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("Range start " + from + " is after range end " + to);
        }
        LocalDate end = to != null ? to : today();
        LocalDate start = from != null ? from : end.minusDays(30);
        return repository.findInRange(Amounts.normalizeCurrency(currency), start, end);
    }

    /**
     * Units of {@code to} obtained for 1 unit of {@code from}.
     *
     * @param date exact rate date for both legs, or null to use each leg's latest rate
     * @throws RateUnavailableException when either leg has no rate
     */
    @Transactional(readOnly = true)
    public BigDecimal crossRate(String from, String to, LocalDate date) {
        return cross(from, to, currency -> buyingLeg(currency, date));
    }

    /**
     * Like {@link #crossRate} for a business date: each leg uses its quote on
     * {@code date}, else the newest quote before it.
     *
     * @throws RateUnavailableException when either leg has no quote on or before {@code date}
     */
    @Transactional(readOnly = true)
    public BigDecimal crossRateAsOf(String from, String to, LocalDate date) {
        return cross(from, to, currency -> repository.findLatestOnOrBefore(currency, date)
                .map(ExchangeRate::getBuyingRate)
                .orElseThrow(() -> {
                    metrics.recordRateMiss(currency);
                    return new RateUnavailableException(currency, date);
                }));
    }

    /**
     * Converts {@code amount} between currencies with {@link #crossRate}, rounded to the amount scale.
     */
    @Transactional(readOnly = true)
    public BigDecimal convert(BigDecimal amount, String from, String to, LocalDate date) {
        return Amounts.amount(amount.multiply(crossRate(from, to, date)));
    }

    /**
     * Records a daily quote; a second call for the same (currency, date) overwrites it.
     */
    @Transactional
    public ExchangeRate recordRate(String currency, LocalDate date, BigDecimal buyingRate,
                                   BigDecimal sellingRate, String source) {
        String code = Amounts.normalizeCurrency(currency);
        if (code == null || code.isBlank()) {
            throw new ValidationException("Currency is required");
        }
        if (date == null) {
            throw new ValidationException("Rate date is required");
        }
        if (isBaseCurrency(code)) {
            throw new ValidationException("Rates are quoted against " + code + "; it cannot be recorded itself");
        }
        if (!Amounts.isPositive(buyingRate) || !Amounts.isPositive(sellingRate)) {
            throw new ValidationException("Exchange rates must be positive: buying=" + buyingRate
                    + ", selling=" + sellingRate);
        }

        ExchangeRate saved = repository.upsert(code, date, Amounts.rate(buyingRate),
                Amounts.rate(sellingRate), source != null ? source : "manual");
        metrics.recordRateRecorded(code, saved.getSource());
        log.info("Recorded exchange rate: currency={}, date={}, buying={}, selling={}, source={}",
                code, date, saved.getBuyingRate(), saved.getSellingRate(), saved.getSource());
        return saved;
    }

    private BigDecimal cross(String from, String to, Function<String, BigDecimal> buyingLeg) {
        String fromCurrency = Amounts.normalizeCurrency(from);
        String toCurrency = Amounts.normalizeCurrency(to);

        if (fromCurrency.equals(toCurrency)) {
            return BigDecimal.ONE;
        }
        if (isBaseCurrency(fromCurrency)) {
            return BigDecimal.ONE.divide(buyingLeg.apply(toCurrency), Amounts.DIVISION_SCALE, Amounts.ROUNDING);
        }
        if (isBaseCurrency(toCurrency)) {
            return buyingLeg.apply(fromCurrency);
        }
        return buyingLeg.apply(fromCurrency)
                .divide(buyingLeg.apply(toCurrency), Amounts.DIVISION_SCALE, Amounts.ROUNDING);
    }

    private BigDecimal buyingLeg(String currency, LocalDate date) {
        Optional<ExchangeRate> rate = date != null
                ? repository.findByCurrencyAndDate(currency, date)
                : repository.findLatestOnOrBefore(currency, today());
        return rate.map(ExchangeRate::getBuyingRate)
                .orElseThrow(() -> {
                    metrics.recordRateMiss(currency);
                    return new RateUnavailableException(currency, date);
                });
    }
}
