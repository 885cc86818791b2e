package com.flagship.currency_ledger.profit;

import com.flagship.currency_ledger.common.Amounts;
import com.flagship.currency_ledger.common.exception.RateUnavailableException;
import com.flagship.currency_ledger.rate.ExchangeRateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Report-side conversion to a common currency.
 *
 * Tries the rates of the amount's own date first, then the latest known rates.
 * When neither resolves, the result is marked unavailable so totals can be flagged
 * incomplete.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CurrencyNormalizer implements AmountNormalizer {

    private final ExchangeRateService rateService;

    @Override
    public NormalizedAmount normalize(BigDecimal amount, String currency, LocalDate date, String reportingCurrency) {
        return normalizeToReportingCurrency(amount, currency, date, reportingCurrency);
    }

    public NormalizedAmount normalizeToReportingCurrency(BigDecimal amount, String currency, LocalDate date,
                                                         String reportingCurrency) {
        String from = Amounts.normalizeCurrency(currency);
        String to = Amounts.normalizeCurrency(reportingCurrency);

        BigDecimal rate = null;
        if (date != null) {
            try {
                rate = rateService.crossRate(from, to, date);
            } catch (RateUnavailableException e) {
                log.debug("No {}->{} rate on {}, falling back to latest: {}", from, to, date, e.getMessage());
            }
        }
        if (rate == null) {
            try {
                rate = rateService.crossRate(from, to, null);
            } catch (RateUnavailableException e) {
                log.warn("Cannot normalize {} {} to {}: {}", amount, from, to, e.getMessage());
                return NormalizedAmount.unavailable(amount, from, to);
            }
        }
        return NormalizedAmount.available(amount, from, to, Amounts.amount(amount.multiply(rate)), rate);
    }
}
