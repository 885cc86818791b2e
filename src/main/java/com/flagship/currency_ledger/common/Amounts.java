package com.flagship.currency_ledger.common;

import com.flagship.currency_ledger.common.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Scales shared by every stored amount and rate.
 */
public final class Amounts {

    /** NUMERIC(18,4) columns. */
    public static final int AMOUNT_SCALE = 4;

    /** NUMERIC(18,8) columns. */
    public static final int RATE_SCALE = 8;

    /** Intermediate precision for rate divisions. */
    public static final int DIVISION_SCALE = 10;

    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    private Amounts() {
    }

    public static BigDecimal amount(BigDecimal value) {
        return value.setScale(AMOUNT_SCALE, ROUNDING);
    }

    public static BigDecimal rate(BigDecimal value) {
        return value.setScale(RATE_SCALE, ROUNDING);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /**
     * Returns {@code value} at the amount scale, rejecting anything that is not
     * positive or carries more decimal places than a stored amount can hold.
     */
    public static BigDecimal requirePositiveAmount(BigDecimal value, String label) {
        if (!isPositive(value)) {
            throw new ValidationException(label + " must be greater than 0, got " + value);
        }
        if (value.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new ValidationException(label + " has more than " + AMOUNT_SCALE
                    + " decimal places: " + value.toPlainString());
        }
        return amount(value);
    }

    public static String normalizeCurrency(String currency) {
        return currency == null ? null : currency.trim().toUpperCase(Locale.ROOT);
    }
}
