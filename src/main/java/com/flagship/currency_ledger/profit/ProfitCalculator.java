package com.flagship.currency_ledger.profit;

import com.flagship.currency_ledger.common.Amounts;
import com.flagship.currency_ledger.common.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Line profit arithmetic.
 *
 * {@code lineProfit} is always exactly {@code lineTotal - lineCost}; the margin is a
 * percentage of the line total and is zero for a zero total.
 */
@Component
public class ProfitCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public LineProfit computeLineProfit(LineItem item) {
        if (item == null) {
            throw new ValidationException("Line item is required");
        }
        if (!Amounts.isPositive(item.getQuantity())) {
            throw new ValidationException("Quantity must be greater than 0, got " + item.getQuantity());
        }
        requireNonNegative("Unit price", item.getUnitPrice());
        requireNonNegative("Cost price", item.getCostPrice());

        BigDecimal lineTotal = Amounts.amount(item.getQuantity().multiply(item.getUnitPrice()));
        BigDecimal lineCost = Amounts.amount(item.getQuantity().multiply(item.getCostPrice()));
        BigDecimal lineProfit = lineTotal.subtract(lineCost);
        return new LineProfit(lineTotal, lineCost, lineProfit, marginPct(lineProfit, lineTotal));
    }

    /**
     * {@code profit / revenue * 100} at amount scale, or zero when revenue is zero.
     */
    public static BigDecimal marginPct(BigDecimal profit, BigDecimal revenue) {
        if (revenue == null || revenue.signum() == 0) {
            return Amounts.amount(BigDecimal.ZERO);
        }
        return profit.multiply(HUNDRED).divide(revenue, Amounts.AMOUNT_SCALE, Amounts.ROUNDING);
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        if (value.signum() < 0) {
            throw new ValidationException(field + " cannot be negative, got " + value);
        }
    }
}
