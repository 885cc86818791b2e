package com.flagship.currency_ledger.profit;

import com.flagship.currency_ledger.common.Amounts;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups persisted profit lines and sums them per original currency and in a
 * reporting currency. Works only on the stored line values; prices are never
 * recomputed.
 *
 * Each line is converted with a single rate taken from its revenue, and its normalized
 * profit is the normalized revenue minus the normalized cost, so the normalized block
 * keeps {@code profit = revenue - cost}.
 */
@Component
public class ProfitLossAggregator {

    public ProfitLossSummary profitLoss(List<ProfitLine> lines, GroupBy groupBy, String currencyFilter,
                                        String reportingCurrency, AmountNormalizer normalizer) {
        String filter = Amounts.normalizeCurrency(currencyFilter);
        String reporting = Amounts.normalizeCurrency(reportingCurrency);

        Map<String, GroupAccumulator> groups = new TreeMap<>();
        NormalizedAccumulator total = new NormalizedAccumulator(reporting);

        for (ProfitLine line : lines) {
            if (filter != null && !filter.equals(line.getCurrency())) {
                continue;
            }
            NormalizedAmount normalizedRevenue = normalizer.normalize(
                    line.getLineTotal(), line.getCurrency(), line.getTransactionDate(), reporting);

            GroupAccumulator group = groups.computeIfAbsent(groupBy.keyOf(line),
                    key -> new GroupAccumulator(key, reporting));
            group.add(line, normalizedRevenue);
            total.add(line, normalizedRevenue);
        }

        List<ProfitLossSummary.Group> result = new ArrayList<>();
        groups.values().forEach(group -> result.add(group.toGroup()));
        return new ProfitLossSummary(groupBy, reporting, result, total.toTotals());
    }

    private static final class GroupAccumulator {
        private final String key;
        private final Map<String, CurrencyAccumulator> byCurrency = new TreeMap<>();
        private final NormalizedAccumulator normalized;
        private int lineCount;

        GroupAccumulator(String key, String reportingCurrency) {
            this.key = key;
            this.normalized = new NormalizedAccumulator(reportingCurrency);
        }

        void add(ProfitLine line, NormalizedAmount normalizedRevenue) {
            lineCount++;
            byCurrency.computeIfAbsent(line.getCurrency(), CurrencyAccumulator::new).add(line);
            normalized.add(line, normalizedRevenue);
        }

        ProfitLossSummary.Group toGroup() {
            return new ProfitLossSummary.Group(key, lineCount,
                    byCurrency.values().stream().map(CurrencyAccumulator::toTotals).toList(),
                    normalized.toTotals());
        }
    }

    private static final class CurrencyAccumulator {
        private final String currency;
        private BigDecimal quantity = BigDecimal.ZERO;
        private BigDecimal revenue = BigDecimal.ZERO;
        private BigDecimal cost = BigDecimal.ZERO;
        private BigDecimal profit = BigDecimal.ZERO;

        CurrencyAccumulator(String currency) {
            this.currency = currency;
        }

        void add(ProfitLine line) {
            quantity = quantity.add(line.getQuantity());
            revenue = revenue.add(line.getLineTotal());
            cost = cost.add(line.getLineCost());
            profit = profit.add(line.getLineProfit());
        }

        ProfitLossSummary.CurrencyTotals toTotals() {
            return new ProfitLossSummary.CurrencyTotals(currency, quantity, revenue, cost, profit,
                    ProfitCalculator.marginPct(profit, revenue));
        }
    }

    private static final class NormalizedAccumulator {
        private final String currency;
        private BigDecimal revenue = BigDecimal.ZERO;
        private BigDecimal cost = BigDecimal.ZERO;
        private int unavailable;

        NormalizedAccumulator(String currency) {
            this.currency = currency;
        }

        void add(ProfitLine line, NormalizedAmount normalizedRevenue) {
            if (!normalizedRevenue.isAvailable()) {
                unavailable++;
                return;
            }
            revenue = revenue.add(normalizedRevenue.getAmount());
            cost = cost.add(Amounts.amount(line.getLineCost().multiply(normalizedRevenue.getRate())));
        }

        ProfitLossSummary.NormalizedTotals toTotals() {
            BigDecimal profit = revenue.subtract(cost);
            return new ProfitLossSummary.NormalizedTotals(currency, revenue, cost, profit,
                    ProfitCalculator.marginPct(profit, revenue), unavailable == 0, unavailable);
        }
    }
}
