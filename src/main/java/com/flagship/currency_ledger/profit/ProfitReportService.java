package com.flagship.currency_ledger.profit;

import com.flagship.currency_ledger.account.AccountRepository;
import com.flagship.currency_ledger.common.Amounts;
import com.flagship.currency_ledger.common.exception.NotFoundException;
import com.flagship.currency_ledger.common.exception.ValidationException;
import com.flagship.currency_ledger.config.LedgerProperties;
import com.flagship.currency_ledger.payment.PaymentChannel;
import com.flagship.currency_ledger.payment.PaymentRepository;
import com.flagship.currency_ledger.payment.PaymentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Read-only reports over persisted transactions, payments and account balances.
 * Periods are inclusive calendar days in the ledger zone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfitReportService {

    private final TradeTransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final PaymentRepository paymentRepository;
    private final ProfitLossAggregator aggregator;
    private final CurrencyNormalizer normalizer;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Profit of SALE lines dated in {@code [from, to]}. Defaults to the current month up to today.
     */
    @Transactional(readOnly = true)
    public ProfitLossSummary profitLoss(LocalDate from, LocalDate to, GroupBy groupBy, UUID companyId,
                                       String currency, String reportingCurrency) {
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.withDayOfMonth(1);
        requireOrdered(start, end);

        Instant startInstant = startOf(start);
        Instant endInstant = startOf(end.plusDays(1));
        List<TransactionItemEntity> items = companyId != null
                ? transactionRepository.findLinesForCompany(TradeTransactionType.SALE, companyId, startInstant, endInstant)
                : transactionRepository.findLines(TradeTransactionType.SALE, startInstant, endInstant);

        List<ProfitLine> lines = items.stream().map(this::toProfitLine).toList();
        ProfitLossSummary summary = aggregator.profitLoss(lines, groupBy != null ? groupBy : GroupBy.PRODUCT,
                currency, reportingOrDefault(reportingCurrency), normalizer);

        log.debug("Profit/loss report: from={}, to={}, lines={}, groups={}, complete={}",
                start, end, lines.size(), summary.getGroups().size(), summary.getTotal().isComplete());
        return summary;
    }

    /**
     * Balances per currency, payment flows in {@code [from, to]}, and each balance in the
     * reporting currency at the rate of {@code to} (or the latest rate).
     */
    @Transactional(readOnly = true)
    public CurrencySummary currencySummary(LocalDate from, LocalDate to, String reportingCurrency) {
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.withDayOfMonth(1);
        requireOrdered(start, end);
        String reporting = reportingOrDefault(reportingCurrency);

        Map<String, BigDecimal[]> flows = new TreeMap<>();
        for (Object[] row : paymentRepository.sumByCurrencyAndType(startOf(start), startOf(end.plusDays(1)))) {
            String currency = (String) row[0];
            PaymentType type = (PaymentType) row[1];
            BigDecimal sum = (BigDecimal) row[2];
            BigDecimal[] totals = flows.computeIfAbsent(currency, c -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
            int slot = type.getDirection() == PaymentType.Direction.INCOMING ? 0 : 1;
            totals[slot] = totals[slot].add(sum);
        }

        Map<String, Object[]> balances = new TreeMap<>();
        for (Object[] row : accountRepository.sumBalancesByCurrency()) {
            balances.put((String) row[0], row);
        }

        List<CurrencySummary.Line> lines = new ArrayList<>();
        BigDecimal normalizedTotal = BigDecimal.ZERO;
        boolean complete = true;
        Set<String> currencies = new TreeSet<>(balances.keySet());
        currencies.addAll(flows.keySet());

        for (String currency : currencies) {
            Object[] balanceRow = balances.get(currency);
            BigDecimal balance = balanceRow != null ? (BigDecimal) balanceRow[1] : BigDecimal.ZERO;
            long accountCount = balanceRow != null ? ((Number) balanceRow[2]).longValue() : 0L;
            BigDecimal[] flow = flows.getOrDefault(currency, new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});

            NormalizedAmount normalized = normalizer.normalizeToReportingCurrency(balance, currency, end, reporting);
            if (normalized.isAvailable()) {
                normalizedTotal = normalizedTotal.add(normalized.getAmount());
            } else {
                complete = false;
            }
            lines.add(new CurrencySummary.Line(currency, accountCount, balance, flow[0], flow[1],
                    flow[0].subtract(flow[1]), normalized));
        }

        return new CurrencySummary(start, end, reporting, lines, Amounts.amount(normalizedTotal), complete);
    }

    /**
     * Payment count and volume per (channel, type, currency) in {@code [from, to]}.
     */
    @Transactional(readOnly = true)
    public PaymentChannelSummary paymentChannelAnalysis(LocalDate from, LocalDate to) {
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.withDayOfMonth(1);
        requireOrdered(start, end);

        List<PaymentChannelSummary.Line> lines = new ArrayList<>();
        for (Object[] row : paymentRepository.sumByChannelAndType(startOf(start), startOf(end.plusDays(1)))) {
            lines.add(new PaymentChannelSummary.Line(
                    (PaymentChannel) row[0],
                    (PaymentType) row[1],
                    (String) row[2],
                    ((Number) row[3]).longValue(),
                    Amounts.amount((BigDecimal) row[4]),
                    Amounts.amount((BigDecimal) row[5])));
        }
        return new PaymentChannelSummary(start, end, lines);
    }

    /**
     * Daily payment flows per type, channel and currency in {@code [from, to]},
     * optionally limited to one account.
     */
    @Transactional(readOnly = true)
    public CashFlowReport cashFlow(LocalDate from, LocalDate to, UUID accountId) {
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.withDayOfMonth(1);
        requireOrdered(start, end);
        if (accountId != null && !accountRepository.existsById(accountId)) {
            throw NotFoundException.of("Account", accountId);
        }

        String zone = properties.getZone().getId();
        List<Object[]> rows = accountId != null
                ? paymentRepository.dailyFlowsForAccount(zone, accountId, startOf(start), startOf(end.plusDays(1)))
                : paymentRepository.dailyFlows(zone, startOf(start), startOf(end.plusDays(1)));

        List<CashFlowReport.Line> lines = new ArrayList<>();
        for (Object[] row : rows) {
            lines.add(new CashFlowReport.Line(
                    toLocalDate(row[0]),
                    PaymentType.fromCode((String) row[1]),
                    PaymentChannel.fromCode((String) row[2]),
                    (String) row[3],
                    ((Number) row[4]).longValue(),
                    Amounts.amount((BigDecimal) row[5])));
        }
        return new CashFlowReport(start, end, accountId, lines);
    }

    private static LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        throw new IllegalStateException("Unexpected day value from cash flow query: " + value);
    }

    private ProfitLine toProfitLine(TransactionItemEntity item) {
        TradeTransactionEntity transaction = item.getTransaction();
        return ProfitLine.builder()
                .transactionId(transaction.getId())
                .transactionNo(transaction.getTransactionNo())
                .transactionDate(LocalDate.ofInstant(transaction.getTransactionDate(), properties.getZone()))
                .companyId(transaction.getCompanyId())
                .contactId(transaction.getContactId())
                .productId(item.getProductId())
                .currency(transaction.getCurrency())
                .quantity(item.getQuantity())
                .lineTotal(item.getLineTotal())
                .lineCost(item.getLineCost())
                .lineProfit(item.getLineProfit())
                .build();
    }

    private String reportingOrDefault(String reportingCurrency) {
        return reportingCurrency != null && !reportingCurrency.isBlank()
                ? Amounts.normalizeCurrency(reportingCurrency)
                : properties.getReportingCurrency();
    }

    private Instant startOf(LocalDate day) {
        return day.atStartOfDay(properties.getZone()).toInstant();
    }

    private static void requireOrdered(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new ValidationException("Period start " + from + " is after its end " + to);
        }
    }
}
