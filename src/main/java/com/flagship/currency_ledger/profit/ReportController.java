package com.flagship.currency_ledger.profit;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ProfitReportService reportService;

    @GetMapping("/profit-loss")
    public ProfitLossSummary profitLoss(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "group_by", defaultValue = "product") String groupBy,
            @RequestParam(value = "company_id", required = false) UUID companyId,
            @RequestParam(value = "currency", required = false) String currency,
            @RequestParam(value = "reporting_currency", required = false) String reportingCurrency) {
        return reportService.profitLoss(from, to, GroupBy.fromCode(groupBy), companyId, currency, reportingCurrency);
    }

    @GetMapping("/currency-summary")
    public CurrencySummary currencySummary(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "reporting_currency", required = false) String reportingCurrency) {
        return reportService.currencySummary(from, to, reportingCurrency);
    }

    @GetMapping("/payment-channels")
    public PaymentChannelSummary paymentChannels(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportService.paymentChannelAnalysis(from, to);
    }

    @GetMapping("/cash-flow")
    public CashFlowReport cashFlow(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "account_id", required = false) UUID accountId) {
        return reportService.cashFlow(from, to, accountId);
    }
}
