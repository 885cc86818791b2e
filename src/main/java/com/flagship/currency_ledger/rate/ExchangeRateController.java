package com.flagship.currency_ledger.rate;

import com.flagship.currency_ledger.common.Amounts;
import com.flagship.currency_ledger.rate.dto.CrossRateResponse;
import com.flagship.currency_ledger.rate.dto.ExchangeRateResponse;
import com.flagship.currency_ledger.rate.dto.RecordRateRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/exchange-rates")
@RequiredArgsConstructor
public class ExchangeRateController {

    private final ExchangeRateService rateService;

    @GetMapping
    public List<ExchangeRateResponse> listRates(
            @RequestParam("currency") String currency,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return rateService.listRates(currency, from, to).stream()
            .map(ExchangeRateResponse::from)
            .toList();
    }

    @GetMapping("/cross")
    public CrossRateResponse crossRate(
            @RequestParam("from") String from,
            @RequestParam("to") String to,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return new CrossRateResponse(Amounts.normalizeCurrency(from), Amounts.normalizeCurrency(to), date,
                rateService.crossRate(from, to, date));
    }

    @GetMapping("/{currency}/latest")
    public ResponseEntity<ExchangeRateResponse> getLatestRate(@PathVariable("currency") String currency) {
        return rateService.getLatestRate(currency)
            .map(rate -> ResponseEntity.ok(ExchangeRateResponse.from(rate)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{currency}/{date}")
    public ResponseEntity<ExchangeRateResponse> getRate(
            @PathVariable("currency") String currency,
            @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return rateService.getRate(currency, date)
            .map(rate -> ResponseEntity.ok(ExchangeRateResponse.from(rate)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{currency}/{date}")
    public ExchangeRateResponse recordRate(
            @PathVariable("currency") String currency,
            @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @Valid @RequestBody RecordRateRequest request) {
        ExchangeRate saved = rateService.recordRate(currency, date,
                request.getBuyingRate(), request.getSellingRate(), request.getSource());
        return ExchangeRateResponse.from(saved);
    }
}
